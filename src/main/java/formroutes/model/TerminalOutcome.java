package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of trying the form's save/submit control at the end of a route.
 * A failed save does not invalidate the route: the fields that were visible
 * are still known.
 */
public final class TerminalOutcome {

    private static final TerminalOutcome NOT_ATTEMPTED = new TerminalOutcome(false, false, List.of());

    private final boolean attempted;
    private final boolean success;
    private final List<String> errors;

    @JsonCreator
    public TerminalOutcome(@JsonProperty("attempted") boolean attempted,
                           @JsonProperty("success")   boolean success,
                           @JsonProperty("errors")    List<String> errors) {
        this.attempted = attempted;
        this.success   = success;
        this.errors    = errors != null ? List.copyOf(errors) : List.of();
    }

    public static TerminalOutcome succeeded() {
        return new TerminalOutcome(true, true, List.of());
    }

    public static TerminalOutcome failed(List<String> errors) {
        return new TerminalOutcome(true, false, errors);
    }

    /** No save control was found or clicking it failed outright. */
    public static TerminalOutcome notAttempted() {
        return NOT_ATTEMPTED;
    }

    @JsonProperty("attempted") public boolean      isAttempted() { return attempted; }
    @JsonProperty("success")   public boolean      isSuccess()   { return success; }
    @JsonProperty("errors")    public List<String> getErrors()   { return errors; }

    @Override
    public String toString() {
        if (!attempted) return "TerminalOutcome{not attempted}";
        return success ? "TerminalOutcome{saved}" : "TerminalOutcome{failed " + errors + "}";
    }
}
