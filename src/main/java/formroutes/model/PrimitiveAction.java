package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single replayable interaction against the page: a click, a select by
 * visible text, a typed value, a checkbox toggle, or one of the pure
 * interactions (hover, frame switch, wait) that make a field reachable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PrimitiveAction {

    public enum Kind {
        CLICK, SELECT_BY_TEXT, SET_VALUE, TOGGLE,
        HOVER, SWITCH_FRAME, WAIT
    }

    private final Kind kind;

    /** Selector hint of the target element, e.g. {@code #country} or {@code [name='plan']}. */
    private final String locatorHint;

    /** Option text or typed text; wait duration in ms for {@code WAIT}. Null for clicks. */
    private final String value;

    @JsonCreator
    public PrimitiveAction(@JsonProperty("kind") Kind kind,
                           @JsonProperty("locatorHint") String locatorHint,
                           @JsonProperty("value") String value) {
        this.kind        = Objects.requireNonNull(kind, "kind");
        this.locatorHint = locatorHint;
        this.value       = value;
    }

    public static PrimitiveAction click(String locatorHint) {
        return new PrimitiveAction(Kind.CLICK, locatorHint, null);
    }

    public static PrimitiveAction selectByText(String locatorHint, String optionText) {
        return new PrimitiveAction(Kind.SELECT_BY_TEXT, locatorHint, optionText);
    }

    public static PrimitiveAction setValue(String locatorHint, String text) {
        return new PrimitiveAction(Kind.SET_VALUE, locatorHint, text);
    }

    public static PrimitiveAction toggle(String locatorHint) {
        return new PrimitiveAction(Kind.TOGGLE, locatorHint, null);
    }

    @JsonProperty("kind")        public Kind   getKind()        { return kind; }
    @JsonProperty("locatorHint") public String getLocatorHint() { return locatorHint; }
    @JsonProperty("value")       public String getValue()       { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveAction other)) return false;
        return kind == other.kind
                && Objects.equals(locatorHint, other.locatorHint)
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, locatorHint, value);
    }

    @Override
    public String toString() {
        return value == null
                ? String.format("%s(%s)", kind, locatorHint)
                : String.format("%s(%s, '%s')", kind, locatorHint, value);
    }
}
