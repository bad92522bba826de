package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One complete path through a form, from its base state to the terminal
 * (save) action. Immutable once recorded.
 */
public final class Route {

    private final String routeId;
    private final String name;
    private final List<Stage> stages;
    private final List<Precondition> preconditions;
    private final TerminalOutcome outcome;

    @JsonCreator
    public Route(@JsonProperty("routeId")       String routeId,
                 @JsonProperty("name")          String name,
                 @JsonProperty("stages")        List<Stage> stages,
                 @JsonProperty("preconditions") List<Precondition> preconditions,
                 @JsonProperty("outcome")       TerminalOutcome outcome) {
        this.routeId       = Objects.requireNonNull(routeId, "routeId");
        this.name          = name != null ? name : routeId;
        this.stages        = stages != null ? List.copyOf(stages) : List.of();
        this.preconditions = preconditions != null ? List.copyOf(preconditions) : List.of();
        this.outcome       = outcome != null ? outcome : TerminalOutcome.notAttempted();
    }

    // ── Getters ──────────────────────────────────────────────────────────

    @JsonProperty("routeId")       public String             getRouteId()       { return routeId; }
    @JsonProperty("name")          public String             getName()          { return name; }
    @JsonProperty("stages")        public List<Stage>        getStages()        { return stages; }
    @JsonProperty("preconditions") public List<Precondition> getPreconditions() { return preconditions; }
    @JsonProperty("outcome")       public TerminalOutcome    getOutcome()       { return outcome; }

    // ── Convenience ──────────────────────────────────────────────────────

    /** Field observations of this route in stage order. */
    @JsonIgnore
    public List<FieldObservation> observations() {
        List<FieldObservation> out = new ArrayList<>();
        for (Stage s : stages) {
            FieldObservation o = s.observationOrNull();
            if (o != null) out.add(o);
        }
        return out;
    }

    /** Value set on each field of this route; a later stage overrides an earlier one. */
    @JsonIgnore
    public Map<String, String> stageValues() {
        Map<String, String> out = new LinkedHashMap<>();
        for (FieldObservation o : observations()) {
            if (o.getValue() != null && !o.getValue().isEmpty()) {
                out.put(o.getFieldId(), o.getValue());
            }
        }
        return out;
    }

    public boolean hasField(String fieldId) {
        for (FieldObservation o : observations()) {
            if (o.getFieldId().equals(fieldId)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("Route{id='%s', stages=%d, preconditions=%s, %s}",
                routeId, stages.size(), preconditions, outcome);
    }
}
