package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A pure interaction recorded in a route (hover to reveal a menu, switch into
 * a frame, wait for an animation). Has no field and no value.
 */
public final class InteractionStage implements Stage {

    private final String label;
    private final List<PrimitiveAction> actions;

    @JsonCreator
    public InteractionStage(@JsonProperty("label")   String label,
                            @JsonProperty("actions") List<PrimitiveAction> actions) {
        this.label   = Objects.requireNonNull(label, "label");
        this.actions = actions != null ? List.copyOf(actions) : List.of();
    }

    @Override
    public Kind kind() {
        return Kind.INTERACTION;
    }

    @JsonProperty("label")   public String                getLabel()   { return label; }
    @JsonProperty("actions") public List<PrimitiveAction> getActions() { return actions; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InteractionStage other)) return false;
        return label.equals(other.label) && actions.equals(other.actions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, actions);
    }

    @Override
    public String toString() {
        return "InteractionStage{" + label + "}";
    }
}
