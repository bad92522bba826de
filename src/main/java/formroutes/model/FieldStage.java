package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A stage that observed (and set) one field. When {@link #getBranch()} is
 * non-null the stage is the queued alternative that opened this route's
 * sub-tree, and its value counts as a precondition for everything after it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FieldStage implements Stage {

    private final FieldObservation observation;
    private final BranchAction branch;

    @JsonCreator
    public FieldStage(@JsonProperty("observation") FieldObservation observation,
                      @JsonProperty("branch")      BranchAction branch) {
        this.observation = Objects.requireNonNull(observation, "observation");
        this.branch      = branch;
    }

    public static FieldStage committed(FieldObservation observation) {
        return new FieldStage(observation, null);
    }

    @Override
    public Kind kind() {
        return Kind.FIELD;
    }

    @Override
    public FieldObservation observationOrNull() {
        return observation;
    }

    @JsonProperty("observation") public FieldObservation getObservation() { return observation; }
    @JsonProperty("branch")      public BranchAction     getBranch()      { return branch; }

    @JsonIgnore public boolean fromBranch() { return branch != null; }
    @JsonIgnore public String  getFieldId() { return observation.getFieldId(); }
    @JsonIgnore public String  getValue()   { return observation.getValue(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldStage other)) return false;
        return observation.equals(other.observation) && Objects.equals(branch, other.branch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(observation, branch);
    }

    @Override
    public String toString() {
        return (branch != null ? "Branch" : "Field") + "Stage{" + getFieldId() + "=" + getValue() + "}";
    }
}
