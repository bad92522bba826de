package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Boolean expression over predictor fields' values under which a field is
 * absent from the form. A condition that evaluates to true means HIDDEN.
 *
 * <p>{@link Confidence#PROVEN} is only ever attached to an {@code AND}
 * condition that passed both the hidden-route and visible-route checks.
 * Every {@code OR} condition is {@link Confidence#BEST_EFFORT}: it describes
 * the observed evidence but is not proven exhaustive.
 */
public final class HidingCondition {

    public enum Operator { AND, OR }

    public enum Confidence { PROVEN, BEST_EFFORT }

    private final Operator operator;
    private final List<ConditionClause> conditions;
    private final Confidence confidence;

    @JsonCreator
    public HidingCondition(@JsonProperty("operator")   Operator operator,
                           @JsonProperty("conditions") List<ConditionClause> conditions,
                           @JsonProperty("confidence") Confidence confidence) {
        this.operator   = Objects.requireNonNull(operator, "operator");
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.confidence = confidence != null ? confidence : Confidence.BEST_EFFORT;
    }

    public static HidingCondition and(List<ConditionClause> clauses) {
        return new HidingCondition(Operator.AND, clauses, Confidence.PROVEN);
    }

    public static HidingCondition or(List<ConditionClause> clauses) {
        return new HidingCondition(Operator.OR, clauses, Confidence.BEST_EFFORT);
    }

    @JsonProperty("operator")   public Operator              getOperator()   { return operator; }
    @JsonProperty("conditions") public List<ConditionClause> getConditions() { return conditions; }
    @JsonProperty("confidence") public Confidence            getConfidence() { return confidence; }

    @JsonIgnore
    public boolean isProven() {
        return confidence == Confidence.PROVEN;
    }

    /**
     * Evaluates the condition against a field-value map.
     * An {@code OR} with no clauses never matches.
     *
     * @return true when the values describe a state in which the field is hidden
     */
    public boolean isSatisfiedBy(Map<String, String> values) {
        if (conditions.isEmpty()) return false;
        if (operator == Operator.AND) {
            return conditions.stream().allMatch(c -> c.matches(values.get(c.predictorFieldId())));
        }
        return conditions.stream().anyMatch(c -> c.matches(values.get(c.predictorFieldId())));
    }

    /** Predictor field ids in clause order. */
    @JsonIgnore
    public List<String> predictorFieldIds() {
        return conditions.stream().map(ConditionClause::predictorFieldId).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HidingCondition other)) return false;
        return operator == other.operator
                && conditions.equals(other.conditions)
                && confidence == other.confidence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, conditions, confidence);
    }

    @Override
    public String toString() {
        String body = conditions.stream().map(ConditionClause::toString)
                .collect(Collectors.joining(" " + operator + " "));
        return String.format("%s{%s}%s", operator, body, isProven() ? "" : " [best-effort]");
    }
}
