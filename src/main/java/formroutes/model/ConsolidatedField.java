package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The single canonical descriptor of a field after every route has been
 * cross-referenced: a representative observation, the distinct values seen,
 * and the inferred hiding condition ({@code null} when always visible).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ConsolidatedField {

    private final String fieldId;
    private final String name;
    private final FieldObservation representative;
    private final List<String> options;
    private final HidingCondition hidingCondition;
    private final int columnScore;

    @JsonCreator
    public ConsolidatedField(@JsonProperty("fieldId")         String fieldId,
                             @JsonProperty("name")            String name,
                             @JsonProperty("representative")  FieldObservation representative,
                             @JsonProperty("options")         List<String> options,
                             @JsonProperty("hidingCondition") HidingCondition hidingCondition,
                             @JsonProperty("columnScore")     int columnScore) {
        this.fieldId         = Objects.requireNonNull(fieldId, "fieldId");
        this.name            = name;
        this.representative  = Objects.requireNonNull(representative, "representative");
        this.options         = options != null ? List.copyOf(options) : List.of();
        this.hidingCondition = hidingCondition;
        this.columnScore     = columnScore;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    @JsonProperty("fieldId")         public String           getFieldId()         { return fieldId; }
    @JsonProperty("name")            public String           getName()            { return name; }
    @JsonProperty("representative")  public FieldObservation getRepresentative()  { return representative; }
    @JsonProperty("options")         public List<String>     getOptions()         { return options; }
    @JsonProperty("hidingCondition") public HidingCondition  getHidingCondition() { return hidingCondition; }
    @JsonProperty("columnScore")     public int              getColumnScore()     { return columnScore; }

    @JsonIgnore public boolean isAlwaysVisible() { return hidingCondition == null; }
    @JsonIgnore public FieldType getFieldType()  { return representative.getFieldType(); }

    /**
     * Renders the verification rule downstream checkers apply to this field:
     * verify the created value, except where the hiding condition holds, in
     * which case the field is expected to be absent.
     */
    public Map<String, Object> verificationAssignment() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (hidingCondition == null || hidingCondition.getConditions().isEmpty()) {
            out.put("type", "assign_same_value_as_in_assign_for_create");
            return out;
        }
        out.put("type", "assign_with_conditions");
        String key = hidingCondition.getOperator().name().toLowerCase(Locale.ROOT) + " condition";
        out.put(key, hidingCondition.getConditions());
        out.put("condition_value_type", "None");
        out.put("else_condition_value_type", "assign_same_value_as_in_assign_for_create");
        return out;
    }

    @Override
    public String toString() {
        return String.format("ConsolidatedField{%s, type=%s, hidden=%s}",
                fieldId, getFieldType(), hidingCondition == null ? "never" : hidingCondition);
    }
}
