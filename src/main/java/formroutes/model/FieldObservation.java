package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One field as it was seen and set during traversal: which control it was,
 * where to find it, the value the explorer gave it, and the branch choices
 * that were in effect at that moment.
 *
 * <p>Created once per interaction; immutable thereafter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FieldObservation {

    /** Stable identifier chosen by the page observer (id, name or generated). */
    private final String fieldId;

    private final String label;

    private final String locatorHint;

    private final FieldType fieldType;

    /** Value committed on this route: option text, radio value, "true"/"false", or typed text. */
    private final String value;

    private final List<Precondition> preconditions;

    @JsonCreator
    public FieldObservation(@JsonProperty("fieldId")       String fieldId,
                            @JsonProperty("label")         String label,
                            @JsonProperty("locatorHint")   String locatorHint,
                            @JsonProperty("fieldType")     FieldType fieldType,
                            @JsonProperty("value")         String value,
                            @JsonProperty("preconditions") List<Precondition> preconditions) {
        this.fieldId       = Objects.requireNonNull(fieldId, "fieldId");
        this.label         = label;
        this.locatorHint   = locatorHint;
        this.fieldType     = fieldType != null ? fieldType : FieldType.OTHER;
        this.value         = value;
        this.preconditions = preconditions != null ? List.copyOf(preconditions) : List.of();
    }

    // ── Getters ──────────────────────────────────────────────────────────

    @JsonProperty("fieldId")       public String             getFieldId()       { return fieldId; }
    @JsonProperty("label")         public String             getLabel()         { return label; }
    @JsonProperty("locatorHint")   public String             getLocatorHint()   { return locatorHint; }
    @JsonProperty("fieldType")     public FieldType          getFieldType()     { return fieldType; }
    @JsonProperty("value")         public String             getValue()         { return value; }
    @JsonProperty("preconditions") public List<Precondition> getPreconditions() { return preconditions; }

    /** Label when present, otherwise the field id. */
    public String displayName() {
        return label != null && !label.isBlank() ? label : fieldId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldObservation other)) return false;
        return fieldId.equals(other.fieldId)
                && Objects.equals(label, other.label)
                && Objects.equals(locatorHint, other.locatorHint)
                && fieldType == other.fieldType
                && Objects.equals(value, other.value)
                && preconditions.equals(other.preconditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldId, label, locatorHint, fieldType, value, preconditions);
    }

    @Override
    public String toString() {
        return String.format("FieldObservation{%s=%s, type=%s}", fieldId, value, fieldType);
    }
}
