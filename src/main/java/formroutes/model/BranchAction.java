package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * An alternative choice not taken on the current route (the 2nd..nth option
 * of a dropdown, an untaken radio value, the opposite checkbox state),
 * queued for separate exploration. Replayed by performing {@link #getActions()}
 * in order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BranchAction {

    public enum Kind { SELECT, RADIO, CHECKBOX }

    private final Kind kind;
    private final String fieldId;
    private final String label;
    private final String locatorHint;
    private final FieldType fieldType;

    /** The value the field holds once the branch has been performed. */
    private final String value;

    private final List<PrimitiveAction> actions;

    /** Free-form note, e.g. "alternative select value UK". */
    private final String note;

    @JsonCreator
    public BranchAction(@JsonProperty("kind")        Kind kind,
                        @JsonProperty("fieldId")     String fieldId,
                        @JsonProperty("label")       String label,
                        @JsonProperty("locatorHint") String locatorHint,
                        @JsonProperty("fieldType")   FieldType fieldType,
                        @JsonProperty("value")       String value,
                        @JsonProperty("actions")     List<PrimitiveAction> actions,
                        @JsonProperty("note")        String note) {
        this.kind        = Objects.requireNonNull(kind, "kind");
        this.fieldId     = Objects.requireNonNull(fieldId, "fieldId");
        this.label       = label;
        this.locatorHint = locatorHint;
        this.fieldType   = fieldType;
        this.value       = value;
        this.actions     = actions != null ? List.copyOf(actions) : List.of();
        this.note        = note;
    }

    // ── Factories ────────────────────────────────────────────────────────

    /** Alternative option of a dropdown: click it open, then select by text. */
    public static BranchAction select(FieldDescriptor field, String option) {
        return new BranchAction(Kind.SELECT, field.getFieldId(), field.getLabel(), field.getLocatorHint(),
                field.getFieldType(), option,
                List.of(PrimitiveAction.click(field.getLocatorHint()),
                        PrimitiveAction.selectByText(field.getLocatorHint(), option)),
                "alternative select value " + option);
    }

    /** Untaken radio value: click the radio that carries it. */
    public static BranchAction radio(FieldDescriptor field, String option) {
        String hint = field.locatorFor(option);
        return new BranchAction(Kind.RADIO, field.getFieldId(), field.getLabel(), hint,
                field.getFieldType(), option,
                List.of(PrimitiveAction.click(hint)),
                "alternative radio " + option);
    }

    /** Opposite checkbox state. */
    public static BranchAction checkbox(FieldDescriptor field, boolean targetState) {
        return new BranchAction(Kind.CHECKBOX, field.getFieldId(), field.getLabel(), field.getLocatorHint(),
                field.getFieldType(), String.valueOf(targetState),
                List.of(PrimitiveAction.toggle(field.getLocatorHint())),
                "checkbox opposite state");
    }

    // ── Getters ──────────────────────────────────────────────────────────

    @JsonProperty("kind")        public Kind                  getKind()        { return kind; }
    @JsonProperty("fieldId")     public String                getFieldId()     { return fieldId; }
    @JsonProperty("label")       public String                getLabel()       { return label; }
    @JsonProperty("locatorHint") public String                getLocatorHint() { return locatorHint; }
    @JsonProperty("fieldType")   public FieldType             getFieldType()   { return fieldType; }
    @JsonProperty("value")       public String                getValue()       { return value; }
    @JsonProperty("actions")     public List<PrimitiveAction> getActions()     { return actions; }
    @JsonProperty("note")        public String                getNote()        { return note; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BranchAction other)) return false;
        return kind == other.kind
                && fieldId.equals(other.fieldId)
                && Objects.equals(locatorHint, other.locatorHint)
                && Objects.equals(value, other.value)
                && actions.equals(other.actions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fieldId, locatorHint, value, actions);
    }

    @Override
    public String toString() {
        return String.format("BranchAction{%s %s=%s}", kind, fieldId, value);
    }
}
