package formroutes.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A currently visible, enterable field as reported by a
 * {@link formroutes.page.PageObserver}: identity, label, type and its legal
 * values.
 *
 * <p>For radio groups one descriptor covers the whole group; the locator of
 * each individual radio is kept in {@link #getOptionLocators()}.
 */
public final class FieldDescriptor {

    private final String fieldId;
    private final String label;
    private final String locatorHint;
    private final FieldType fieldType;
    private final List<String> options;
    private final Map<String, String> optionLocators;
    private final String currentValue;
    private final boolean required;

    private FieldDescriptor(Builder b) {
        this.fieldId        = Objects.requireNonNull(b.fieldId, "fieldId");
        this.label          = b.label;
        this.locatorHint    = b.locatorHint != null ? b.locatorHint : "#" + b.fieldId;
        this.fieldType      = b.fieldType != null ? b.fieldType : FieldType.TEXT;
        this.options        = List.copyOf(b.options);
        this.optionLocators = Map.copyOf(b.optionLocators);
        this.currentValue   = b.currentValue;
        this.required       = b.required;
    }

    public static Builder builder(String fieldId) {
        return new Builder(fieldId);
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String              getFieldId()        { return fieldId; }
    public String              getLabel()          { return label; }
    public String              getLocatorHint()    { return locatorHint; }
    public FieldType           getFieldType()      { return fieldType; }
    public List<String>        getOptions()        { return options; }
    public Map<String, String> getOptionLocators() { return optionLocators; }
    public String              getCurrentValue()   { return currentValue; }
    public boolean             isRequired()        { return required; }

    /** Locator of the control carrying {@code option}; the field locator when none is registered. */
    public String locatorFor(String option) {
        return optionLocators.getOrDefault(option, locatorHint);
    }

    /** True when the checkbox is reported as checked. */
    public boolean isChecked() {
        return Boolean.parseBoolean(currentValue);
    }

    @Override
    public String toString() {
        return String.format("FieldDescriptor{%s, type=%s, options=%s}", fieldId, fieldType, options);
    }

    // ── Builder ──────────────────────────────────────────────────────────

    public static final class Builder {
        private final String fieldId;
        private String label;
        private String locatorHint;
        private FieldType fieldType;
        private final List<String> options = new java.util.ArrayList<>();
        private final Map<String, String> optionLocators = new LinkedHashMap<>();
        private String currentValue;
        private boolean required;

        private Builder(String fieldId) {
            this.fieldId = fieldId;
        }

        public Builder label(String label)             { this.label = label; return this; }
        public Builder locatorHint(String hint)        { this.locatorHint = hint; return this; }
        public Builder type(FieldType type)            { this.fieldType = type; return this; }
        public Builder currentValue(String value)      { this.currentValue = value; return this; }
        public Builder required(boolean required)      { this.required = required; return this; }

        public Builder options(List<String> values) {
            this.options.addAll(values);
            return this;
        }

        public Builder option(String value, String locatorHint) {
            this.options.add(value);
            if (locatorHint != null) this.optionLocators.put(value, locatorHint);
            return this;
        }

        public FieldDescriptor build() {
            return new FieldDescriptor(this);
        }
    }
}
