package formroutes.model;

import java.util.Locale;

/**
 * Kind of form control a field was observed as. Drives which value the
 * explorer commits to and which alternatives it queues as branches.
 */
public enum FieldType {
    TEXT, TEXTAREA, EMAIL, NUMBER, TEL, DATE, PASSWORD,
    SELECT, RADIO, CHECKBOX,
    OTHER;

    /**
     * Maps an HTML tag plus its {@code type} attribute to a field type.
     *
     * @param tagName  element tag, e.g. {@code input}, {@code select}
     * @param htmlType value of the {@code type} attribute, may be null
     */
    public static FieldType fromHtml(String tagName, String htmlType) {
        String tag = tagName == null ? "" : tagName.toLowerCase(Locale.ROOT).trim();
        if ("select".equals(tag))   return SELECT;
        if ("textarea".equals(tag)) return TEXTAREA;
        String t = htmlType == null ? "" : htmlType.toLowerCase(Locale.ROOT).trim();
        return switch (t) {
            case "", "text", "search", "url" -> "input".equals(tag) || tag.isEmpty() ? TEXT : OTHER;
            case "email"    -> EMAIL;
            case "number", "range" -> NUMBER;
            case "tel", "phone" -> TEL;
            case "date", "datetime-local", "month", "time", "week" -> DATE;
            case "password" -> PASSWORD;
            case "radio"    -> RADIO;
            case "checkbox" -> CHECKBOX;
            case "select"   -> SELECT;
            default         -> OTHER;
        };
    }

    /** True for controls whose legal values form a closed, enumerable set. */
    public boolean isEnumerable() {
        return this == SELECT || this == RADIO;
    }

    /** True for controls the explorer fills with a suggested free-text value. */
    public boolean isFreeText() {
        return this == TEXT || this == TEXTAREA || this == EMAIL || this == NUMBER
                || this == TEL || this == DATE || this == PASSWORD;
    }
}
