package formroutes.explorer;

import formroutes.model.FieldDescriptor;
import formroutes.model.FieldType;

import java.util.List;
import java.util.Locale;

/**
 * Picks a plausible value for a free-text field from its type, label and id.
 * Suggestions are fixed strings so repeated runs over the same form make
 * the same choices.
 */
public class ValueSuggester {

    /** Label/id fragments marking the field that names the created entity. */
    private static final List<String> NAME_FIELD_HINTS = List.of("name", "title");

    /** Fragments that disqualify a "name" match, e.g. first/last name of a person. */
    private static final List<String> PERSON_NAME_HINTS = List.of("first", "last", "fname", "lname", "surname", "user");

    public String suggest(FieldDescriptor field) {
        return suggest(field.getFieldType(), field.getLabel(), field.getFieldId());
    }

    public String suggest(FieldType type, String label, String name) {
        String l = ((label == null ? "" : label) + " " + (name == null ? "" : name)).toLowerCase(Locale.ROOT);
        if (l.contains("email") || type == FieldType.EMAIL)   return "alice.cohen@example.com";
        if (l.contains("phone") || type == FieldType.TEL)     return "2025550123";
        if (l.contains("number") || type == FieldType.NUMBER) return "1000";
        if (l.contains("first") || l.contains("fname"))       return "Alice";
        if (l.contains("last") || l.contains("lname") || l.contains("surname")) return "Cohen";
        if (type == FieldType.DATE)                           return "2025-01-01";
        if (type == FieldType.PASSWORD)                       return "Passw0rd!";
        if (l.contains("city"))                               return "Springfield";
        if (l.contains("address"))                            return "123 Main St";
        return "TestValue";
    }

    /**
     * True when the field looks like the one that names the record being
     * created (a free-text "name" or "title" that is not a person's name).
     */
    public boolean isEntityNameField(FieldDescriptor field) {
        if (!field.getFieldType().isFreeText() || field.getFieldType() == FieldType.EMAIL) return false;
        String l = ((field.getLabel() == null ? "" : field.getLabel()) + " " + field.getFieldId())
                .toLowerCase(Locale.ROOT);
        if (PERSON_NAME_HINTS.stream().anyMatch(l::contains)) return false;
        return NAME_FIELD_HINTS.stream().anyMatch(l::contains);
    }
}
