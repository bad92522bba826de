package formroutes.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One prior choice ({@code fieldId = value}) that was active when a route or
 * observation began.
 */
public record Precondition(@JsonProperty("fieldId") String fieldId,
                           @JsonProperty("value") String value) {

    public Precondition {
        Objects.requireNonNull(fieldId, "fieldId");
    }

    /**
     * Folds a precondition list into a map. A later entry for the same field
     * overrides an earlier one; insertion order follows first occurrence.
     */
    public static Map<String, String> toMap(Collection<Precondition> preconditions) {
        Map<String, String> out = new LinkedHashMap<>();
        if (preconditions == null) return out;
        for (Precondition p : preconditions) {
            if (p.value() != null) {
                out.put(p.fieldId(), p.value());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return fieldId + "=" + value;
    }
}
