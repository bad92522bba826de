package formroutes.inference;

import formroutes.model.ConsolidatedField;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Picks the fields most likely to identify a record in a list/grid view.
 * Each keyword group adds its weight once when any of its keywords occurs
 * in the field's normalised name.
 */
public class ColumnRanker {

    private static final Map<List<String>, Integer> WEIGHTS = new LinkedHashMap<>();

    static {
        WEIGHTS.put(List.of("name", "title"), 100);
        WEIGHTS.put(List.of("type"), 80);
        WEIGHTS.put(List.of("status", "state"), 70);
        WEIGHTS.put(List.of("date"), 60);
        WEIGHTS.put(List.of("email"), 50);
    }

    private final int limit;

    public ColumnRanker(int limit) {
        this.limit = limit;
    }

    /** Lower-cased label (or id) with whitespace runs replaced by underscores. */
    public static String normalize(String labelOrId) {
        if (labelOrId == null) return "";
        return labelOrId.trim().replaceAll("\\s+", "_").toLowerCase(Locale.ROOT);
    }

    public static int score(String normalizedName) {
        int total = 0;
        for (Map.Entry<List<String>, Integer> e : WEIGHTS.entrySet()) {
            if (e.getKey().stream().anyMatch(normalizedName::contains)) total += e.getValue();
        }
        return total;
    }

    /**
     * Ids of the best-scoring fields, highest first; equal scores keep
     * encounter order and zero scores are never picked.
     */
    public List<String> rank(List<ConsolidatedField> fields) {
        List<ConsolidatedField> sorted = new ArrayList<>(fields);
        sorted.sort(Comparator.comparingInt(ConsolidatedField::getColumnScore).reversed());
        return sorted.stream()
                .filter(f -> f.getColumnScore() > 0)
                .limit(limit)
                .map(ConsolidatedField::getFieldId)
                .collect(Collectors.toList());
    }
}
