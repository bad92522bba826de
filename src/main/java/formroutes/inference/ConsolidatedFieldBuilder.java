package formroutes.inference;

import formroutes.explorer.ExplorationContext;
import formroutes.model.ConsolidatedField;
import formroutes.model.FieldObservation;
import formroutes.model.HidingCondition;
import formroutes.model.Route;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges every observation of a field into one {@link ConsolidatedField}:
 * the first observation represents it, enumerable fields collect the values
 * seen across routes, and the inferred hiding condition is attached.
 */
public class ConsolidatedFieldBuilder {

    private final HidingConditionInferrer inferrer;

    public ConsolidatedFieldBuilder(HidingConditionInferrer inferrer) {
        this.inferrer = inferrer;
    }

    /** Consolidated fields keyed by field id, in encounter order. */
    public Map<String, ConsolidatedField> build(ExplorationContext context) {
        Map<String, ConsolidatedField> out = new LinkedHashMap<>();
        for (String fieldId : context.tracker().fieldIds()) {
            FieldObservation representative = context.tracker().appearances(fieldId).get(0).observation();
            String name = representative.displayName();
            List<String> options = representative.getFieldType().isEnumerable()
                    ? observedValues(fieldId, context.routes())
                    : List.of();
            HidingCondition condition = inferrer.inferCondition(fieldId).orElse(null);
            out.put(fieldId, new ConsolidatedField(fieldId, name, representative, options, condition,
                    ColumnRanker.score(ColumnRanker.normalize(name))));
        }
        return out;
    }

    private static List<String> observedValues(String fieldId, List<Route> routes) {
        Set<String> values = new TreeSet<>();
        for (Route r : routes) {
            for (FieldObservation o : r.observations()) {
                if (o.getFieldId().equals(fieldId) && o.getValue() != null) values.add(o.getValue());
            }
        }
        return new ArrayList<>(values);
    }
}
