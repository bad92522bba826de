package formroutes.explorer;

import formroutes.model.FieldAppearance;
import formroutes.model.FieldObservation;
import formroutes.model.Precondition;
import formroutes.model.Route;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index from field id to every route the field was observed on, together
 * with that route's preconditions. A field id is present exactly when at
 * least one recorded route contains an observation of it.
 */
public class FieldAppearanceTracker {

    private final Map<String, List<FieldAppearance>> appearances = new LinkedHashMap<>();

    public void record(String fieldId, Route route, List<Precondition> preconditions,
                       FieldObservation observation) {
        appearances.computeIfAbsent(fieldId, k -> new ArrayList<>())
                .add(new FieldAppearance(route.getRouteId(), preconditions, observation));
    }

    /** Field ids in the order they were first observed. */
    public List<String> fieldIds() {
        return List.copyOf(appearances.keySet());
    }

    public List<FieldAppearance> appearances(String fieldId) {
        List<FieldAppearance> list = appearances.get(fieldId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /** Distinct ids of routes that contain the field, in recording order. */
    public List<String> routesWithField(String fieldId) {
        Set<String> ids = new LinkedHashSet<>();
        for (FieldAppearance a : appearances(fieldId)) {
            ids.add(a.routeId());
        }
        return List.copyOf(ids);
    }

    /** Ids of routes in {@code allRoutes} that never showed the field. */
    public List<String> routesWithoutField(String fieldId, Collection<Route> allRoutes) {
        Set<String> with = new LinkedHashSet<>(routesWithField(fieldId));
        List<String> out = new ArrayList<>();
        for (Route r : allRoutes) {
            if (!with.contains(r.getRouteId())) out.add(r.getRouteId());
        }
        return out;
    }

    public boolean contains(String fieldId) {
        return appearances.containsKey(fieldId);
    }

    /** Snapshot of the whole index. */
    public Map<String, List<FieldAppearance>> snapshot() {
        Map<String, List<FieldAppearance>> copy = new LinkedHashMap<>();
        appearances.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return copy;
    }
}
