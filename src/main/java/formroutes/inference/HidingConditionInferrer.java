package formroutes.inference;

import formroutes.explorer.ExplorationContext;
import formroutes.explorer.FieldAppearanceTracker;
import formroutes.model.ConditionClause;
import formroutes.model.HidingCondition;
import formroutes.model.Precondition;
import formroutes.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives, per field, the condition under which it is hidden by comparing
 * the routes that showed it with the routes that did not.
 *
 * <p>Evidence is every field value set on a route. Only fields the
 * exploration varied (those appearing in some route's branch choices) can
 * act as predictors.
 * <ul>
 *   <li>{@code AND}: the predictors set on every hidden route, each with the
 *       values it took there. The conjunction must match no visible route;
 *       clauses that can go without breaking this are dropped. Two or more
 *       remaining clauses make a proven result.</li>
 *   <li>{@code OR} otherwise: each predictor with the values seen only on
 *       hidden routes, marked best-effort.</li>
 * </ul>
 */
public class HidingConditionInferrer {

    private static final Logger log = LoggerFactory.getLogger(HidingConditionInferrer.class);

    private final List<Route> routes;
    private final FieldAppearanceTracker tracker;
    private final Set<String> variedFields;

    public HidingConditionInferrer(ExplorationContext context) {
        this(context.routes(), context.tracker());
    }

    public HidingConditionInferrer(List<Route> routes, FieldAppearanceTracker tracker) {
        this.routes  = List.copyOf(routes);
        this.tracker = tracker;
        this.variedFields = new HashSet<>();
        for (Route r : this.routes) {
            for (Precondition p : r.getPreconditions()) {
                variedFields.add(p.fieldId());
            }
        }
    }

    /**
     * Infers the hiding condition of one field.
     *
     * @return empty when the field was present on every route
     */
    public Optional<HidingCondition> inferCondition(String fieldId) {
        Set<String> withIds = new HashSet<>(tracker.routesWithField(fieldId));
        List<Map<String, String>> visible = new ArrayList<>();
        List<Map<String, String>> hidden  = new ArrayList<>();
        for (Route r : routes) {
            Map<String, String> values = r.stageValues();
            if (withIds.contains(r.getRouteId())) {
                values.remove(fieldId);
                visible.add(values);
            } else {
                hidden.add(values);
            }
        }
        if (hidden.isEmpty()) return Optional.empty();

        Set<String> predictors = candidates(fieldId, hidden);
        HidingCondition and = provenConjunction(predictors, hidden, visible);
        if (and != null) {
            log.debug("Field '{}' hidden when {}", fieldId, and);
            return Optional.of(and);
        }

        List<ConditionClause> clauses = new ArrayList<>();
        for (String predictor : predictors) {
            Set<String> hidingValues = new TreeSet<>(valuesOf(predictor, hidden));
            hidingValues.removeAll(valuesOf(predictor, visible));
            if (!hidingValues.isEmpty()) {
                clauses.add(new ConditionClause(predictor, new ArrayList<>(hidingValues)));
            }
        }

        HidingCondition or = HidingCondition.or(clauses);
        log.debug("Field '{}' hidden when {}", fieldId, or);
        return Optional.of(or);
    }

    /** Conditions of every field that is hidden on at least one route, in encounter order. */
    public Map<String, HidingCondition> inferAll() {
        Map<String, HidingCondition> out = new LinkedHashMap<>();
        for (String fieldId : tracker.fieldIds()) {
            inferCondition(fieldId).ifPresent(c -> out.put(fieldId, c));
        }
        return out;
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    /** Varied fields set on hidden routes, in the order first met there. */
    private Set<String> candidates(String fieldId, List<Map<String, String>> hidden) {
        Set<String> out = new LinkedHashSet<>();
        for (Map<String, String> m : hidden) {
            for (String key : m.keySet()) {
                if (!key.equals(fieldId) && variedFields.contains(key)) out.add(key);
            }
        }
        return out;
    }

    /**
     * AND over the predictors set on every hidden route, reduced to the
     * clauses needed to spare every visible route, or null when it matches
     * a visible route or fewer than two clauses remain.
     */
    private static HidingCondition provenConjunction(Set<String> predictors,
                                                     List<Map<String, String>> hidden,
                                                     List<Map<String, String>> visible) {
        List<ConditionClause> clauses = new ArrayList<>();
        for (String predictor : predictors) {
            if (hidden.stream().allMatch(m -> m.containsKey(predictor))) {
                List<String> values = new ArrayList<>(new TreeSet<>(valuesOf(predictor, hidden)));
                clauses.add(new ConditionClause(predictor, values));
            }
        }
        if (clauses.size() < 2 || !sparesVisible(clauses, visible)) return null;

        for (ConditionClause clause : List.copyOf(clauses)) {
            List<ConditionClause> without = new ArrayList<>(clauses);
            without.remove(clause);
            if (!without.isEmpty() && sparesVisible(without, visible)) {
                clauses = without;
            }
        }
        return clauses.size() < 2 ? null : HidingCondition.and(clauses);
    }

    private static boolean sparesVisible(List<ConditionClause> clauses, List<Map<String, String>> visible) {
        HidingCondition candidate = HidingCondition.and(clauses);
        return visible.stream().noneMatch(candidate::isSatisfiedBy);
    }

    private static Set<String> valuesOf(String fieldId, List<Map<String, String>> evidence) {
        Set<String> out = new HashSet<>();
        for (Map<String, String> m : evidence) {
            String v = m.get(fieldId);
            if (v != null) out.add(v);
        }
        return out;
    }
}
