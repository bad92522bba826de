package formroutes.explorer;

import formroutes.model.Route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything one exploration run accumulates: the recorded routes, the field
 * appearance index and the set of branch signatures already queued.
 *
 * <p>Created per run and confined to the thread performing it.
 */
public class ExplorationContext {

    private final String formName;
    private final List<Route> routes = new ArrayList<>();
    private final FieldAppearanceTracker tracker = new FieldAppearanceTracker();
    private final Set<String> visitedSignatures = new HashSet<>();
    private final List<String> queuedSignatures = new ArrayList<>();

    public ExplorationContext(String formName) {
        this.formName = formName;
    }

    public String getFormName() {
        return formName;
    }

    /** Recorded routes in recording order (read-only view). */
    public List<Route> routes() {
        return Collections.unmodifiableList(routes);
    }

    public int routeCount() {
        return routes.size();
    }

    public FieldAppearanceTracker tracker() {
        return tracker;
    }

    /**
     * Marks a branch signature as queued.
     *
     * @return false when the signature was already seen in this run
     */
    public boolean markVisited(String signature) {
        if (!visitedSignatures.add(signature)) return false;
        queuedSignatures.add(signature);
        return true;
    }

    /** Every signature accepted by {@link #markVisited}, in queue order. */
    public List<String> queuedSignatures() {
        return Collections.unmodifiableList(queuedSignatures);
    }

    void addRoute(Route route) {
        routes.add(route);
    }
}
