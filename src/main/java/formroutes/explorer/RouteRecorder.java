package formroutes.explorer;

import formroutes.model.FieldObservation;
import formroutes.model.Precondition;
import formroutes.model.Route;
import formroutes.model.Stage;
import formroutes.model.TerminalOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns the stages of one finished traversal path into a {@link Route},
 * appends it to the run's route list and indexes its fields.
 */
public class RouteRecorder {

    private static final Logger log = LoggerFactory.getLogger(RouteRecorder.class);

    /** Name of a route reached without taking any alternative. */
    static final String BASE_ROUTE_NAME = "base";

    public Route record(ExplorationContext context, List<Stage> stages,
                        List<Precondition> preconditions, TerminalOutcome outcome) {
        String routeId = String.format("route-%03d", context.routeCount() + 1);
        Route route = new Route(routeId, routeName(preconditions), stages, preconditions, outcome);
        context.addRoute(route);

        Set<String> seen = new HashSet<>();
        for (FieldObservation obs : route.observations()) {
            if (seen.add(obs.getFieldId())) {
                context.tracker().record(obs.getFieldId(), route, route.getPreconditions(), obs);
            }
        }
        log.info("Recorded {} '{}' ({} stages, {} fields, {})",
                routeId, route.getName(), stages.size(), seen.size(), outcome);
        return route;
    }

    /** Readable name from the route's branch choices, e.g. {@code "country=UK, gift=true"}. */
    static String routeName(List<Precondition> preconditions) {
        if (preconditions == null || preconditions.isEmpty()) return BASE_ROUTE_NAME;
        return Precondition.toMap(preconditions).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
