package formroutes.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One sighting of a field: the route it was seen on, that route's
 * preconditions, and the observation itself.
 */
public record FieldAppearance(@JsonProperty("routeId") String routeId,
                              @JsonProperty("preconditions") List<Precondition> preconditions,
                              @JsonProperty("observation") FieldObservation observation) {

    public FieldAppearance {
        Objects.requireNonNull(routeId, "routeId");
        preconditions = preconditions != null ? List.copyOf(preconditions) : List.of();
    }
}
