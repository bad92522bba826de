package formroutes.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One recorded unit of work within a route. Either a {@link FieldStage}
 * (a field observation, possibly produced by a queued branch) or an
 * {@link InteractionStage} (hover, frame switch, wait) that carries no value.
 *
 * <p>Serialised with an explicit {@code kind} tag.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FieldStage.class,       name = "field"),
        @JsonSubTypes.Type(value = InteractionStage.class, name = "interaction")
})
public sealed interface Stage permits FieldStage, InteractionStage {

    enum Kind { FIELD, INTERACTION }

    @JsonIgnore
    Kind kind();

    /** Field observed by this stage, or null for pure interactions. */
    @JsonIgnore
    default FieldObservation observationOrNull() {
        return null;
    }
}
