package formroutes.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One predictor of a hiding condition: the field is hidden (as far as this
 * clause is concerned) when {@code predictorFieldId} holds any of
 * {@code hidingValues}.
 */
public record ConditionClause(@JsonProperty("predictorFieldId") String predictorFieldId,
                              @JsonProperty("hidingValues") List<String> hidingValues) {

    public ConditionClause {
        Objects.requireNonNull(predictorFieldId, "predictorFieldId");
        hidingValues = hidingValues != null ? List.copyOf(hidingValues) : List.of();
    }

    /** True when {@code value} is one of the hiding values. */
    public boolean matches(String value) {
        return value != null && hidingValues.contains(value);
    }

    @Override
    public String toString() {
        return predictorFieldId + " in " + hidingValues;
    }
}
