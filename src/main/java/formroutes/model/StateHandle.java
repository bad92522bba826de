package formroutes.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Opaque restore point for a form state. For browser forms this is the URL
 * (including any query state); {@code token} carries observer-specific extra
 * state and may be null.
 */
public record StateHandle(@JsonProperty("url") String url,
                          @JsonProperty("token") String token) {

    public StateHandle {
        Objects.requireNonNull(url, "url");
    }

    public static StateHandle of(String url) {
        return new StateHandle(url, null);
    }
}
