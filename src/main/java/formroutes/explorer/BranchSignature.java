package formroutes.explorer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import formroutes.model.BranchAction;
import formroutes.model.Stage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical string form of a queued branch: the stages leading up to it
 * plus the branch itself, serialised with sorted keys so equal branches
 * always produce equal signatures.
 */
public final class BranchSignature {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private BranchSignature() {}

    public static String of(List<Stage> prefix, BranchAction branch) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prefix", prefix);
        payload.put("branch", branch);
        try {
            return CANONICAL.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ExplorationException("Cannot compute signature for " + branch, e);
        }
    }
}
