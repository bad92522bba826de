package formroutes.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes exploration output as JSON.
 *
 * <p>Layout written by {@link #writeAll}:
 * <pre>
 *   &lt;dir&gt;/&lt;form&gt;_result.json        full {@link ExplorationResult}
 *   &lt;dir&gt;/routes/&lt;route-name&gt;.json   one file per {@link Route}
 * </pre>
 *
 * <p>On read: validates against {@code exploration-schema.json} before
 * deserializing and rejects unsupported schema versions.
 */
public final class RouteIO {

    private static final Logger log = LoggerFactory.getLogger(RouteIO.class);
    private static final String SCHEMA_RESOURCE = "/exploration-schema.json";

    /** Shared ObjectMapper; thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from classpath; null if the schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private RouteIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Writes the full result plus one file per route under {@code dir}.
     *
     * @return path of the written result file
     * @throws IOException if any file cannot be written
     */
    public static Path writeAll(ExplorationResult result, Path dir) throws IOException {
        Path routesDir = dir.resolve("routes");
        Files.createDirectories(routesDir);
        for (Route route : result.getRoutes()) {
            writeRoute(route, routesDir.resolve(sanitizeFilename(route.getRouteId() + "_" + route.getName()) + ".json"));
        }
        Path resultFile = dir.resolve(sanitizeFilename(result.getFormName()) + "_result.json");
        write(result, resultFile);
        return resultFile;
    }

    /**
     * Writes an {@link ExplorationResult} (pretty-printed).
     *
     * @throws IOException if the file cannot be written
     */
    public static void write(ExplorationResult result, Path path) throws IOException {
        createParent(path);
        MAPPER.writeValue(path.toFile(), result);
        log.info("Wrote exploration of '{}' ({} routes, {} fields) to {}",
                result.getFormName(), result.getRoutes().size(), result.getFields().size(), path);
    }

    public static void writeRoute(Route route, Path path) throws IOException {
        createParent(path);
        MAPPER.writeValue(path.toFile(), route);
        log.debug("Wrote route '{}' to {}", route.getRouteId(), path);
    }

    /**
     * Reads an {@link ExplorationResult} from a JSON file.
     *
     * @throws IOException             if the file cannot be read or parsed
     * @throws SchemaVersionException  if the schema version is not supported
     * @throws SchemaValidationException if the JSON does not match the schema
     */
    public static ExplorationResult read(Path path) throws IOException {
        log.debug("Reading exploration result from: {}", path);
        String json = Files.readString(path);
        validateSchema(json, path.toString());
        ExplorationResult result = MAPPER.readValue(json, ExplorationResult.class);
        if (!result.isVersionSupported()) {
            throw new SchemaVersionException(
                    "Unsupported schema version: " + result.getSchemaVersion()
                    + " (expected: " + ExplorationResult.CURRENT_SCHEMA_VERSION + ")");
        }
        log.info("Loaded exploration of '{}' with {} routes from {}", result.getFormName(),
                result.getRoutes().size(), path);
        return result;
    }

    public static Route readRoute(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), Route.class);
    }

    public static String toJson(Object value) throws IOException {
        return MAPPER.writeValueAsString(value);
    }

    /** Deserializes without schema validation. */
    public static ExplorationResult fromJson(String json) throws IOException {
        return MAPPER.readValue(json, ExplorationResult.class);
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper getMapper() { return MAPPER; }

    /** Replaces spaces and anything outside {@code [a-zA-Z0-9._-]} with {@code _}. */
    public static String sanitizeFilename(String name) {
        if (name == null || name.isBlank()) return "form_page";
        String cleaned = name.strip().replace(' ', '_').replaceAll("[^a-zA-Z0-9._-]", "_");
        return cleaned.isEmpty() ? "form_page" : cleaned;
    }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static void validateSchema(String json, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("exploration-schema.json not found on classpath, skipping schema validation");
            return;
        }
        try {
            Set<ValidationMessage> errors = schema.validate(MAPPER.readTree(json));
            if (!errors.isEmpty()) {
                StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
                errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
                throw new SchemaValidationException(sb.toString());
            }
        } catch (IOException e) {
            log.warn("Could not parse JSON for schema validation: {}", e.getMessage());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (RouteIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = RouteIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaVersionException extends RuntimeException {
        public SchemaVersionException(String msg) { super(msg); }
    }

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
