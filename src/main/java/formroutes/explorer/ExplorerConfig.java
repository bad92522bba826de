package formroutes.explorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Reads explorer settings from {@code config.properties} (classpath) and
 * exposes typed accessors with sensible defaults.
 *
 * <p>An optional {@code config.local.properties} on the classpath overrides
 * any value from the base file.
 *
 * <h3>Supported keys and defaults</h3>
 * <table>
 *   <tr><th>Key</th><th>Default</th></tr>
 *   <tr><td>explorer.max.routes</td><td>500</td></tr>
 *   <tr><td>explorer.max.steps.per.route</td><td>20</td></tr>
 *   <tr><td>explorer.summary.columns</td><td>5</td></tr>
 *   <tr><td>explorer.entity.prefix</td><td>tested_</td></tr>
 *   <tr><td>explorer.fill.name.field</td><td>true</td></tr>
 *   <tr><td>explorer.next.keywords</td><td>next,continue,proceed,forward,advance</td></tr>
 *   <tr><td>explorer.save.keywords</td><td>save,finish,submit,done,complete,create,confirm</td></tr>
 *   <tr><td>explorer.wait.sec</td><td>10</td></tr>
 *   <tr><td>explorer.output.dir</td><td>form-routes</td></tr>
 * </table>
 */
public class ExplorerConfig {

    private static final Logger log = LoggerFactory.getLogger(ExplorerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    private static final String KEY_MAX_ROUTES       = "explorer.max.routes";
    private static final String KEY_MAX_STEPS        = "explorer.max.steps.per.route";
    private static final String KEY_SUMMARY_COLUMNS  = "explorer.summary.columns";
    private static final String KEY_ENTITY_PREFIX    = "explorer.entity.prefix";
    private static final String KEY_FILL_NAME_FIELD  = "explorer.fill.name.field";
    private static final String KEY_NEXT_KEYWORDS    = "explorer.next.keywords";
    private static final String KEY_SAVE_KEYWORDS    = "explorer.save.keywords";
    private static final String KEY_WAIT_SEC         = "explorer.wait.sec";
    private static final String KEY_OUTPUT_DIR       = "explorer.output.dir";

    // Defaults
    private static final int     DEFAULT_MAX_ROUTES      = 500;
    private static final int     DEFAULT_MAX_STEPS       = 20;
    private static final int     DEFAULT_SUMMARY_COLUMNS = 5;
    private static final String  DEFAULT_ENTITY_PREFIX   = "tested_";
    private static final boolean DEFAULT_FILL_NAME_FIELD = true;
    private static final String  DEFAULT_NEXT_KEYWORDS   = "next,continue,proceed,forward,advance";
    private static final String  DEFAULT_SAVE_KEYWORDS   = "save,finish,submit,done,complete,create,confirm";
    private static final int     DEFAULT_WAIT_SEC        = 10;
    private static final String  DEFAULT_OUTPUT_DIR      = "form-routes";

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads configuration from the classpath. A missing {@code config.properties}
     * is tolerated and every setting falls back to its default.
     */
    public ExplorerConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /**
     * Package-private constructor for tests; accepts a pre-populated
     * {@link Properties} instance, bypassing classpath I/O.
     */
    ExplorerConfig(Properties props) {
        this.props = props;
    }

    /** Configuration holding only defaults, with no classpath lookup. */
    public static ExplorerConfig defaults() {
        return new ExplorerConfig(new Properties());
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    /** Upper bound on recorded routes per run (default: 500). */
    public int getMaxRoutes() {
        return getInt(KEY_MAX_ROUTES, DEFAULT_MAX_ROUTES);
    }

    /** Upper bound on "next" steps followed within one route (default: 20). */
    public int getMaxStepsPerRoute() {
        return getInt(KEY_MAX_STEPS, DEFAULT_MAX_STEPS);
    }

    /** How many ranked fields make up the summary/grid short list (default: 5). */
    public int getSummaryColumns() {
        return getInt(KEY_SUMMARY_COLUMNS, DEFAULT_SUMMARY_COLUMNS);
    }

    /** Prefix of the entity name typed into the form's name field (default: "tested_"). */
    public String getEntityPrefix() {
        return props.getProperty(KEY_ENTITY_PREFIX, DEFAULT_ENTITY_PREFIX).trim();
    }

    /** Whether the detected name/title field receives a route-specific entity name (default: true). */
    public boolean isFillNameField() {
        return getBool(KEY_FILL_NAME_FIELD, DEFAULT_FILL_NAME_FIELD);
    }

    /** Lower-cased keywords identifying the "next" control. */
    public List<String> getNextKeywords() {
        return splitToList(props.getProperty(KEY_NEXT_KEYWORDS, DEFAULT_NEXT_KEYWORDS));
    }

    /** Lower-cased keywords identifying the save/submit control. */
    public List<String> getSaveKeywords() {
        return splitToList(props.getProperty(KEY_SAVE_KEYWORDS, DEFAULT_SAVE_KEYWORDS));
    }

    /** Explicit wait timeout for page loads in seconds (default: 10). */
    public int getWaitSec() {
        return getInt(KEY_WAIT_SEC, DEFAULT_WAIT_SEC);
    }

    /** Directory exploration results are written to (default: "form-routes"). */
    public String getOutputDir() {
        return props.getProperty(KEY_OUTPUT_DIR, DEFAULT_OUTPUT_DIR).trim();
    }

    /** Overrides the route cap at runtime, e.g. from the {@code --max-routes} CLI option. */
    public void setMaxRoutes(int maxRoutes) {
        props.setProperty(KEY_MAX_ROUTES, String.valueOf(maxRoutes));
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {} - all explorer settings use defaults", CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded explorer base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new ExplorationException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {} - using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                log.warn("Non-positive value for key '{}': '{}' - using default {}", key, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}' - using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

    private static List<String> splitToList(String csv) {
        if (csv == null || csv.isBlank()) return Collections.emptyList();
        return Arrays.stream(csv.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }
}
