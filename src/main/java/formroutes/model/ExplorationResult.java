package formroutes.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output boundary of one exploration run: every recorded route, the field
 * appearance index, the consolidated fields and the ranked summary columns.
 */
public final class ExplorationResult {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    private final String schemaVersion;
    private final String formName;
    private final Instant completedAt;
    private final List<Route> routes;
    private final Map<String, List<FieldAppearance>> appearances;
    private final Map<String, ConsolidatedField> fields;
    private final List<String> summaryColumns;

    @JsonCreator
    public ExplorationResult(@JsonProperty("schemaVersion")  String schemaVersion,
                             @JsonProperty("formName")       String formName,
                             @JsonProperty("completedAt")    Instant completedAt,
                             @JsonProperty("routes")         List<Route> routes,
                             @JsonProperty("appearances")    Map<String, List<FieldAppearance>> appearances,
                             @JsonProperty("fields")         Map<String, ConsolidatedField> fields,
                             @JsonProperty("summaryColumns") List<String> summaryColumns) {
        this.schemaVersion  = schemaVersion != null ? schemaVersion : CURRENT_SCHEMA_VERSION;
        this.formName       = formName;
        this.completedAt    = completedAt;
        this.routes         = routes != null ? List.copyOf(routes) : List.of();
        this.appearances    = appearances != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(appearances)) : Map.of();
        this.fields         = fields != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        this.summaryColumns = summaryColumns != null ? List.copyOf(summaryColumns) : List.of();
    }

    @JsonProperty("schemaVersion")  public String                              getSchemaVersion()  { return schemaVersion; }
    @JsonProperty("formName")       public String                              getFormName()       { return formName; }
    @JsonProperty("completedAt")    public Instant                             getCompletedAt()    { return completedAt; }
    @JsonProperty("routes")         public List<Route>                         getRoutes()         { return routes; }
    @JsonProperty("appearances")    public Map<String, List<FieldAppearance>>  getAppearances()    { return appearances; }
    @JsonProperty("fields")         public Map<String, ConsolidatedField>      getFields()         { return fields; }
    @JsonProperty("summaryColumns") public List<String>                        getSummaryColumns() { return summaryColumns; }

    @JsonIgnore
    public boolean isVersionSupported() {
        return CURRENT_SCHEMA_VERSION.equals(schemaVersion);
    }

    @Override
    public String toString() {
        return String.format("ExplorationResult{form='%s', routes=%d, fields=%d}",
                formName, routes.size(), fields.size());
    }
}
