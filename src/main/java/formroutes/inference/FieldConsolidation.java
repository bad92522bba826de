package formroutes.inference;

import formroutes.explorer.ExplorationContext;
import formroutes.model.ConsolidatedField;
import formroutes.model.ExplorationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cross-references all routes of a finished run into an
 * {@link ExplorationResult}. Pure function of the context apart from the
 * completion timestamp.
 */
public class FieldConsolidation {

    private static final Logger log = LoggerFactory.getLogger(FieldConsolidation.class);

    private final ColumnRanker ranker;

    public FieldConsolidation(int summaryColumns) {
        this.ranker = new ColumnRanker(summaryColumns);
    }

    public ExplorationResult consolidate(ExplorationContext context) {
        HidingConditionInferrer inferrer = new HidingConditionInferrer(context);
        Map<String, ConsolidatedField> fields = new ConsolidatedFieldBuilder(inferrer).build(context);
        List<String> summary = ranker.rank(new ArrayList<>(fields.values()));

        long conditional = fields.values().stream().filter(f -> !f.isAlwaysVisible()).count();
        log.info("Consolidated {} field(s) of '{}': {} conditional, summary columns {}",
                fields.size(), context.getFormName(), conditional, summary);

        return new ExplorationResult(ExplorationResult.CURRENT_SCHEMA_VERSION, context.getFormName(),
                Instant.now(), context.routes(), context.tracker().snapshot(), fields, summary);
    }
}
