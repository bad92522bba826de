package formroutes.inference;

import formroutes.explorer.ExplorationContext;
import formroutes.explorer.ExplorerConfig;
import formroutes.explorer.MockFormObserver;
import formroutes.explorer.TraversalEngine;
import formroutes.model.ConsolidatedField;
import formroutes.model.ExplorationResult;
import formroutes.model.FieldType;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class ConsolidatedFieldBuilderTest {

    private ExplorationContext ctx;

    @BeforeMethod
    public void setUp() {
        MockFormObserver form = new MockFormObserver()
                .select("country", List.of("US", "UK", "FR"))
                .radio("plan", List.of("pro", "basic"))
                .text("state", m -> "US".equals(m.get("country")))
                .text("project_name", "Project name", m -> true);
        ctx = new TraversalEngine(ExplorerConfig.defaults(), "projects").run(form);
    }

    @Test(description = "Fields are consolidated in encounter order with a representative observation")
    public void testEncounterOrderAndRepresentative() {
        Map<String, ConsolidatedField> fields =
                new ConsolidatedFieldBuilder(new HidingConditionInferrer(ctx)).build(ctx);

        assertThat(fields.keySet()).containsExactly("country", "plan", "state", "project_name");
        assertThat(fields.get("country").getRepresentative().getValue()).isEqualTo("US");
        assertThat(fields.get("project_name").getName()).isEqualTo("Project name");
        assertThat(fields.get("project_name").getFieldType()).isEqualTo(FieldType.TEXT);
    }

    @Test(description = "Enumerable fields list every observed value, sorted; free text lists none")
    public void testOptions() {
        Map<String, ConsolidatedField> fields =
                new ConsolidatedFieldBuilder(new HidingConditionInferrer(ctx)).build(ctx);

        assertThat(fields.get("country").getOptions()).containsExactly("FR", "UK", "US");
        assertThat(fields.get("plan").getOptions()).containsExactly("basic", "pro");
        assertThat(fields.get("state").getOptions()).isEmpty();
    }

    @Test(description = "Hiding conditions are attached; always-visible fields have none")
    public void testConditionsAttached() {
        Map<String, ConsolidatedField> fields =
                new ConsolidatedFieldBuilder(new HidingConditionInferrer(ctx)).build(ctx);

        assertThat(fields.get("country").isAlwaysVisible()).isTrue();
        assertThat(fields.get("project_name").isAlwaysVisible()).isTrue();
        assertThat(fields.get("state").isAlwaysVisible()).isFalse();
        assertThat(fields.get("state").getHidingCondition().getConditions().get(0).hidingValues())
                .containsExactly("FR", "UK");
    }

    @Test(description = "FieldConsolidation exposes summary columns and the appearance index")
    public void testFieldConsolidation() {
        ExplorationResult result = new FieldConsolidation(2).consolidate(ctx);

        assertThat(result.getFormName()).isEqualTo("projects");
        assertThat(result.getRoutes()).hasSize(ctx.routeCount());
        assertThat(result.getSummaryColumns()).containsExactly("project_name", "state");
        assertThat(result.getAppearances()).containsOnlyKeys("country", "plan", "state", "project_name");
        assertThat(result.getCompletedAt()).isNotNull();
    }
}
