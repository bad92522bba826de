package formroutes.inference;

import formroutes.explorer.ExplorationContext;
import formroutes.explorer.ExplorerConfig;
import formroutes.explorer.FieldAppearanceTracker;
import formroutes.explorer.MockFormObserver;
import formroutes.explorer.TraversalEngine;
import formroutes.model.ConditionClause;
import formroutes.model.FieldObservation;
import formroutes.model.FieldStage;
import formroutes.model.FieldType;
import formroutes.model.HidingCondition;
import formroutes.model.HidingCondition.Confidence;
import formroutes.model.HidingCondition.Operator;
import formroutes.model.Route;
import formroutes.model.RouteIO;
import formroutes.model.TerminalOutcome;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link HidingConditionInferrer}, run on routes produced by
 * exploring synthetic forms.
 */
public class HidingConditionInferrerTest {

    private static ExplorationContext explore(MockFormObserver form) {
        return new TraversalEngine(ExplorerConfig.defaults(), "form").run(form);
    }

    private static MockFormObserver andForm() {
        return new MockFormObserver()
                .select("a", List.of("x", "z"))
                .select("b", List.of("y", "w"))
                .text("f", m -> !("x".equals(m.get("a")) && "y".equals(m.get("b"))));
    }

    private static MockFormObserver orForm() {
        return new MockFormObserver()
                .select("a", List.of("x", "z"))
                .select("b", List.of("y", "w"))
                .text("f", m -> !("x".equals(m.get("a")) || "y".equals(m.get("b"))));
    }

    /** Default route visible; hidden iff a=x AND b=y; c never matters. */
    private static MockFormObserver andFormVisibleByDefault() {
        return new MockFormObserver()
                .select("a", List.of("z", "x"))
                .select("b", List.of("w", "y"))
                .select("c", List.of("p", "q"))
                .text("f", m -> !("x".equals(m.get("a")) && "y".equals(m.get("b"))));
    }

    /** Default route visible; hidden iff a=x OR b=y; c never matters. */
    private static MockFormObserver orFormVisibleByDefault() {
        return new MockFormObserver()
                .select("a", List.of("z", "x"))
                .select("b", List.of("w", "y"))
                .select("c", List.of("p", "q"))
                .text("f", m -> !("x".equals(m.get("a")) || "y".equals(m.get("b"))));
    }

    /** Default route visible; hidden iff a=z; b and c never matter. */
    private static MockFormObserver singleFormVisibleByDefault() {
        return new MockFormObserver()
                .select("a", List.of("x", "z"))
                .select("b", List.of("y", "w"))
                .select("c", List.of("p", "q"))
                .text("f", m -> !"z".equals(m.get("a")));
    }

    private static void assertClassifiesEveryRoute(ExplorationContext ctx, HidingCondition c, String fieldId) {
        for (Route r : ctx.routes()) {
            assertThat(c.isSatisfiedBy(r.stageValues()))
                    .as("%s on route %s (%s) %s", c, r.getRouteId(), r.getName(), r.stageValues())
                    .isEqualTo(!r.hasField(fieldId));
        }
    }

    private static MockFormObserver countryForm() {
        return new MockFormObserver()
                .select("country", List.of("US", "UK"))
                .text("state", m -> "US".equals(m.get("country")))
                .text("county", m -> "UK".equals(m.get("country")));
    }

    // ── AND ───────────────────────────────────────────────────────────────

    @Test(description = "A field hidden only for a combination of two choices gets a proven AND")
    public void testAndConditionIsProven() {
        ExplorationContext ctx = explore(andForm());

        HidingCondition c = new HidingConditionInferrer(ctx).inferCondition("f").orElseThrow();

        assertThat(c.getOperator()).isEqualTo(Operator.AND);
        assertThat(c.getConfidence()).isEqualTo(Confidence.PROVEN);
        assertThat(c.getConditions()).containsExactly(
                new ConditionClause("a", List.of("x")),
                new ConditionClause("b", List.of("y")));
    }

    @Test(description = "A proven AND classifies every recorded route correctly")
    public void testAndConditionIsSound() {
        ExplorationContext ctx = explore(andForm());
        HidingCondition c = new HidingConditionInferrer(ctx).inferCondition("f").orElseThrow();

        for (Route r : ctx.routes()) {
            assertThat(c.isSatisfiedBy(r.stageValues()))
                    .as("route %s (%s)", r.getRouteId(), r.getName())
                    .isEqualTo(!r.hasField("f"));
        }
    }

    @Test(description = "AND is found when the default route shows the field and an unrelated select varies")
    public void testAndConditionWithVisibleDefault() {
        ExplorationContext ctx = explore(andFormVisibleByDefault());

        HidingCondition c = new HidingConditionInferrer(ctx).inferCondition("f").orElseThrow();

        assertThat(ctx.routes()).hasSize(8);
        assertThat(ctx.routes().get(0).hasField("f")).isTrue();
        assertThat(c.getOperator()).isEqualTo(Operator.AND);
        assertThat(c.isProven()).isTrue();
        assertThat(c.getConditions()).containsExactly(
                new ConditionClause("a", List.of("x")),
                new ConditionClause("b", List.of("y")));
        assertClassifiesEveryRoute(ctx, c, "f");
    }

    // ── OR ────────────────────────────────────────────────────────────────

    @Test(description = "A field hidden by either of two choices gets a best-effort OR")
    public void testOrCondition() {
        ExplorationContext ctx = explore(orForm());

        HidingCondition c = new HidingConditionInferrer(ctx).inferCondition("f").orElseThrow();

        assertThat(c.getOperator()).isEqualTo(Operator.OR);
        assertThat(c.isProven()).isFalse();
        assertThat(c.getConditions()).containsExactly(
                new ConditionClause("a", List.of("x")),
                new ConditionClause("b", List.of("y")));
        for (Route r : ctx.routes()) {
            assertThat(c.isSatisfiedBy(r.stageValues())).isEqualTo(!r.hasField("f"));
        }
    }

    @Test(description = "OR is not mistaken for AND when the default route shows the field")
    public void testOrConditionWithVisibleDefault() {
        ExplorationContext ctx = explore(orFormVisibleByDefault());

        HidingCondition c = new HidingConditionInferrer(ctx).inferCondition("f").orElseThrow();

        assertThat(c.getOperator()).isEqualTo(Operator.OR);
        assertThat(c.getConfidence()).isEqualTo(Confidence.BEST_EFFORT);
        assertThat(c.getConditions()).containsExactly(
                new ConditionClause("a", List.of("x")),
                new ConditionClause("b", List.of("y")));
        assertClassifiesEveryRoute(ctx, c, "f");
    }

    @Test(description = "Values committed by default on visible routes never become hiding values")
    public void testDefaultValuesAreVisibleEvidence() {
        ExplorationContext ctx = explore(singleFormVisibleByDefault());

        HidingCondition c = new HidingConditionInferrer(ctx).inferCondition("f").orElseThrow();

        assertThat(c.getOperator()).isEqualTo(Operator.OR);
        assertThat(c.getConditions()).containsExactly(new ConditionClause("a", List.of("z")));
        assertClassifiesEveryRoute(ctx, c, "f");
    }

    // ── Always visible and no evidence ────────────────────────────────────

    @Test(description = "A field present on every route has no hiding condition")
    public void testAlwaysVisible() {
        ExplorationContext ctx = explore(andForm());

        HidingConditionInferrer inferrer = new HidingConditionInferrer(ctx);

        assertThat(inferrer.inferCondition("a")).isEmpty();
        assertThat(inferrer.inferCondition("b")).isEmpty();
        assertThat(inferrer.inferAll()).containsOnlyKeys("f");
    }

    @Test(description = "A single predictor yields a one-clause best-effort OR")
    public void testSinglePredictor() {
        ExplorationContext ctx = explore(new MockFormObserver()
                .checkbox("gift")
                .text("note", m -> !"false".equals(m.get("gift"))));

        HidingCondition c = new HidingConditionInferrer(ctx).inferCondition("note").orElseThrow();

        assertThat(c.getOperator()).isEqualTo(Operator.OR);
        assertThat(c.getConfidence()).isEqualTo(Confidence.BEST_EFFORT);
        assertThat(c.getConditions()).containsExactly(new ConditionClause("gift", List.of("false")));
    }

    @Test(description = "A field hidden without any varied predictor gets an empty best-effort OR")
    public void testHiddenWithoutCandidates() {
        FieldAppearanceTracker tracker = new FieldAppearanceTracker();
        FieldObservation f = new FieldObservation("f", null, "#f", FieldType.TEXT, "v", List.of());
        FieldObservation g = new FieldObservation("g", null, "#g", FieldType.TEXT, "v", List.of());
        Route r1 = new Route("route-001", "base", List.of(FieldStage.committed(f), FieldStage.committed(g)),
                List.of(), TerminalOutcome.succeeded());
        Route r2 = new Route("route-002", "base", List.of(FieldStage.committed(g)),
                List.of(), TerminalOutcome.succeeded());
        tracker.record("f", r1, List.of(), f);
        tracker.record("g", r1, List.of(), g);
        tracker.record("g", r2, List.of(), g);

        HidingConditionInferrer inferrer = new HidingConditionInferrer(List.of(r1, r2), tracker);
        Optional<HidingCondition> c = inferrer.inferCondition("f");

        assertThat(c).isPresent();
        assertThat(c.get().getOperator()).isEqualTo(Operator.OR);
        assertThat(c.get().getConditions()).isEmpty();
        assertThat(c.get().isProven()).isFalse();
        assertThat(c.get().isSatisfiedBy(r2.stageValues())).isFalse();
        assertThat(inferrer.inferCondition("g")).isEmpty();
    }

    // ── Country example ───────────────────────────────────────────────────

    @Test(description = "Country example: state hidden for UK, county hidden for US")
    public void testCountryExample() {
        ExplorationContext ctx = explore(countryForm());

        assertThat(ctx.routes()).hasSize(2);
        Map<String, HidingCondition> all = new HidingConditionInferrer(ctx).inferAll();

        assertThat(all).containsOnlyKeys("state", "county");
        assertThat(all.get("state").getConditions()).containsExactly(new ConditionClause("country", List.of("UK")));
        assertThat(all.get("county").getConditions()).containsExactly(new ConditionClause("country", List.of("US")));
    }

    // ── Idempotence ───────────────────────────────────────────────────────

    @Test(description = "Inference is idempotent and serialises byte-identically")
    public void testIdempotent() throws Exception {
        ExplorationContext ctx = explore(andForm());
        HidingConditionInferrer inferrer = new HidingConditionInferrer(ctx);

        Map<String, HidingCondition> first  = inferrer.inferAll();
        Map<String, HidingCondition> second = new HidingConditionInferrer(ctx).inferAll();

        assertThat(first).isEqualTo(second);
        assertThat(RouteIO.toJson(first)).isEqualTo(RouteIO.toJson(second));
    }
}
