package formroutes.explorer;

import formroutes.model.FieldAppearance;
import formroutes.model.FieldObservation;
import formroutes.model.FieldType;
import formroutes.model.Route;
import formroutes.model.TerminalOutcome;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class FieldAppearanceTrackerTest {

    private static Route route(String id) {
        return new Route(id, id, List.of(), List.of(), TerminalOutcome.notAttempted());
    }

    private static FieldObservation obs(String fieldId) {
        return new FieldObservation(fieldId, null, "#" + fieldId, FieldType.TEXT, "v", List.of());
    }

    @Test(description = "Field ids keep encounter order and only observed fields are present")
    public void testFieldIdsInEncounterOrder() {
        FieldAppearanceTracker tracker = new FieldAppearanceTracker();
        tracker.record("z", route("r1"), List.of(), obs("z"));
        tracker.record("a", route("r1"), List.of(), obs("a"));
        tracker.record("z", route("r2"), List.of(), obs("z"));

        assertThat(tracker.fieldIds()).containsExactly("z", "a");
        assertThat(tracker.contains("a")).isTrue();
        assertThat(tracker.contains("missing")).isFalse();
        assertThat(tracker.appearances("missing")).isEmpty();
    }

    @Test(description = "routesWithoutField returns the complement in route order")
    public void testRoutesWithoutField() {
        FieldAppearanceTracker tracker = new FieldAppearanceTracker();
        Route r1 = route("r1");
        Route r2 = route("r2");
        Route r3 = route("r3");
        tracker.record("f", r2, List.of(), obs("f"));

        assertThat(tracker.routesWithField("f")).containsExactly("r2");
        assertThat(tracker.routesWithoutField("f", List.of(r1, r2, r3))).containsExactly("r1", "r3");
    }

    @Test(description = "snapshot is detached from later recordings")
    public void testSnapshotIsCopy() {
        FieldAppearanceTracker tracker = new FieldAppearanceTracker();
        tracker.record("f", route("r1"), List.of(), obs("f"));
        Map<String, List<FieldAppearance>> snapshot = tracker.snapshot();
        tracker.record("f", route("r2"), List.of(), obs("f"));

        assertThat(snapshot.get("f")).hasSize(1);
        assertThat(tracker.appearances("f")).hasSize(2);
    }
}
