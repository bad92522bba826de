package formroutes.explorer;

import formroutes.model.FieldObservation;
import formroutes.model.FieldStage;
import formroutes.model.FieldType;
import formroutes.model.InteractionStage;
import formroutes.model.Precondition;
import formroutes.model.PrimitiveAction;
import formroutes.model.Route;
import formroutes.model.Stage;
import formroutes.model.TerminalOutcome;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class RouteRecorderTest {

    private ExplorationContext context;
    private RouteRecorder recorder;

    @BeforeMethod
    public void setUp() {
        context  = new ExplorationContext("orders");
        recorder = new RouteRecorder();
    }

    private static Stage field(String id, String value) {
        return FieldStage.committed(new FieldObservation(id, id, "#" + id, FieldType.TEXT, value, List.of()));
    }

    @Test(description = "Routes get sequential ids, are appended and indexed")
    public void testRecordAppendsAndIndexes() {
        Route first  = recorder.record(context, List.of(field("a", "1")), List.of(), TerminalOutcome.succeeded());
        Route second = recorder.record(context, List.of(field("a", "2"), field("b", "x")),
                List.of(new Precondition("a", "2")), TerminalOutcome.succeeded());

        assertThat(first.getRouteId()).isEqualTo("route-001");
        assertThat(second.getRouteId()).isEqualTo("route-002");
        assertThat(context.routes()).containsExactly(first, second);
        assertThat(context.tracker().routesWithField("a")).containsExactly("route-001", "route-002");
        assertThat(context.tracker().routesWithField("b")).containsExactly("route-002");
        assertThat(context.tracker().appearances("b").get(0).preconditions())
                .containsExactly(new Precondition("a", "2"));
    }

    @Test(description = "A field observed twice on one route is indexed once")
    public void testRepeatedFieldIndexedOnce() {
        recorder.record(context, List.of(field("a", "1"), field("a", "2")), List.of(), TerminalOutcome.notAttempted());

        assertThat(context.tracker().appearances("a")).hasSize(1);
    }

    @Test(description = "Interaction stages are kept but never indexed")
    public void testInteractionStagesNotIndexed() {
        Stage hover = new InteractionStage("open menu", List.of(new PrimitiveAction(PrimitiveAction.Kind.HOVER, "#menu", null)));

        Route r = recorder.record(context, List.of(hover, field("a", "1")), List.of(), TerminalOutcome.succeeded());

        assertThat(r.getStages()).hasSize(2);
        assertThat(context.tracker().fieldIds()).containsExactly("a");
    }

    @Test(description = "Route names list the branch choices, or 'base' when there are none")
    public void testRouteName() {
        assertThat(RouteRecorder.routeName(List.of())).isEqualTo("base");
        assertThat(RouteRecorder.routeName(List.of(new Precondition("country", "UK"), new Precondition("gift", "false"))))
                .isEqualTo("country=UK, gift=false");
    }
}
