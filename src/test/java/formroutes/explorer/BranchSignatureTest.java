package formroutes.explorer;

import formroutes.model.BranchAction;
import formroutes.model.FieldDescriptor;
import formroutes.model.FieldObservation;
import formroutes.model.FieldStage;
import formroutes.model.FieldType;
import formroutes.model.Stage;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class BranchSignatureTest {

    private final FieldDescriptor country = FieldDescriptor.builder("country")
            .type(FieldType.SELECT).options(List.of("US", "UK")).build();

    private static List<Stage> prefix(String value) {
        return List.of(FieldStage.committed(
                new FieldObservation("gift", null, "#gift", FieldType.CHECKBOX, value, List.of())));
    }

    @Test(description = "Equal prefix and branch give equal signatures")
    public void testStable() {
        assertThat(BranchSignature.of(prefix("true"), BranchAction.select(country, "UK")))
                .isEqualTo(BranchSignature.of(prefix("true"), BranchAction.select(country, "UK")));
    }

    @Test(description = "A different prefix or branch value changes the signature")
    public void testDistinguishes() {
        String base = BranchSignature.of(prefix("true"), BranchAction.select(country, "UK"));

        assertThat(BranchSignature.of(prefix("false"), BranchAction.select(country, "UK"))).isNotEqualTo(base);
        assertThat(BranchSignature.of(prefix("true"), BranchAction.select(country, "US"))).isNotEqualTo(base);
        assertThat(BranchSignature.of(List.of(), BranchAction.select(country, "UK"))).isNotEqualTo(base);
    }
}
