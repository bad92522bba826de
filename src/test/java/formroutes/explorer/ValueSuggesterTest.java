package formroutes.explorer;

import formroutes.model.FieldDescriptor;
import formroutes.model.FieldType;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.*;

public class ValueSuggesterTest {

    private final ValueSuggester suggester = new ValueSuggester();

    @Test(description = "Suggestions follow the field's label, name and type")
    public void testSuggestions() {
        assertThat(suggester.suggest(FieldType.TEXT, "Contact Email", "contact")).isEqualTo("alice.cohen@example.com");
        assertThat(suggester.suggest(FieldType.TEL, null, "mobile")).isEqualTo("2025550123");
        assertThat(suggester.suggest(FieldType.NUMBER, "Quantity", "qty")).isEqualTo("1000");
        assertThat(suggester.suggest(FieldType.TEXT, "First name", "fname")).isEqualTo("Alice");
        assertThat(suggester.suggest(FieldType.TEXT, "Surname", "sn")).isEqualTo("Cohen");
        assertThat(suggester.suggest(FieldType.DATE, "Start", "start")).isEqualTo("2025-01-01");
        assertThat(suggester.suggest(FieldType.TEXT, "City", "city")).isEqualTo("Springfield");
        assertThat(suggester.suggest(FieldType.TEXTAREA, "Billing address", "addr")).isEqualTo("123 Main St");
        assertThat(suggester.suggest(FieldType.TEXT, "Remarks", "remarks")).isEqualTo("TestValue");
    }

    @Test(description = "Entity name fields are free-text name/title fields that are not person names")
    public void testEntityNameDetection() {
        assertThat(suggester.isEntityNameField(FieldDescriptor.builder("project_name").build())).isTrue();
        assertThat(suggester.isEntityNameField(
                FieldDescriptor.builder("t1").label("Title").type(FieldType.TEXTAREA).build())).isTrue();
        assertThat(suggester.isEntityNameField(
                FieldDescriptor.builder("first_name").label("First name").build())).isFalse();
        assertThat(suggester.isEntityNameField(
                FieldDescriptor.builder("name").type(FieldType.SELECT).build())).isFalse();
        assertThat(suggester.isEntityNameField(FieldDescriptor.builder("notes").build())).isFalse();
    }
}
