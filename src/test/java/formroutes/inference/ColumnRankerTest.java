package formroutes.inference;

import formroutes.model.ConsolidatedField;
import formroutes.model.FieldObservation;
import formroutes.model.FieldType;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class ColumnRankerTest {

    private static ConsolidatedField field(String id, String label) {
        FieldObservation rep = new FieldObservation(id, label, "#" + id, FieldType.TEXT, "v", List.of());
        return new ConsolidatedField(id, label, rep, List.of(), null,
                ColumnRanker.score(ColumnRanker.normalize(label)));
    }

    @Test(description = "Names are lower-cased with whitespace replaced by underscores")
    public void testNormalize() {
        assertThat(ColumnRanker.normalize("  Order   Status ")).isEqualTo("order_status");
        assertThat(ColumnRanker.normalize(null)).isEmpty();
    }

    @Test(description = "Keyword group weights are summed")
    public void testScore() {
        assertThat(ColumnRanker.score("project_name")).isEqualTo(100);
        assertThat(ColumnRanker.score("name_type")).isEqualTo(180);
        assertThat(ColumnRanker.score("start_date")).isEqualTo(60);
        assertThat(ColumnRanker.score("contact_email")).isEqualTo(50);
        assertThat(ColumnRanker.score("order_status")).isEqualTo(70);
        assertThat(ColumnRanker.score("remarks")).isZero();
    }

    @Test(description = "Synonyms within a keyword group count once")
    public void testGroupedKeywordsCountOnce() {
        assertThat(ColumnRanker.score("name_title")).isEqualTo(100);
        assertThat(ColumnRanker.score("status_state")).isEqualTo(70);
        assertThat(ColumnRanker.score("title_status_state")).isEqualTo(170);

        List<ConsolidatedField> fields = new ArrayList<>(List.of(
                field("display", "Name title"),
                field("name", "Name"),
                field("kind", "Type")));
        assertThat(new ColumnRanker(2).rank(fields)).containsExactly("display", "name");
    }

    @Test(description = "rank keeps the top positive scores, ties in encounter order")
    public void testRank() {
        List<ConsolidatedField> fields = new ArrayList<>(List.of(
                field("remarks", "Remarks"),
                field("email", "Email"),
                field("kind", "Type"),
                field("title", "Title"),
                field("name", "Name"),
                field("status", "Status")));

        assertThat(new ColumnRanker(3).rank(fields)).containsExactly("title", "name", "kind");
        assertThat(new ColumnRanker(10).rank(fields))
                .containsExactly("title", "name", "kind", "status", "email");
    }
}
