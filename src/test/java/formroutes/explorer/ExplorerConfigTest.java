package formroutes.explorer;

import org.testng.annotations.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ExplorerConfig}.
 *
 * <p>Uses the package-private {@code ExplorerConfig(Properties)} constructor
 * so no classpath file is read.
 */
public class ExplorerConfigTest {

    @Test(description = "All accessors return documented defaults when properties are empty")
    public void testAllDefaults() {
        ExplorerConfig cfg = new ExplorerConfig(new Properties());

        assertThat(cfg.getMaxRoutes()).as("maxRoutes default").isEqualTo(500);
        assertThat(cfg.getMaxStepsPerRoute()).as("maxStepsPerRoute default").isEqualTo(20);
        assertThat(cfg.getSummaryColumns()).as("summaryColumns default").isEqualTo(5);
        assertThat(cfg.getEntityPrefix()).as("entityPrefix default").isEqualTo("tested_");
        assertThat(cfg.isFillNameField()).as("fillNameField default").isTrue();
        assertThat(cfg.getNextKeywords()).contains("next", "continue");
        assertThat(cfg.getSaveKeywords()).contains("save", "submit");
        assertThat(cfg.getWaitSec()).isEqualTo(10);
        assertThat(cfg.getOutputDir()).isEqualTo("form-routes");
    }

    @Test(description = "Integer and string properties are read and trimmed")
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty("explorer.max.routes", " 12 ");
        p.setProperty("explorer.summary.columns", "3");
        p.setProperty("explorer.entity.prefix", "  qa_  ");
        p.setProperty("explorer.fill.name.field", "false");
        p.setProperty("explorer.output.dir", " /tmp/routes ");

        ExplorerConfig cfg = new ExplorerConfig(p);

        assertThat(cfg.getMaxRoutes()).isEqualTo(12);
        assertThat(cfg.getSummaryColumns()).isEqualTo(3);
        assertThat(cfg.getEntityPrefix()).isEqualTo("qa_");
        assertThat(cfg.isFillNameField()).isFalse();
        assertThat(cfg.getOutputDir()).isEqualTo("/tmp/routes");
    }

    @Test(description = "Invalid or non-positive integers fall back to defaults")
    public void testInvalidIntegersFallBack() {
        Properties p = new Properties();
        p.setProperty("explorer.max.routes", "lots");
        p.setProperty("explorer.max.steps.per.route", "-4");
        p.setProperty("explorer.wait.sec", "0");

        ExplorerConfig cfg = new ExplorerConfig(p);

        assertThat(cfg.getMaxRoutes()).isEqualTo(500);
        assertThat(cfg.getMaxStepsPerRoute()).isEqualTo(20);
        assertThat(cfg.getWaitSec()).isEqualTo(10);
    }

    @Test(description = "Keyword lists are lower-cased, trimmed and de-duplicated")
    public void testKeywordLists() {
        Properties p = new Properties();
        p.setProperty("explorer.next.keywords", " Next , WEITER,next,, ");

        assertThat(new ExplorerConfig(p).getNextKeywords()).containsExactly("next", "weiter");
    }

    @Test(description = "setMaxRoutes overrides the configured cap")
    public void testSetMaxRoutes() {
        ExplorerConfig cfg = ExplorerConfig.defaults();
        cfg.setMaxRoutes(7);

        assertThat(cfg.getMaxRoutes()).isEqualTo(7);
    }

    @Test(description = "The classpath config.properties loads without error")
    public void testClasspathLoad() {
        ExplorerConfig cfg = new ExplorerConfig();

        assertThat(cfg.getMaxRoutes()).isPositive();
        assertThat(cfg.getSaveKeywords()).isNotEmpty();
    }
}
