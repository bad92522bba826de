package formroutes.cli;

import formroutes.explorer.ExplorationException;
import formroutes.explorer.ExplorerConfig;
import formroutes.explorer.TraversalEngine;
import formroutes.model.ConsolidatedField;
import formroutes.model.ExplorationResult;
import formroutes.model.RouteIO;
import formroutes.page.selenium.SeleniumPageObserver;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI entry-point of the form route explorer.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code formroutes explore}: explore a live form and write its routes and field model</li>
 *   <li>{@code formroutes summarize}: print the field model of a saved result</li>
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 bad input, 2 exploration aborted.
 */
@Command(
        name        = "formroutes",
        description = "Explores dynamic web forms and infers when each field is hidden",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                ExplorerCLI.ExploreCommand.class,
                ExplorerCLI.SummarizeCommand.class
        }
)
public class ExplorerCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new ExplorerCLI()).execute(args);
        System.exit(exit);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Opens a form in a fresh browser, explores every route and writes the result.
     */
    @Command(
            name        = "explore",
            description = "Explore a form and record every route",
            mixinStandardHelpOptions = true
    )
    static class ExploreCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ExploreCommand.class);

        @Parameters(index = "0", description = "URL of the form page")
        String url;

        @Option(
                names       = {"-n", "--form-name"},
                description = "Name of the form, used in file and entity names (default: form_page)",
                defaultValue = "form_page"
        )
        String formName;

        @Option(
                names       = {"-b", "--browser"},
                description = "Browser to use: edge, chrome, firefox (default: edge)",
                defaultValue = "edge"
        )
        String browser;

        @Option(
                names       = {"-o", "--output-dir"},
                description = "Output directory (default: explorer.output.dir)"
        )
        Path outputDir;

        @Option(
                names       = {"--max-routes"},
                description = "Upper bound on recorded routes (default: explorer.max.routes)"
        )
        Integer maxRoutes;

        @Override
        public Integer call() throws Exception {
            if (url == null || !(url.startsWith("http://") || url.startsWith("https://") || url.startsWith("file:"))) {
                System.err.println("Not a form URL: " + url);
                return 1;
            }
            if (maxRoutes != null && maxRoutes <= 0) {
                System.err.println("--max-routes must be positive");
                return 1;
            }

            ExplorerConfig config = new ExplorerConfig();
            if (maxRoutes != null) config.setMaxRoutes(maxRoutes);
            Path dir = outputDir != null ? outputDir : Path.of(config.getOutputDir());

            System.out.printf("Starting %s WebDriver (Selenium Manager auto-downloads driver)...%n",
                    browser.toLowerCase(Locale.ROOT));
            WebDriver driver = createDriver(browser);
            try {
                driver.get(url);
                SeleniumPageObserver observer = new SeleniumPageObserver(driver, config);
                ExplorationResult result = new TraversalEngine(config, formName).explore(observer);
                Path written = RouteIO.writeAll(result, dir);

                System.out.printf("%nExploration complete: %d route(s), %d field(s)%n",
                        result.getRoutes().size(), result.getFields().size());
                System.out.printf("  Result : %s%n", written.toAbsolutePath());
                return 0;
            } catch (ExplorationException e) {
                log.error("Exploration aborted", e);
                System.err.println("Exploration aborted: " + e.getMessage());
                return 2;
            } finally {
                driver.quit();
            }
        }

        /**
         * Creates a WebDriver for the requested browser. Selenium Manager
         * downloads the matching browser driver.
         */
        private WebDriver createDriver(String browser) {
            return switch (browser.toLowerCase(Locale.ROOT).trim()) {
                case "chrome" -> {
                    ChromeOptions opts = new ChromeOptions();
                    opts.addArguments("--start-maximized");
                    yield new ChromeDriver(opts);
                }
                case "firefox" -> new FirefoxDriver(new FirefoxOptions());
                default -> {
                    EdgeOptions opts = new EdgeOptions();
                    opts.addArguments("--start-maximized");
                    yield new EdgeDriver(opts);
                }
            };
        }
    }

    /**
     * Prints each field of a saved result with its hiding condition.
     */
    @Command(
            name        = "summarize",
            description = "Print the field model of a saved exploration result",
            mixinStandardHelpOptions = true
    )
    static class SummarizeCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to <form>_result.json")
        Path resultFile;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(resultFile)) {
                System.err.println("Result file not found: " + resultFile.toAbsolutePath());
                return 1;
            }
            ExplorationResult result;
            try {
                result = RouteIO.read(resultFile);
            } catch (RouteIO.SchemaValidationException | RouteIO.SchemaVersionException e) {
                System.err.println("Invalid result file: " + e.getMessage());
                return 1;
            }
            print(result, System.out);
            return 0;
        }

        static void print(ExplorationResult result, PrintStream out) {
            out.printf("Form    : %s%n", result.getFormName());
            out.printf("Routes  : %d%n", result.getRoutes().size());
            out.printf("Summary : %s%n%n", String.join(", ", result.getSummaryColumns()));
            for (ConsolidatedField f : result.getFields().values()) {
                String when = f.isAlwaysVisible()
                        ? "always visible"
                        : "hidden when " + f.getHidingCondition();
                out.printf("  %-24s %-9s %s%n", f.getFieldId(), f.getFieldType(), when);
            }
        }
    }
}
