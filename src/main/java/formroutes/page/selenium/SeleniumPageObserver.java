package formroutes.page.selenium;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import formroutes.explorer.ExplorationException;
import formroutes.explorer.ExplorerConfig;
import formroutes.explorer.ValueSuggester;
import formroutes.model.FieldDescriptor;
import formroutes.model.FieldType;
import formroutes.model.InteractionStage;
import formroutes.model.PrimitiveAction;
import formroutes.model.RouteIO;
import formroutes.model.StateHandle;
import formroutes.model.TerminalOutcome;
import formroutes.page.FieldDiscoveryStrategy;
import formroutes.page.PageObserver;
import formroutes.page.StateRestoreException;
import org.openqa.selenium.Alert;
import org.openqa.selenium.By;
import org.openqa.selenium.NoAlertPresentException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.support.ui.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * {@link PageObserver} over a live browser session.
 *
 * <p>State handles carry the page URL plus, as their token, the journal of
 * actions performed since the page was loaded; restoring reloads the URL and
 * replays the journal, since a reload alone drops typed values and
 * selections.
 *
 * <p>Before each discovery and before the next/save controls are used,
 * native alerts, extra windows and visible modal dialogs are dismissed and
 * reported through {@link #drainInteractions()}.
 */
public class SeleniumPageObserver implements PageObserver {

    private static final Logger log = LoggerFactory.getLogger(SeleniumPageObserver.class);

    private static final TypeReference<List<PrimitiveAction>> JOURNAL_TYPE = new TypeReference<>() {};

    /** Controls that may act as "next" or "save". */
    private static final By CLICKABLES = By.cssSelector(
            "button, input[type='submit'], input[type='button'], a[role='button'], [role='button']");

    /** Elements whose text is reported as a validation message after saving. */
    private static final List<By> ERROR_LOCATORS = List.of(
            By.cssSelector(".error"),
            By.cssSelector(".error-message"),
            By.cssSelector(".invalid-feedback"),
            By.cssSelector(".validation-error"),
            By.cssSelector(".text-danger"),
            By.cssSelector("[role='alert']"),
            By.cssSelector("[aria-invalid='true']")
    );

    /** Visible modal overlays. */
    private static final List<By> MODAL_LOCATORS = List.of(
            By.cssSelector("[role='dialog']:not([aria-hidden='true'])"),
            By.cssSelector("[role='alertdialog']"),
            By.cssSelector(".modal.show"),
            By.cssSelector(".modal.in"),
            By.cssSelector("[data-modal='true']")
    );

    private static final By MODAL_CLOSE = By.cssSelector(
            ".close, .btn-close, [aria-label='Close'], [data-dismiss='modal'], [data-bs-dismiss='modal']");

    private static final By REQUIRED_INPUTS = By.cssSelector(
            "input[required], textarea[required], input[aria-required='true'], textarea[aria-required='true'],"
                    + " input[aria-invalid='true'], textarea[aria-invalid='true']");

    private final WebDriver driver;
    private final ExplorerConfig config;
    private final FieldDiscoveryStrategy<WebDriver> discovery;
    private final PageWaits waits;
    private final ValueSuggester suggester = new ValueSuggester();
    private final String mainWindow;

    /** Actions performed since the current page was loaded. */
    private final List<PrimitiveAction> journal = new ArrayList<>();

    private final List<InteractionStage> interactions = new ArrayList<>();

    // ── Construction ──────────────────────────────────────────────────────

    public SeleniumPageObserver(WebDriver driver, ExplorerConfig config) {
        this(driver, config, new HeuristicFieldDiscovery());
    }

    public SeleniumPageObserver(WebDriver driver, ExplorerConfig config,
                                FieldDiscoveryStrategy<WebDriver> discovery) {
        this(driver, config, discovery, new PageWaits(driver, config.getWaitSec()));
    }

    /** Package-private constructor for unit tests; accepts a pre-built wait helper. */
    SeleniumPageObserver(WebDriver driver, ExplorerConfig config,
                         FieldDiscoveryStrategy<WebDriver> discovery, PageWaits waits) {
        this.driver     = driver;
        this.config     = config;
        this.discovery  = discovery;
        this.waits      = waits;
        this.mainWindow = driver.getWindowHandle();
    }

    // ── PageObserver ──────────────────────────────────────────────────────

    @Override
    public List<FieldDescriptor> currentInteractableFields() {
        dismissPopups();
        return discovery.discover(driver);
    }

    @Override
    public boolean performAction(PrimitiveAction action) {
        try {
            switch (action.getKind()) {
                case CLICK, TOGGLE -> find(action.getLocatorHint()).click();
                case SELECT_BY_TEXT -> new Select(find(action.getLocatorHint())).selectByVisibleText(action.getValue());
                case SET_VALUE -> {
                    WebElement el = find(action.getLocatorHint());
                    el.clear();
                    el.sendKeys(action.getValue());
                }
                case HOVER -> new Actions(driver).moveToElement(find(action.getLocatorHint())).perform();
                case SWITCH_FRAME -> {
                    if (action.getLocatorHint() == null || action.getLocatorHint().isBlank()) {
                        driver.switchTo().defaultContent();
                    } else {
                        driver.switchTo().frame(find(action.getLocatorHint()));
                    }
                }
                case WAIT -> waits.pause(Long.parseLong(action.getValue()));
            }
            journal.add(action);
            return true;
        } catch (WebDriverException | IllegalArgumentException e) {
            log.debug("{} failed: {}", action, firstLine(e.getMessage()));
            return false;
        }
    }

    @Override
    public StateHandle captureStateHandle() {
        try {
            return new StateHandle(driver.getCurrentUrl(), RouteIO.getMapper().writeValueAsString(journal));
        } catch (JsonProcessingException e) {
            throw new ExplorationException("Cannot encode action journal", e);
        }
    }

    @Override
    public void restoreState(StateHandle handle) {
        try {
            driver.get(handle.url());
            waits.waitForPageLoad();
            journal.clear();
            for (PrimitiveAction action : decodeJournal(handle)) {
                if (!performAction(action)) {
                    throw new StateRestoreException(handle, "replay of " + action + " failed");
                }
            }
            log.debug("Restored {} ({} action(s) replayed)", handle.url(), journal.size());
        } catch (StateRestoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StateRestoreException(handle, e);
        }
    }

    @Override
    public boolean advanceIfPossible() {
        dismissPopups();
        WebElement next = lowestClickable(config.getNextKeywords());
        if (next == null) return false;

        String hint = ElementHints.hintFor(next);
        String before = driver.getCurrentUrl();
        try {
            next.click();
        } catch (WebDriverException e) {
            log.warn("Could not click next control {}: {}", hint, firstLine(e.getMessage()));
            return false;
        }
        settle();

        List<String> errors = collectErrors();
        if (!errors.isEmpty()) {
            log.info("Next control {} did not advance: {}", hint, errors);
            return false;
        }
        if (before != null && !before.equals(driver.getCurrentUrl())) {
            journal.clear();
        } else {
            journal.add(PrimitiveAction.click(hint));
        }
        return true;
    }

    @Override
    public TerminalOutcome attemptTerminalAction() {
        dismissPopups();
        WebElement save = lowestClickable(config.getSaveKeywords());
        if (save == null) {
            log.info("No save control found on {}", driver.getCurrentUrl());
            return TerminalOutcome.notAttempted();
        }
        String hint = ElementHints.hintFor(save);
        if (!clickHint(hint)) return TerminalOutcome.notAttempted();

        List<String> errors = collectErrors();
        if (errors.isEmpty()) return TerminalOutcome.succeeded();

        log.info("Save reported {} error(s): {}", errors.size(), errors);
        if (autoFix(errors) > 0 && clickHint(hint)) {
            errors = collectErrors();
            if (errors.isEmpty()) return TerminalOutcome.succeeded();
        }
        return TerminalOutcome.failed(errors);
    }

    @Override
    public List<InteractionStage> drainInteractions() {
        List<InteractionStage> out = List.copyOf(interactions);
        interactions.clear();
        return out;
    }

    // ── Popups ────────────────────────────────────────────────────────────

    void dismissPopups() {
        dismissAlert();
        closeExtraWindows();
        dismissModal();
    }

    private void dismissAlert() {
        try {
            Alert alert = driver.switchTo().alert();
            String text = alert.getText();
            alert.dismiss();
            log.info("Dismissed native alert: '{}'", text);
            interactions.add(new InteractionStage("dismiss alert", List.of()));
        } catch (NoAlertPresentException e) {
            log.trace("No native alert open");
        } catch (WebDriverException e) {
            log.debug("Alert check failed: {}", firstLine(e.getMessage()));
        }
    }

    private void closeExtraWindows() {
        try {
            Set<String> handles = driver.getWindowHandles();
            if (handles == null || handles.size() <= 1) return;
            for (String h : handles) {
                if (!h.equals(mainWindow)) {
                    driver.switchTo().window(h);
                    driver.close();
                }
            }
            driver.switchTo().window(mainWindow);
            log.info("Closed {} extra window(s)", handles.size() - 1);
            interactions.add(new InteractionStage("close extra windows", List.of()));
        } catch (WebDriverException e) {
            log.debug("Window check failed: {}", firstLine(e.getMessage()));
        }
    }

    private void dismissModal() {
        for (By locator : MODAL_LOCATORS) {
            try {
                for (WebElement modal : driver.findElements(locator)) {
                    if (!modal.isDisplayed()) continue;
                    for (WebElement close : modal.findElements(MODAL_CLOSE)) {
                        if (!close.isDisplayed()) continue;
                        String hint = ElementHints.hintFor(close);
                        close.click();
                        log.info("Dismissed modal matching {}", locator);
                        interactions.add(new InteractionStage("dismiss modal",
                                List.of(PrimitiveAction.click(hint))));
                        return;
                    }
                }
            } catch (WebDriverException e) {
                log.debug("Modal check for {} failed: {}", locator, firstLine(e.getMessage()));
            }
        }
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private WebElement find(String hint) {
        return driver.findElement(ElementHints.toBy(hint));
    }

    private List<PrimitiveAction> decodeJournal(StateHandle handle) {
        if (handle.token() == null || handle.token().isBlank()) return List.of();
        try {
            return RouteIO.getMapper().readValue(handle.token(), JOURNAL_TYPE);
        } catch (JsonProcessingException e) {
            throw new StateRestoreException(handle, e);
        }
    }

    /** The displayed, enabled control matching a keyword that sits lowest on the page. */
    private WebElement lowestClickable(List<String> keywords) {
        WebElement best = null;
        int bestY = Integer.MIN_VALUE;
        for (WebElement el : driver.findElements(CLICKABLES)) {
            try {
                if (!el.isDisplayed() || !el.isEnabled()) continue;
                String text = (el.getText() + " " + nullToEmpty(el.getAttribute("value")))
                        .toLowerCase(Locale.ROOT);
                if (keywords.stream().noneMatch(text::contains)) continue;
                int y = el.getLocation() == null ? 0 : el.getLocation().getY();
                if (best == null || y > bestY) {
                    best = el;
                    bestY = y;
                }
            } catch (WebDriverException e) {
                log.debug("Skipping control: {}", firstLine(e.getMessage()));
            }
        }
        return best;
    }

    private boolean clickHint(String hint) {
        try {
            find(hint).click();
        } catch (WebDriverException e) {
            log.warn("Could not click {}: {}", hint, firstLine(e.getMessage()));
            return false;
        }
        settle();
        return true;
    }

    private void settle() {
        try {
            waits.waitForPageLoad();
        } catch (ExplorationException e) {
            log.warn("{}", e.getMessage());
        }
    }

    List<String> collectErrors() {
        Set<String> out = new LinkedHashSet<>();
        for (By locator : ERROR_LOCATORS) {
            try {
                for (WebElement el : driver.findElements(locator)) {
                    if (!el.isDisplayed()) continue;
                    String text = el.getText() == null ? "" : el.getText().trim();
                    if (!text.isEmpty()) out.add(text);
                }
            } catch (WebDriverException e) {
                log.debug("Error lookup {} failed: {}", locator, firstLine(e.getMessage()));
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Fills empty required or invalid inputs, and empty inputs whose label is
     * named in an error message, with suggested values.
     *
     * @return number of fields filled
     */
    int autoFix(List<String> errors) {
        String allErrors = String.join(" ", errors).toLowerCase(Locale.ROOT);
        Set<WebElement> targets = new LinkedHashSet<>(driver.findElements(REQUIRED_INPUTS));
        for (FieldDescriptor f : discovery.discover(driver)) {
            if (f.getFieldType().isFreeText() && f.getLabel() != null
                    && allErrors.contains(f.getLabel().toLowerCase(Locale.ROOT))) {
                targets.addAll(driver.findElements(ElementHints.toBy(f.getLocatorHint())));
            }
        }

        int filled = 0;
        for (WebElement el : targets) {
            try {
                if (!el.isDisplayed() || !nullToEmpty(el.getAttribute("value")).isEmpty()) continue;
                FieldType type = FieldType.fromHtml(el.getTagName(), el.getAttribute("type"));
                if (!type.isFreeText()) continue;
                String value = suggester.suggest(type, el.getAttribute("aria-label"), el.getAttribute("name"));
                el.clear();
                el.sendKeys(value);
                filled++;
            } catch (WebDriverException e) {
                log.debug("Auto-fix skipped a field: {}", firstLine(e.getMessage()));
            }
        }
        if (filled > 0) log.info("Auto-filled {} field(s) after validation errors - retrying save", filled);
        return filled;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String firstLine(String message) {
        if (message == null) return "";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
