package formroutes.page.selenium;

import formroutes.explorer.ExplorationException;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Explicit waits used by the Selenium observer. Implicit waits are never
 * set, so every timeout goes through this class.
 */
public class PageWaits {

    private static final Logger log = LoggerFactory.getLogger(PageWaits.class);

    private final WebDriverWait wait;
    private final int timeoutSec;

    /**
     * @param driver     active WebDriver session
     * @param timeoutSec maximum time to wait for any condition
     */
    public PageWaits(WebDriver driver, int timeoutSec) {
        this.timeoutSec = timeoutSec;
        this.wait = new WebDriverWait(driver, Duration.ofSeconds(timeoutSec));
    }

    /**
     * Waits until the browser reports {@code document.readyState == 'complete'}.
     *
     * @throws ExplorationException if the page does not finish loading in time
     */
    public void waitForPageLoad() {
        log.debug("Waiting up to {}s for page load (document.readyState == complete)", timeoutSec);
        try {
            wait.until(d -> "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
        } catch (Exception e) {
            throw new ExplorationException(
                    "Timed out after " + timeoutSec + "s waiting for page to finish loading", e);
        }
    }

    /**
     * Waits until the element is visible and enabled.
     *
     * @throws ExplorationException if the element is not clickable in time
     */
    public WebElement waitForClickable(By locator) {
        log.debug("Waiting up to {}s for element CLICKABLE: {}", timeoutSec, locator);
        try {
            return wait.until(ExpectedConditions.elementToBeClickable(locator));
        } catch (Exception e) {
            throw new ExplorationException(
                    "Timed out after " + timeoutSec + "s waiting for element to be clickable: " + locator, e);
        }
    }

    /** Sleeps for {@code millis}; used by {@code WAIT} actions. */
    public void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExplorationException("Interrupted while waiting", e);
        }
    }
}
