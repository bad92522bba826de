package formroutes.page.selenium;

import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds and resolves the locator hints stored in recorded routes.
 * A hint is a CSS selector, or an XPath when it starts with {@code /} or {@code (}.
 */
public final class ElementHints {

    private static final Pattern CSS_IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private ElementHints() {}

    /** Most stable hint for an element: id, then name, then tag plus first class. */
    public static String hintFor(WebElement element) {
        String tag = element.getTagName() == null ? "*" : element.getTagName().toLowerCase(Locale.ROOT);
        String id = element.getAttribute("id");
        if (id != null && !id.isBlank()) {
            return CSS_IDENT.matcher(id).matches() ? "#" + id : "[id='" + escape(id) + "']";
        }
        String name = element.getAttribute("name");
        if (name != null && !name.isBlank()) {
            return tag + "[name='" + escape(name) + "']";
        }
        String cls = element.getAttribute("class");
        if (cls != null && !cls.isBlank()) {
            String first = cls.trim().split("\\s+")[0];
            if (CSS_IDENT.matcher(first).matches()) return tag + "." + first;
        }
        return tag;
    }

    /** Hint of one radio button in a group. */
    public static String radioHint(String groupName, String value) {
        return "input[type='radio'][name='" + escape(groupName) + "'][value='" + escape(value) + "']";
    }

    public static By toBy(String hint) {
        if (hint == null || hint.isBlank()) {
            throw new IllegalArgumentException("Empty locator hint");
        }
        String h = hint.trim();
        return h.startsWith("/") || h.startsWith("(") ? By.xpath(h) : By.cssSelector(h);
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("'", "\\'");
    }
}
