package formroutes.page.selenium;

import formroutes.model.FieldDescriptor;
import formroutes.model.FieldType;
import formroutes.page.FieldDiscoveryStrategy;
import org.openqa.selenium.By;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * DOM scan for visible, enabled {@code input}, {@code select} and
 * {@code textarea} elements. Radio buttons sharing a {@code name} become one
 * field whose options are their values.
 */
public class HeuristicFieldDiscovery implements FieldDiscoveryStrategy<WebDriver> {

    private static final Logger log = LoggerFactory.getLogger(HeuristicFieldDiscovery.class);

    private static final By CONTROLS = By.cssSelector("input, select, textarea");

    /** Input types that are not data fields. */
    private static final Set<String> IGNORED_INPUT_TYPES =
            Set.of("hidden", "submit", "button", "reset", "image", "file");

    @Override
    public List<FieldDescriptor> discover(WebDriver driver) {
        List<FieldDescriptor> out = new ArrayList<>();
        Map<String, FieldDescriptor.Builder> radioGroups = new LinkedHashMap<>();
        Map<String, Integer> radioSlots = new LinkedHashMap<>();
        int index = 0;

        for (WebElement el : driver.findElements(CONTROLS)) {
            index++;
            try {
                if (!el.isDisplayed() || !el.isEnabled()) continue;
                String tag  = el.getTagName().toLowerCase(Locale.ROOT);
                String type = attr(el, "type").toLowerCase(Locale.ROOT);
                if ("input".equals(tag) && IGNORED_INPUT_TYPES.contains(type)) continue;

                FieldType fieldType = FieldType.fromHtml(tag, type);
                if (fieldType == FieldType.RADIO) {
                    addRadio(driver, el, radioGroups, radioSlots, out);
                    continue;
                }
                String fieldId = fieldId(el, index);
                FieldDescriptor.Builder b = FieldDescriptor.builder(fieldId)
                        .label(labelFor(driver, el))
                        .locatorHint(ElementHints.hintFor(el))
                        .type(fieldType)
                        .required(isRequired(el));
                if (fieldType == FieldType.SELECT) {
                    Select select = new Select(el);
                    for (WebElement option : select.getOptions()) {
                        String text = option.getText().trim();
                        if (!text.isEmpty() && !attr(option, "value").isEmpty()) b.option(text, null);
                    }
                    List<WebElement> selected = select.getAllSelectedOptions();
                    if (!selected.isEmpty()) b.currentValue(selected.get(0).getText().trim());
                } else if (fieldType == FieldType.CHECKBOX) {
                    b.currentValue(String.valueOf(el.isSelected()));
                } else {
                    b.currentValue(attr(el, "value"));
                }
                out.add(b.build());
            } catch (StaleElementReferenceException e) {
                log.debug("Element went stale during discovery - skipped");
            }
        }

        // Radio groups are placed where their first button appeared.
        List<Map.Entry<String, Integer>> slots = new ArrayList<>(radioSlots.entrySet());
        for (int i = slots.size() - 1; i >= 0; i--) {
            Map.Entry<String, Integer> slot = slots.get(i);
            out.add(Math.min(slot.getValue(), out.size()), radioGroups.get(slot.getKey()).build());
        }
        log.debug("Heuristic discovery found {} field(s)", out.size());
        return out;
    }

    @Override
    public String name() {
        return "heuristic";
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void addRadio(WebDriver driver, WebElement el, Map<String, FieldDescriptor.Builder> groups,
                          Map<String, Integer> slots, List<FieldDescriptor> out) {
        String group = attr(el, "name");
        if (group.isEmpty()) group = fieldId(el, out.size() + 1);
        String value = attr(el, "value");
        if (value.isEmpty()) value = labelFor(driver, el);

        FieldDescriptor.Builder b = groups.get(group);
        if (b == null) {
            b = FieldDescriptor.builder(group)
                    .label(groupLabel(el, group))
                    .locatorHint("input[type='radio'][name='" + group + "']")
                    .type(FieldType.RADIO)
                    .required(isRequired(el));
            groups.put(group, b);
            slots.put(group, out.size());
        }
        b.option(value, ElementHints.radioHint(group, value));
        if (el.isSelected()) b.currentValue(value);
    }

    private static String fieldId(WebElement el, int index) {
        String id = attr(el, "id");
        if (!id.isEmpty()) return id;
        String name = attr(el, "name");
        if (!name.isEmpty()) return name;
        return "field_" + index;
    }

    private static String labelFor(WebDriver driver, WebElement el) {
        String id = attr(el, "id");
        if (!id.isEmpty()) {
            List<WebElement> labels = driver.findElements(By.cssSelector("label[for='" + id + "']"));
            if (!labels.isEmpty() && !labels.get(0).getText().isBlank()) {
                return labels.get(0).getText().trim();
            }
        }
        String aria = attr(el, "aria-label");
        if (!aria.isEmpty()) return aria;
        String placeholder = attr(el, "placeholder");
        if (!placeholder.isEmpty()) return placeholder;
        return attr(el, "name");
    }

    /** Legend of the enclosing fieldset, else the group name. */
    private static String groupLabel(WebElement el, String group) {
        List<WebElement> legends = el.findElements(By.xpath("ancestor::fieldset[1]/legend"));
        if (!legends.isEmpty() && !legends.get(0).getText().isBlank()) {
            return legends.get(0).getText().trim();
        }
        return group;
    }

    private static boolean isRequired(WebElement el) {
        return el.getAttribute("required") != null || "true".equalsIgnoreCase(attr(el, "aria-required"));
    }

    private static String attr(WebElement el, String name) {
        String v = el.getAttribute(name);
        return v == null ? "" : v.trim();
    }
}
