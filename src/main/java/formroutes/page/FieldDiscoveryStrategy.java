package formroutes.page;

import formroutes.model.FieldDescriptor;

import java.util.List;

/**
 * Finds the interactable fields of the current page. A page observer is
 * configured with one strategy; the traversal algorithm is the same
 * whichever strategy supplies the fields.
 *
 * @param <P> page handle the strategy inspects, e.g. a {@code WebDriver}
 */
public interface FieldDiscoveryStrategy<P> {

    /**
     * @param page live page handle
     * @return visible, enterable fields in page order; never null
     */
    List<FieldDescriptor> discover(P page);

    /** Short name used in log messages. */
    String name();
}
