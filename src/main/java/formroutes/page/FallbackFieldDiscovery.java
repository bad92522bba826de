package formroutes.page;

import formroutes.model.FieldDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tries a primary strategy (typically an assisted one supplied by the
 * caller) and falls back to a second one when the primary throws or finds
 * nothing.
 */
public class FallbackFieldDiscovery<P> implements FieldDiscoveryStrategy<P> {

    private static final Logger log = LoggerFactory.getLogger(FallbackFieldDiscovery.class);

    private final FieldDiscoveryStrategy<P> primary;
    private final FieldDiscoveryStrategy<P> fallback;

    public FallbackFieldDiscovery(FieldDiscoveryStrategy<P> primary, FieldDiscoveryStrategy<P> fallback) {
        this.primary  = primary;
        this.fallback = fallback;
    }

    @Override
    public List<FieldDescriptor> discover(P page) {
        try {
            List<FieldDescriptor> fields = primary.discover(page);
            if (fields != null && !fields.isEmpty()) {
                return fields;
            }
            log.debug("{} found no fields, falling back to {}", primary.name(), fallback.name());
        } catch (RuntimeException e) {
            log.warn("{} discovery failed ({}), falling back to {}",
                    primary.name(), e.getMessage(), fallback.name());
        }
        return fallback.discover(page);
    }

    @Override
    public String name() {
        return primary.name() + "+" + fallback.name();
    }
}
