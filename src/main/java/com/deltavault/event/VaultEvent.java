package com.deltavault.event;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a vault operation has committed. A failed operation publishes nothing,
 * so listeners only ever observe settled state changes.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>VaultMetricsService - deposit/withdraw/rebalance counters</li>
 * </ul>
 */
public class VaultEvent extends ApplicationEvent {

    private final VaultEventType eventType;
    private final Map<String, Object> details;

    public VaultEvent(Object source, VaultEventType eventType, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public VaultEventType getEventType() {
        return eventType;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Typed accessor for a detail entry, e.g. {@code event.detail("assets", BigInteger.class)}.
     */
    public <T> T detail(String key, Class<T> type) {
        return type.cast(details.get(key));
    }

    @Override
    public String toString() {
        return "VaultEvent{" + eventType + ", " + details + "}";
    }
}
