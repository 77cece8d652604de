package com.chronograph.core.logging;

import com.chronograph.core.model.Event;
import org.slf4j.MDC;

/**
 * Utility for managing chronograph MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEvent(Event event) {
        put("sessionId", event.sessionId());
        put("agentId", event.agentKey());
        put("eventType", event.eventType() != null ? event.eventType().wireName() : null);
    }

    public static void setSubscription(String subscriptionId) {
        MDC.put("subscriptionId", subscriptionId);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("agentId");
        MDC.remove("eventType");
        MDC.remove("subscriptionId");
    }

    private static void put(String key, String value) {
        if (value == null || value.isBlank()) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
