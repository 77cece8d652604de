package com.chronograph.core.events;

import com.chronograph.core.model.Event;
import com.chronograph.core.model.EventType;

import java.util.Optional;

/**
 * Identity of a producer delivery, used to make retried appends idempotent.
 * Interactions use {@code source->target} in place of the agent key.
 */
record DedupKey(String sessionId, String participant, EventType eventType, String nonce) {

    /**
     * @return the key, or empty when the producer supplied no nonce (such events are never de-duplicated)
     */
    static Optional<DedupKey> of(Event event) {
        if (event.nonce() == null || event.nonce().isBlank()) {
            return Optional.empty();
        }
        String participant = event.eventType() == EventType.INTERACTION
                ? event.source() + "->" + event.target()
                : event.agentKey();
        return Optional.of(new DedupKey(event.sessionId(), participant, event.eventType(), event.nonce()));
    }
}
