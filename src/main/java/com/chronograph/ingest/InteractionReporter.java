package com.chronograph.ingest;

import com.chronograph.core.events.EventStore;
import com.chronograph.core.logging.MdcContext;
import com.chronograph.core.metrics.ChronographMetrics;
import com.chronograph.core.model.Event;
import com.chronograph.core.model.EventType;
import com.chronograph.core.model.InteractionType;
import com.chronograph.core.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Records interactions reported by pipeline participants: queries, delegations,
 * results, decisions and responses. Unknown interaction types are rejected.
 */
@Service
public class InteractionReporter {

    private static final Logger log = LoggerFactory.getLogger(InteractionReporter.class);

    private final EventStore eventStore;
    private final ChronographMetrics metrics;

    public InteractionReporter(EventStore eventStore, ChronographMetrics metrics) {
        this.eventStore = eventStore;
        this.metrics = metrics;
    }

    /**
     * @param producer metrics tag naming the transport ("rpc" or "hook")
     */
    public InteractionReceipt report(String source, String target, String summary, String interactionType,
                                     Map<String, String> labels, String sessionId, String nonce,
                                     String producer) {
        if (InteractionType.fromWire(interactionType).isEmpty()) {
            metrics.recordRejected(producer);
            String error = "Unknown interaction_type '" + interactionType + "'. Valid types: "
                    + InteractionType.wireNames();
            log.warn("Rejected interaction {} -> {}: {}", source, target, error);
            return InteractionReceipt.rejected(error);
        }

        Event event = Event.builder(EventType.INTERACTION)
                .sessionId(sessionId)
                .source(source)
                .target(target)
                .payload(Event.SUMMARY, summary)
                .payload(Event.INTERACTION_TYPE, InteractionType.fromWire(interactionType).get().wireName())
                .labels(labels)
                .nonce(nonce)
                .build();

        MdcContext.setEvent(event);
        try {
            String id = eventStore.append(event);
            log.debug("Recorded {} interaction {} -> {}", interactionType, source, target);
            return InteractionReceipt.recorded(id);
        } catch (ValidationException e) {
            metrics.recordRejected(producer);
            log.warn("Rejected interaction {} -> {}: {}", source, target, e.getMessage());
            return InteractionReceipt.rejected(e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    public InteractionReceipt report(String source, String target, String summary, String interactionType,
                                     Map<String, String> labels) {
        return report(source, target, summary, interactionType, labels, null, null, "rpc");
    }

    /**
     * Records an interaction posted over HTTP in the hook body shape.
     */
    public InteractionReceipt reportFromHook(Map<String, Object> body) {
        return report(
                HookEventMapper.text(body, "source"),
                HookEventMapper.text(body, "target"),
                HookEventMapper.text(body, "summary"),
                HookEventMapper.text(body, "interaction_type"),
                HookEventMapper.stringMap(body.get("labels")),
                HookEventMapper.text(body, "session_id"),
                blankToNull(HookEventMapper.text(body, "nonce")),
                HookReceiver.SOURCE);
    }

    private static String blankToNull(String value) {
        return value.isBlank() ? null : value;
    }
}
