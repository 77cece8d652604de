package com.chronograph.ingest;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.events.EventStore;
import com.chronograph.core.logging.MdcContext;
import com.chronograph.core.metrics.ChronographMetrics;
import com.chronograph.core.model.Event;
import com.chronograph.core.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ingests lifecycle and tool-use notifications from hook scripts.
 * <p>
 * Never throws: the observed pipeline must not be slowed or broken by this service,
 * so every failure is logged and folded into the returned {@link IngestResult}.
 */
@Service
public class HookReceiver {

    private static final Logger log = LoggerFactory.getLogger(HookReceiver.class);
    static final String SOURCE = "hook";

    private final EventStore eventStore;
    private final ChronographMetrics metrics;
    private final HookEventMapper mapper;

    public HookReceiver(EventStore eventStore, ChronographMetrics metrics, ChronographProperties properties) {
        this.eventStore = eventStore;
        this.metrics = metrics;
        this.mapper = new HookEventMapper(properties.getWatch().getFileName());
    }

    public IngestResult receive(Map<String, Object> body) {
        List<Event> events;
        try {
            events = mapper.map(body);
        } catch (ValidationException e) {
            metrics.recordRejected(SOURCE);
            log.warn("Rejected hook notification: {}", e.getMessage());
            return IngestResult.of(List.of(), e.getProblems());
        } catch (RuntimeException e) {
            log.error("Failed to map hook notification", e);
            return IngestResult.of(List.of(), List.of("internal error: " + e.getClass().getSimpleName()));
        }

        List<String> ids = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Event event : events) {
            MdcContext.setEvent(event);
            try {
                ids.add(eventStore.append(event));
            } catch (ValidationException e) {
                metrics.recordRejected(SOURCE);
                log.warn("Rejected {} event: {}", event.eventType().wireName(), e.getMessage());
                errors.addAll(e.getProblems());
            } catch (RuntimeException e) {
                log.error("Failed to store {} event", event.eventType().wireName(), e);
                errors.add("internal error: " + e.getClass().getSimpleName());
            } finally {
                MdcContext.clear();
            }
        }
        return IngestResult.of(ids, errors);
    }

    /**
     * Entry point for a body that could not even be parsed as JSON.
     */
    public IngestResult rejectUnreadable(String reason) {
        metrics.recordRejected(SOURCE);
        log.warn("Rejected unreadable hook body: {}", reason);
        return IngestResult.of(List.of(), List.of("Invalid JSON body"));
    }
}
