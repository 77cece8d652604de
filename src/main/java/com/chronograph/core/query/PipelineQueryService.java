package com.chronograph.core.query;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.events.EventHistory;
import com.chronograph.core.events.EventStore;
import com.chronograph.core.model.Event;
import com.chronograph.core.model.PipelineSnapshot;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only facade shared by the HTTP API and the MCP tools. All writes go through
 * the ingestion adapters.
 */
@Service
public class PipelineQueryService {

    private final EventStore eventStore;
    private final int defaultLimit;

    public PipelineQueryService(EventStore eventStore, ChronographProperties properties) {
        this.eventStore = eventStore;
        this.defaultLimit = properties.getStore().getDefaultEventLimit();
    }

    public PipelineSnapshot getPipelineStatus() {
        return eventStore.snapshot();
    }

    /**
     * Recent events for an agent.
     *
     * @param agentId agent id or agent type
     * @param label   optional label filter ({@code key=value} or {@code key})
     * @param limit   maximum number of events, most recent kept; null or non-positive uses the default
     */
    public AgentEventsResult getAgentEvents(String agentId, String label, Integer limit) {
        String normalizedLabel = label == null || label.isBlank() ? null : label.trim();
        if (agentId == null || agentId.isBlank()) {
            return AgentEventsResult.notFound("", normalizedLabel);
        }
        EventHistory history = eventStore.eventsFor(agentId, normalizedLabel);
        if (!history.hasAgentEvents()) {
            return AgentEventsResult.notFound(agentId, normalizedLabel);
        }
        int effectiveLimit = limit == null || limit <= 0 ? defaultLimit : limit;
        List<Event> events = history.last(effectiveLimit);
        return AgentEventsResult.found(agentId, normalizedLabel, events);
    }
}
