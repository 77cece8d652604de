package com.chronograph.core.query;

import com.chronograph.core.model.Event;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Answer to an agent-history query. An unknown agent is an expected condition and
 * yields {@code status = "not_found"} with no events rather than an error.
 *
 * @param status  "ok" or "not_found"
 * @param agentId the queried agent id or type
 * @param label   the label filter applied (null when none)
 * @param events  matching events, oldest first
 */
public record AgentEventsResult(
        String status,
        @JsonProperty("agent_id") String agentId,
        String label,
        List<Event> events
) {

    public static final String OK = "ok";
    public static final String NOT_FOUND = "not_found";

    public AgentEventsResult {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static AgentEventsResult found(String agentId, String label, List<Event> events) {
        return new AgentEventsResult(OK, agentId, label, events);
    }

    public static AgentEventsResult notFound(String agentId, String label) {
        return new AgentEventsResult(NOT_FOUND, agentId, label, List.of());
    }

    @JsonIgnore
    public boolean isFound() {
        return OK.equals(status);
    }
}
