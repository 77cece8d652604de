package com.chronograph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derived per-agent projection of the event log. Never mutated in place: every
 * change produces a new card via the {@code with*} methods.
 *
 * @param agentId             agent key the card is indexed by
 * @param agentType           agent role, empty until a start or phase line names it
 * @param sessionId           owning session, empty when unknown
 * @param lifecycleState      current lifecycle state
 * @param currentPhase        last phase name seen from a progress line (nullable)
 * @param phase               last phase number seen
 * @param totalPhases         declared number of phases
 * @param lastMessage         last human-readable message for the agent
 * @param labels              merged labels from start events and progress lines
 * @param startedAt           commit time of the agent_start event (nullable)
 * @param stoppedAt           commit time of the agent_stop event (nullable)
 * @param startObserved       whether an agent_start was ever recorded
 * @param lastUpdateTimestamp commit time of the last event that touched the card
 */
public record AgentStatusCard(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("agent_type") String agentType,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("lifecycle_state") LifecycleState lifecycleState,
        @JsonProperty("current_phase") String currentPhase,
        int phase,
        @JsonProperty("total_phases") int totalPhases,
        @JsonProperty("last_message") String lastMessage,
        Map<String, String> labels,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("stopped_at") Instant stoppedAt,
        @JsonProperty("start_observed") boolean startObserved,
        @JsonProperty("last_update_timestamp") Instant lastUpdateTimestamp
) {

    public AgentStatusCard {
        agentType = agentType == null ? "" : agentType;
        sessionId = sessionId == null ? "" : sessionId;
        lastMessage = lastMessage == null ? "" : lastMessage;
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /** A fresh card in {@link LifecycleState#SPAWNED}. */
    public static AgentStatusCard spawned(String agentId, String agentType, String sessionId, Instant at) {
        return new AgentStatusCard(agentId, agentType, sessionId, LifecycleState.SPAWNED,
                null, 0, 0, "", Map.of(), at, null, true, at);
    }

    /** A card for an agent only known from a progress line. */
    public static AgentStatusCard placeholder(String agentId, String agentType, Instant at) {
        return new AgentStatusCard(agentId, agentType, "", LifecycleState.RUNNING,
                null, 0, 0, "", Map.of(), null, null, false, at);
    }

    public AgentStatusCard withState(LifecycleState state, Instant at) {
        return new AgentStatusCard(agentId, agentType, sessionId, state, currentPhase, phase, totalPhases,
                lastMessage, labels, startedAt, stoppedAt, startObserved, at);
    }

    public AgentStatusCard withStart(String type, String session, Map<String, String> extraLabels, Instant at) {
        Map<String, String> merged = new LinkedHashMap<>(labels);
        if (extraLabels != null) {
            merged.putAll(extraLabels);
        }
        return new AgentStatusCard(agentId, type == null || type.isBlank() ? agentType : type,
                session == null || session.isBlank() ? sessionId : session,
                lifecycleState, currentPhase, phase, totalPhases, lastMessage, merged,
                startedAt != null ? startedAt : at, stoppedAt, true, at);
    }

    /** The same card indexed under another agent key. */
    public AgentStatusCard rekeyed(String newAgentId) {
        return new AgentStatusCard(newAgentId, agentType, sessionId, lifecycleState, currentPhase, phase,
                totalPhases, lastMessage, labels, startedAt, stoppedAt, startObserved, lastUpdateTimestamp);
    }

    public AgentStatusCard withStop(LifecycleState state, String message, Instant at) {
        return new AgentStatusCard(agentId, agentType, sessionId, state, currentPhase, phase, totalPhases,
                message == null || message.isBlank() ? lastMessage : message, labels,
                startedAt, at, startObserved, at);
    }

    public AgentStatusCard withPhase(String name, int number, int total, String message,
                                     Map<String, String> extraLabels, Instant at) {
        Map<String, String> merged = new LinkedHashMap<>(labels);
        if (extraLabels != null) {
            merged.putAll(extraLabels);
        }
        return new AgentStatusCard(agentId, agentType, sessionId, lifecycleState, name, number, total,
                message == null || message.isBlank() ? lastMessage : message, merged,
                startedAt, stoppedAt, startObserved, at);
    }

    public AgentStatusCard touched(Instant at) {
        return withState(lifecycleState, at);
    }
}
