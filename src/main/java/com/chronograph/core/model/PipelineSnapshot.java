package com.chronograph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Consistent point-in-time view of the pipeline, copied out of the event store.
 *
 * @param agents           status cards in first-seen order
 * @param delegationForest root nodes of the delegation hierarchy
 * @param delegationChain  every delegation in arrival order
 * @param interactions     interaction timeline in commit order
 * @param eventCount       number of events in the log
 * @param recentEvents     most recent events, oldest first
 * @param lastSequence     sequence of the last committed event, 0 when empty
 * @param takenAt          when the snapshot was taken
 */
public record PipelineSnapshot(
        List<AgentStatusCard> agents,
        @JsonProperty("delegation_forest") List<DelegationNode> delegationForest,
        @JsonProperty("delegation_chain") List<DelegationLink> delegationChain,
        List<Event> interactions,
        @JsonProperty("event_count") int eventCount,
        @JsonProperty("recent_events") List<Event> recentEvents,
        @JsonProperty("last_sequence") long lastSequence,
        @JsonProperty("taken_at") Instant takenAt
) {

    public PipelineSnapshot {
        agents = List.copyOf(agents);
        delegationForest = List.copyOf(delegationForest);
        delegationChain = List.copyOf(delegationChain);
        interactions = List.copyOf(interactions);
        recentEvents = List.copyOf(recentEvents);
    }

    public Optional<AgentStatusCard> agent(String agentId) {
        return agents.stream().filter(a -> a.agentId().equals(agentId)).findFirst();
    }

    /**
     * Finds a node anywhere in the forest.
     */
    public Optional<DelegationNode> node(String agentId) {
        for (DelegationNode root : delegationForest) {
            DelegationNode match = root.find(agentId);
            if (match != null) {
                return Optional.of(match);
            }
        }
        return Optional.empty();
    }
}
