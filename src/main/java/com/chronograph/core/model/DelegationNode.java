package com.chronograph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Node of the reconstructed delegation forest.
 *
 * @param agentId     participant this node stands for
 * @param parent      participant that delegated to this one most recently, null for roots
 *                    that were never delegated to
 * @param summary     summary of the winning delegation (empty for roots)
 * @param delegatedAt commit time of the winning delegation (null for roots)
 * @param children    participants this one delegated to, in delegation order
 */
public record DelegationNode(
        @JsonProperty("agent_id") String agentId,
        String parent,
        String summary,
        @JsonProperty("delegated_at") Instant delegatedAt,
        List<DelegationNode> children
) {

    public DelegationNode {
        summary = summary == null ? "" : summary;
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Depth-first search for a node by id within this subtree.
     */
    public DelegationNode find(String id) {
        if (agentId.equals(id)) {
            return this;
        }
        for (DelegationNode child : children) {
            DelegationNode match = child.find(id);
            if (match != null) {
                return match;
            }
        }
        return null;
    }
}
