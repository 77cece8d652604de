package com.chronograph.core.derive;

import com.chronograph.core.model.DelegationLink;
import com.chronograph.core.model.DelegationNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Materializes the delegation forest from the current parent links.
 * <p>
 * Roots are participants that were never delegated to: external callers such as
 * {@code user} and {@code main_agent}, and agents with no recorded delegation.
 * Re-targeting can close a cycle; members of a cycle are unreachable from any root,
 * so the first of them in delegation order is promoted to a root to keep every
 * participant visible.
 */
public final class DelegationForestBuilder {

    private DelegationForestBuilder() {}

    /**
     * @param links       winning delegation per child, in first-delegation order
     * @param knownAgents agents with a status card, in first-seen order
     * @return root nodes of the forest
     */
    public static List<DelegationNode> build(Map<String, DelegationLink> links, Collection<String> knownAgents) {
        Set<String> participants = new LinkedHashSet<>();
        Map<String, List<String>> childrenOf = new LinkedHashMap<>();
        for (DelegationLink link : links.values()) {
            participants.add(link.parent());
            participants.add(link.child());
            childrenOf.computeIfAbsent(link.parent(), k -> new ArrayList<>()).add(link.child());
        }
        participants.addAll(knownAgents);

        Set<String> visited = new HashSet<>();
        List<DelegationNode> roots = new ArrayList<>();
        for (String id : participants) {
            if (!links.containsKey(id)) {
                roots.add(materialize(id, links, childrenOf, visited));
            }
        }
        for (String id : participants) {
            if (!visited.contains(id)) {
                roots.add(materialize(id, links, childrenOf, visited));
            }
        }
        return roots;
    }

    private static DelegationNode materialize(String id, Map<String, DelegationLink> links,
                                              Map<String, List<String>> childrenOf, Set<String> visited) {
        visited.add(id);
        List<DelegationNode> children = new ArrayList<>();
        for (String child : childrenOf.getOrDefault(id, List.of())) {
            if (!visited.contains(child)) {
                children.add(materialize(child, links, childrenOf, visited));
            }
        }
        DelegationLink link = links.get(id);
        return link == null
                ? new DelegationNode(id, null, "", null, children)
                : new DelegationNode(id, link.parent(), link.reason(), link.timestamp(), children);
    }
}
