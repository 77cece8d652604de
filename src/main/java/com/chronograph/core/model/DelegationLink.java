package com.chronograph.core.model;

import java.time.Instant;

/**
 * One recorded delegation, in arrival order. Superseded delegations stay in the chain.
 *
 * @param parent    delegating participant
 * @param child     delegated-to agent
 * @param reason    delegation summary
 * @param timestamp commit time of the delegation interaction
 */
public record DelegationLink(String parent, String child, String reason, Instant timestamp) {}
