package com.chronograph.core.derive;

import com.chronograph.core.model.AgentStatusCard;
import com.chronograph.core.model.DelegationLink;
import com.chronograph.core.model.Event;
import com.chronograph.core.model.EventType;
import com.chronograph.core.model.LifecycleState;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * Side-effect-free derivation of status cards and delegation links from single events.
 * <p>
 * Each event touches at most one card and one link, so the store applies these
 * functions incrementally instead of replaying the log. All methods expect a
 * committed event (identity and timestamp assigned).
 */
public final class DerivationEngine {

    private DerivationEngine() {}

    /**
     * Determines which card an event belongs to.
     * <p>
     * Phase lines from the progress log only name the agent role, so they resolve to the
     * card with that exact key, then to the most recently started live card of that type,
     * and finally to the role name itself (which becomes a placeholder card).
     *
     * @param event committed event
     * @param cards current cards keyed by agent key
     * @return the card key, or empty for events that never touch a card
     */
    public static Optional<String> cardKey(Event event, Map<String, AgentStatusCard> cards) {
        EventType type = event.eventType();
        if (type == EventType.INTERACTION) {
            return Optional.empty();
        }
        String key = event.agentKey();
        if (type != EventType.PHASE_TRANSITION || !event.agentId().isBlank() || cards.containsKey(key)) {
            return key.isBlank() ? Optional.empty() : Optional.of(key);
        }
        return cards.values().stream()
                .filter(c -> c.agentType().equals(event.agentType()))
                .filter(c -> !c.lifecycleState().isTerminal())
                .max(Comparator.comparing(AgentStatusCard::startedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(AgentStatusCard::agentId)
                .or(() -> Optional.of(key));
    }

    /**
     * Finds the placeholder a start event takes over.
     * <p>
     * A phase line that arrives before its agent's start creates a placeholder keyed by
     * the agent type. When the start arrives with a distinct agent id, the placeholder's
     * phase progress moves to the started card and the placeholder disappears.
     *
     * @return the placeholder's key, or empty when there is nothing to take over
     */
    public static Optional<String> placeholderKey(Event event, Map<String, AgentStatusCard> cards) {
        if (event.eventType() != EventType.AGENT_START) {
            return Optional.empty();
        }
        String type = event.agentType();
        String key = event.agentKey();
        if (type.isBlank() || type.equals(key) || cards.containsKey(key)) {
            return Optional.empty();
        }
        AgentStatusCard candidate = cards.get(type);
        if (candidate == null || candidate.startObserved() || candidate.lifecycleState().isTerminal()) {
            return Optional.empty();
        }
        return Optional.of(type);
    }

    /**
     * Computes the next version of a card.
     *
     * @param current existing card, or null when none exists for {@code key}
     * @param key     card key from {@link #cardKey}
     * @param event   committed event
     * @return the new card, or empty when the event leaves the card set untouched
     */
    public static Optional<AgentStatusCard> applyToCard(AgentStatusCard current, String key, Event event) {
        Instant at = event.timestamp();
        return switch (event.eventType()) {
            case AGENT_START -> Optional.of(onStart(current, key, event, at));
            case AGENT_STOP -> Optional.of(onStop(current, key, event, at));
            case ERROR -> Optional.of(onError(current, key, event, at));
            case PHASE_TRANSITION -> Optional.of(onPhase(current, key, event, at));
            case TOOL_USE -> Optional.ofNullable(current).map(c -> c.touched(at));
            case INTERACTION -> Optional.empty();
        };
    }

    /**
     * Extracts the parent link a delegation interaction establishes.
     */
    public static Optional<DelegationLink> delegation(Event event) {
        if (!event.isDelegation()) {
            return Optional.empty();
        }
        return Optional.of(new DelegationLink(event.source(), event.target(),
                event.payloadString(Event.SUMMARY).orElse(""), event.timestamp()));
    }

    /**
     * Lifecycle state as reported to readers. A live card with no update for longer than
     * {@code gracePeriod} is surfaced as orphaned; a zero or negative period disables this.
     */
    public static LifecycleState effectiveState(AgentStatusCard card, Instant now, Duration gracePeriod) {
        LifecycleState state = card.lifecycleState();
        if (gracePeriod == null || gracePeriod.isZero() || gracePeriod.isNegative() || state.isTerminal()) {
            return state;
        }
        Instant deadline = card.lastUpdateTimestamp().plus(gracePeriod);
        return now.isAfter(deadline) ? LifecycleState.ORPHANED : state;
    }

    private static AgentStatusCard onStart(AgentStatusCard current, String key, Event event, Instant at) {
        if (current == null) {
            return AgentStatusCard.spawned(key, event.agentType(), event.sessionId(), at)
                    .withStart(event.agentType(), event.sessionId(), event.labels(), at)
                    .withState(LifecycleState.RUNNING, at);
        }
        if (current.lifecycleState().isTerminal()) {
            return current.touched(at);
        }
        return current.withStart(event.agentType(), event.sessionId(), event.labels(), at)
                .withState(LifecycleState.RUNNING, at);
    }

    private static AgentStatusCard onStop(AgentStatusCard current, String key, Event event, Instant at) {
        String message = event.payloadString(Event.MESSAGE).orElse("");
        if (current == null) {
            return new AgentStatusCard(key, event.agentType(), event.sessionId(), LifecycleState.ORPHANED,
                    null, 0, 0, message, Map.of(), null, at, false, at);
        }
        if (current.lifecycleState().isTerminal()) {
            return current.touched(at);
        }
        if (!current.startObserved()) {
            return current.withStop(LifecycleState.ORPHANED, message, at);
        }
        boolean failed = event.payloadString(Event.STATUS)
                .filter(s -> s.equalsIgnoreCase(LifecycleState.FAILED.wireName()))
                .isPresent();
        return current.withStop(failed ? LifecycleState.FAILED : LifecycleState.COMPLETED, message, at);
    }

    private static AgentStatusCard onError(AgentStatusCard current, String key, Event event, Instant at) {
        String message = event.payloadString(Event.MESSAGE).orElse("");
        if (current == null) {
            return new AgentStatusCard(key, event.agentType(), event.sessionId(), LifecycleState.FAILED,
                    null, 0, 0, message, Map.of(), null, at, false, at);
        }
        if (current.lifecycleState().isTerminal()) {
            return current.touched(at);
        }
        return current.withStop(LifecycleState.FAILED, message, at);
    }

    private static AgentStatusCard onPhase(AgentStatusCard current, String key, Event event, Instant at) {
        AgentStatusCard base = current != null ? current : AgentStatusCard.placeholder(key, event.agentType(), at);
        return base.withPhase(
                event.payloadString(Event.PHASE_NAME).orElse(null),
                event.payloadInt(Event.PHASE),
                event.payloadInt(Event.TOTAL_PHASES),
                event.payloadString(Event.MESSAGE).orElse(""),
                event.labels(),
                at);
    }
}
