package com.chronograph.core.events;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.derive.DelegationForestBuilder;
import com.chronograph.core.derive.DerivationEngine;
import com.chronograph.core.metrics.ChronographMetrics;
import com.chronograph.core.model.AgentStatusCard;
import com.chronograph.core.model.DelegationLink;
import com.chronograph.core.model.DelegationNode;
import com.chronograph.core.model.Event;
import com.chronograph.core.model.EventType;
import com.chronograph.core.model.PipelineSnapshot;
import com.chronograph.core.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single source of truth for the ordered event log and its derived views.
 * <p>
 * Every producer funnels through {@link #append}. One lock guards the log, the
 * de-dup index and the derived-view cache. While holding it, {@code append} updates
 * the touched card and delegation link and enqueues the event into every live
 * subscription, so readers and subscribers observe exactly the commit order.
 * No I/O happens under the lock. Readers get copies, never live references.
 */
@Service
public class EventStore {

    private static final Logger log = LoggerFactory.getLogger(EventStore.class);

    private final EventBroadcaster broadcaster;
    private final ChronographMetrics metrics;
    private final Clock clock;
    private final int recentEventLimit;
    private final Duration orphanGracePeriod;

    private final ReentrantLock lock = new ReentrantLock();

    /** Append-only log in commit order. */
    private final List<Event> events = new ArrayList<>();

    private final Map<DedupKey, String> dedupIndex = new HashMap<>();

    /** Derived cards keyed by agent key, in first-seen order. */
    private final LinkedHashMap<String, AgentStatusCard> cards = new LinkedHashMap<>();

    /** Winning delegation per child, in first-delegation order. */
    private final LinkedHashMap<String, DelegationLink> delegations = new LinkedHashMap<>();

    private final List<DelegationLink> delegationChain = new ArrayList<>();
    private final List<Event> interactions = new ArrayList<>();
    private long lastSequence;

    @Autowired
    public EventStore(EventBroadcaster broadcaster, ChronographMetrics metrics, ChronographProperties properties) {
        this(broadcaster, metrics, Clock.systemUTC(),
                properties.getStore().getRecentEventLimit(),
                properties.getStore().getOrphanGracePeriod());
    }

    EventStore(EventBroadcaster broadcaster, ChronographMetrics metrics, Clock clock,
               int recentEventLimit, Duration orphanGracePeriod) {
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.clock = clock;
        this.recentEventLimit = recentEventLimit;
        this.orphanGracePeriod = orphanGracePeriod;
    }

    /**
     * Commits an event and returns its id. A retried delivery with a de-dup key that was
     * already committed is a no-op returning the original id.
     *
     * @throws ValidationException if the event is missing fields required for its type
     */
    public String append(Event event) {
        if (event == null) {
            throw new ValidationException("event is required");
        }
        event.validate();
        Optional<DedupKey> key = DedupKey.of(event);

        lock.lock();
        try {
            if (key.isPresent()) {
                String existing = dedupIndex.get(key.get());
                if (existing != null) {
                    metrics.recordDuplicate(event.eventType().wireName());
                    log.debug("Duplicate {} delivery ignored, returning {}", event.eventType().wireName(), existing);
                    return existing;
                }
            }

            Event committed = event.commit(UUID.randomUUID().toString(), ++lastSequence, Instant.now(clock));
            events.add(committed);
            key.ifPresent(k -> dedupIndex.put(k, committed.eventId()));
            derive(committed);
            broadcaster.fanOut(committed);

            metrics.recordAppended(committed.eventType().wireName());
            log.debug("Committed {} #{} for {}", committed.eventType().wireName(), committed.sequence(),
                    committed.eventType() == EventType.INTERACTION
                            ? committed.source() + "->" + committed.target()
                            : committed.agentKey());
            return committed.eventId();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a consistent point-in-time view of cards, hierarchy and timeline.
     */
    public PipelineSnapshot snapshot() {
        List<AgentStatusCard> cardCopy;
        Map<String, DelegationLink> linkCopy;
        List<DelegationLink> chainCopy;
        List<Event> interactionCopy;
        List<Event> recent;
        int count;
        long sequence;
        Instant now;

        lock.lock();
        try {
            now = Instant.now(clock);
            cardCopy = new ArrayList<>(cards.size());
            for (AgentStatusCard card : cards.values()) {
                var state = DerivationEngine.effectiveState(card, now, orphanGracePeriod);
                cardCopy.add(state == card.lifecycleState() ? card : card.withState(state, card.lastUpdateTimestamp()));
            }
            linkCopy = new LinkedHashMap<>(delegations);
            chainCopy = List.copyOf(delegationChain);
            interactionCopy = List.copyOf(interactions);
            count = events.size();
            recent = List.copyOf(events.subList(Math.max(0, count - recentEventLimit), count));
            sequence = lastSequence;
        } finally {
            lock.unlock();
        }

        List<DelegationNode> forest = DelegationForestBuilder.build(linkCopy,
                cardCopy.stream().map(AgentStatusCard::agentId).toList());
        return new PipelineSnapshot(cardCopy, forest, chainCopy, interactionCopy, count, recent, sequence, now);
    }

    /**
     * Raw events concerning an agent, matched by agent id or agent type, in commit order.
     *
     * @param agentId     agent id or agent type
     * @param labelFilter optional {@code key=value} or {@code key} expression
     */
    public EventHistory eventsFor(String agentId, String labelFilter) {
        List<Event> matching = new ArrayList<>();
        lock.lock();
        try {
            for (Event event : events) {
                if (event.eventType() != EventType.INTERACTION
                        && (agentId.equals(event.agentId()) || agentId.equals(event.agentType()))) {
                    matching.add(event);
                }
            }
        } finally {
            lock.unlock();
        }
        return new EventHistory(matching, LabelFilter.parse(labelFilter));
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public long lastSequence() {
        lock.lock();
        try {
            return lastSequence;
        } finally {
            lock.unlock();
        }
    }

    private void derive(Event committed) {
        DerivationEngine.cardKey(committed, cards).ifPresent(cardKey -> {
            AgentStatusCard current = cards.get(cardKey);
            Optional<String> placeholder = DerivationEngine.placeholderKey(committed, cards);
            if (current == null && placeholder.isPresent()) {
                current = cards.remove(placeholder.get()).rekeyed(cardKey);
                log.debug("Placeholder card {} taken over by {}", placeholder.get(), cardKey);
            }
            DerivationEngine.applyToCard(current, cardKey, committed)
                    .ifPresent(card -> cards.put(cardKey, card));
        });

        if (committed.eventType() == EventType.INTERACTION) {
            interactions.add(committed);
            DerivationEngine.delegation(committed).ifPresent(link -> {
                DelegationLink previous = delegations.put(link.child(), link);
                if (previous != null && !previous.parent().equals(link.parent())) {
                    log.info("Agent {} re-delegated from {} to {}", link.child(), previous.parent(), link.parent());
                }
                delegationChain.add(link);
            });
        }
    }
}
