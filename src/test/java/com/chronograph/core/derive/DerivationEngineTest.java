package com.chronograph.core.derive;

import com.chronograph.core.model.AgentStatusCard;
import com.chronograph.core.model.Event;
import com.chronograph.core.model.EventType;
import com.chronograph.core.model.InteractionType;
import com.chronograph.core.model.LifecycleState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DerivationEngine}.
 */
class DerivationEngineTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private long sequence;

    private Event commit(Event event, Instant at) {
        return event.commit("evt-" + (sequence + 1), ++sequence, at);
    }

    private AgentStatusCard apply(AgentStatusCard current, Event committed) {
        return DerivationEngine.applyToCard(current, committed.agentKey(), committed).orElseThrow();
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("start creates a running card with the start observed")
        void startCreatesRunningCard() {
            var card = apply(null, commit(Event.agentStart("s1", "a-1", "researcher"), T0));

            assertEquals("a-1", card.agentId());
            assertEquals("researcher", card.agentType());
            assertEquals(LifecycleState.RUNNING, card.lifecycleState());
            assertTrue(card.startObserved());
            assertEquals(T0, card.startedAt());
        }

        @Test
        @DisplayName("stop after start completes the card")
        void stopCompletes() {
            var started = apply(null, commit(Event.agentStart("s1", "a-1", "researcher"), T0));
            var stopped = apply(started, commit(Event.agentStop("s1", "a-1", "researcher"), T0.plusSeconds(5)));

            assertEquals(LifecycleState.COMPLETED, stopped.lifecycleState());
            assertEquals(T0.plusSeconds(5), stopped.stoppedAt());
        }

        @Test
        @DisplayName("stop with failed status fails the card")
        void stopWithFailedStatus() {
            var started = apply(null, commit(Event.agentStart("s1", "a-1", "coder"), T0));
            var stop = Event.builder(EventType.AGENT_STOP).agentId("a-1").payload(Event.STATUS, "failed").build();

            assertEquals(LifecycleState.FAILED, apply(started, commit(stop, T0.plusSeconds(1))).lifecycleState());
        }

        @Test
        @DisplayName("stop without a start yields an orphaned card")
        void stopWithoutStartIsOrphaned() {
            var card = apply(null, commit(Event.agentStop("s1", "ghost", "coder"), T0));

            assertEquals(LifecycleState.ORPHANED, card.lifecycleState());
            assertFalse(card.startObserved());
        }

        @Test
        @DisplayName("terminal cards never move back to running")
        void terminalIsSticky() {
            var started = apply(null, commit(Event.agentStart("s1", "a-1", "coder"), T0));
            var stopped = apply(started, commit(Event.agentStop("s1", "a-1", "coder"), T0.plusSeconds(1)));
            var restarted = apply(stopped, commit(Event.agentStart("s1", "a-1", "coder"), T0.plusSeconds(2)));

            assertEquals(LifecycleState.COMPLETED, restarted.lifecycleState());
            assertEquals(T0.plusSeconds(2), restarted.lastUpdateTimestamp());
        }

        @Test
        @DisplayName("error fails a running card and creates a failed card for unknown agents")
        void errorFails() {
            var error = Event.builder(EventType.ERROR).agentId("a-9").payload(Event.MESSAGE, "boom").build();
            var card = apply(null, commit(error, T0));

            assertEquals(LifecycleState.FAILED, card.lifecycleState());
            assertEquals("boom", card.lastMessage());
        }

        @Test
        @DisplayName("tool use only touches known cards")
        void toolUseTouchesKnownCards() {
            var toolUse = commit(Event.builder(EventType.TOOL_USE).sessionId("s1").agentId("a-1")
                    .payload(Event.FILE_PATH, "/tmp/x").build(), T0.plusSeconds(3));

            assertTrue(DerivationEngine.applyToCard(null, "a-1", toolUse).isEmpty());

            var started = apply(null, commit(Event.agentStart("s1", "a-1", "coder"), T0));
            assertEquals(T0.plusSeconds(3), apply(started, toolUse).lastUpdateTimestamp());
        }
    }

    @Nested
    @DisplayName("phases")
    class PhaseTests {

        private Event phase(String agentType, int n, int total, String name) {
            return Event.builder(EventType.PHASE_TRANSITION)
                    .agentType(agentType)
                    .payload(Event.PHASE, n)
                    .payload(Event.TOTAL_PHASES, total)
                    .payload(Event.PHASE_NAME, name)
                    .payload(Event.MESSAGE, "working on " + name)
                    .label("sprint", "3")
                    .build();
        }

        @Test
        @DisplayName("phase line resolves to the live card of the same agent type")
        void resolvesToLiveCardOfType() {
            Map<String, AgentStatusCard> cards = new LinkedHashMap<>();
            cards.put("a-1", apply(null, commit(Event.agentStart("s1", "a-1", "researcher"), T0)));

            var key = DerivationEngine.cardKey(commit(phase("researcher", 1, 3, "search"), T0), cards);

            assertEquals("a-1", key.orElseThrow());
        }

        @Test
        @DisplayName("phase line without a card creates a placeholder keyed by type")
        void createsPlaceholder() {
            var event = commit(phase("researcher", 2, 3, "read"), T0);
            var key = DerivationEngine.cardKey(event, Map.of()).orElseThrow();
            var card = DerivationEngine.applyToCard(null, key, event).orElseThrow();

            assertEquals("researcher", key);
            assertEquals(LifecycleState.RUNNING, card.lifecycleState());
            assertFalse(card.startObserved());
            assertEquals("read", card.currentPhase());
            assertEquals(2, card.phase());
            assertEquals(3, card.totalPhases());
            assertEquals("3", card.labels().get("sprint"));
        }

        @Test
        @DisplayName("a start with an agent id finds the placeholder of its type")
        void startFindsPlaceholder() {
            var phaseEvent = commit(phase("researcher", 1, 3, "search"), T0);
            Map<String, AgentStatusCard> cards = new LinkedHashMap<>();
            cards.put("researcher", DerivationEngine.applyToCard(null, "researcher", phaseEvent).orElseThrow());

            var start = commit(Event.agentStart("s1", "a-1", "researcher"), T0.plusSeconds(1));
            assertEquals("researcher", DerivationEngine.placeholderKey(start, cards).orElseThrow());

            var adopted = apply(cards.get("researcher").rekeyed("a-1"), start);
            assertEquals("a-1", adopted.agentId());
            assertTrue(adopted.startObserved());
            assertEquals("search", adopted.currentPhase());

            cards.put("a-1", adopted);
            var retried = commit(Event.agentStart("s1", "a-1", "researcher"), T0.plusSeconds(2));
            assertTrue(DerivationEngine.placeholderKey(retried, cards).isEmpty());
        }

        @Test
        @DisplayName("a started card of the type is never taken over")
        void startedCardNotAPlaceholder() {
            Map<String, AgentStatusCard> cards = new LinkedHashMap<>();
            cards.put("researcher", apply(null, commit(Event.agentStart("s1", "researcher", "researcher"), T0)));

            var start = commit(Event.agentStart("s1", "a-2", "researcher"), T0.plusSeconds(1));

            assertTrue(DerivationEngine.placeholderKey(start, cards).isEmpty());
        }

        @Test
        @DisplayName("phase updates keep the lifecycle state")
        void phaseKeepsState() {
            var started = apply(null, commit(Event.agentStart("s1", "a-1", "researcher"), T0));
            var event = commit(phase("researcher", 1, 3, "search"), T0.plusSeconds(1));
            var updated = DerivationEngine.applyToCard(started, "a-1", event).orElseThrow();

            assertEquals(LifecycleState.RUNNING, updated.lifecycleState());
            assertEquals("search", updated.currentPhase());
            assertEquals("working on search", updated.lastMessage());
        }

        @Test
        @DisplayName("interactions never touch a card")
        void interactionsHaveNoCard() {
            var event = commit(Event.interaction("user", "A", "go", InteractionType.DELEGATION), T0);
            assertTrue(DerivationEngine.cardKey(event, Map.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("delegation")
    class DelegationTests {

        @Test
        @DisplayName("delegation interaction yields a parent link")
        void delegationYieldsLink() {
            var link = DerivationEngine.delegation(
                    commit(Event.interaction("user", "A", "Plan", InteractionType.DELEGATION), T0)).orElseThrow();

            assertEquals("user", link.parent());
            assertEquals("A", link.child());
            assertEquals("Plan", link.reason());
            assertEquals(T0, link.timestamp());
        }

        @Test
        @DisplayName("other interaction types yield no link")
        void otherTypesYieldNothing() {
            assertTrue(DerivationEngine.delegation(
                    commit(Event.interaction("A", "user", "done", InteractionType.RESULT), T0)).isEmpty());
        }
    }

    @Nested
    @DisplayName("effectiveState")
    class EffectiveStateTests {

        @Test
        @DisplayName("disabled grace period never orphans")
        void disabledGracePeriod() {
            var card = AgentStatusCard.spawned("a", "coder", "s", T0).withState(LifecycleState.RUNNING, T0);
            assertEquals(LifecycleState.RUNNING,
                    DerivationEngine.effectiveState(card, T0.plus(Duration.ofDays(1)), Duration.ZERO));
        }

        @Test
        @DisplayName("stale live card is reported orphaned")
        void staleCardIsOrphaned() {
            var card = AgentStatusCard.spawned("a", "coder", "s", T0).withState(LifecycleState.RUNNING, T0);

            assertEquals(LifecycleState.RUNNING,
                    DerivationEngine.effectiveState(card, T0.plusSeconds(30), Duration.ofMinutes(1)));
            assertEquals(LifecycleState.ORPHANED,
                    DerivationEngine.effectiveState(card, T0.plusSeconds(61), Duration.ofMinutes(1)));
        }

        @Test
        @DisplayName("terminal cards keep their state")
        void terminalKeepsState() {
            var card = AgentStatusCard.spawned("a", "coder", "s", T0).withState(LifecycleState.COMPLETED, T0);
            assertEquals(LifecycleState.COMPLETED,
                    DerivationEngine.effectiveState(card, T0.plus(Duration.ofDays(1)), Duration.ofMinutes(1)));
        }
    }
}
