package com.chronograph.core.query;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.events.EventBroadcaster;
import com.chronograph.core.events.EventStore;
import com.chronograph.core.metrics.ChronographMetrics;
import com.chronograph.core.model.Event;
import com.chronograph.core.model.EventType;
import com.chronograph.core.model.InteractionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PipelineQueryServiceTest {

    private EventStore store;
    private PipelineQueryService service;

    @BeforeEach
    void setUp() {
        var properties = new ChronographProperties();
        properties.getStore().setDefaultEventLimit(3);
        var metrics = new ChronographMetrics(new SimpleMeterRegistry());
        store = new EventStore(new EventBroadcaster(metrics, properties), metrics, properties);
        service = new PipelineQueryService(store, properties);
    }

    private void phase(String agentType, int n, String label) {
        store.append(Event.builder(EventType.PHASE_TRANSITION)
                .agentType(agentType)
                .payload(Event.PHASE, n)
                .payload(Event.TOTAL_PHASES, 5)
                .payload(Event.PHASE_NAME, "step-" + n)
                .label(label, "")
                .build());
    }

    @Nested
    @DisplayName("getAgentEvents")
    class GetAgentEventsTests {

        @Test
        @DisplayName("unknown agent yields not_found, not an error")
        void unknownAgent() {
            AgentEventsResult result = service.getAgentEvents("nobody", null, null);

            assertEquals(AgentEventsResult.NOT_FOUND, result.status());
            assertFalse(result.isFound());
            assertTrue(result.events().isEmpty());
        }

        @Test
        @DisplayName("blank agent id yields not_found")
        void blankAgent() {
            assertFalse(service.getAgentEvents("  ", null, 5).isFound());
        }

        @Test
        @DisplayName("applies the default limit and keeps the most recent events")
        void defaultLimit() {
            for (int i = 1; i <= 5; i++) {
                phase("coder", i, "build");
            }

            AgentEventsResult result = service.getAgentEvents("coder", null, null);

            assertEquals(AgentEventsResult.OK, result.status());
            assertEquals(3, result.events().size());
            assertEquals(3, result.events().get(0).payloadInt(Event.PHASE));
            assertEquals(5, result.events().get(2).payloadInt(Event.PHASE));
        }

        @Test
        @DisplayName("explicit limit wins over the default")
        void explicitLimit() {
            for (int i = 1; i <= 5; i++) {
                phase("coder", i, "build");
            }
            assertEquals(5, service.getAgentEvents("coder", null, 10).events().size());
            assertEquals(1, service.getAgentEvents("coder", null, 1).events().size());
        }

        @Test
        @DisplayName("label filter narrowing to nothing still reports the agent as found")
        void labelFilterEmpty() {
            phase("coder", 1, "build");

            AgentEventsResult result = service.getAgentEvents("coder", "deploy", null);

            assertTrue(result.isFound());
            assertEquals("deploy", result.label());
            assertTrue(result.events().isEmpty());
        }
    }

    @Test
    @DisplayName("getPipelineStatus returns the current snapshot")
    void pipelineStatus() {
        store.append(Event.agentStart("s1", "a-1", "coder"));
        store.append(Event.interaction("user", "a-1", "go", InteractionType.DELEGATION));

        var snapshot = service.getPipelineStatus();

        assertEquals(2, snapshot.eventCount());
        assertEquals(1, snapshot.agents().size());
        assertEquals(1, snapshot.interactions().size());
    }
}
