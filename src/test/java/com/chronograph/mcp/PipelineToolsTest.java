package com.chronograph.mcp;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.events.EventBroadcaster;
import com.chronograph.core.events.EventStore;
import com.chronograph.core.metrics.ChronographMetrics;
import com.chronograph.core.model.Event;
import com.chronograph.core.query.AgentEventsResult;
import com.chronograph.core.query.PipelineQueryService;
import com.chronograph.ingest.InteractionReceipt;
import com.chronograph.ingest.InteractionReporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineToolsTest {

    private EventStore store;
    private PipelineTools tools;

    @BeforeEach
    void setUp() {
        var properties = new ChronographProperties();
        var metrics = new ChronographMetrics(new SimpleMeterRegistry());
        store = new EventStore(new EventBroadcaster(metrics, properties), metrics, properties);
        tools = new PipelineTools(new PipelineQueryService(store, properties), new InteractionReporter(store, metrics));
    }

    @Test
    @DisplayName("report_interaction then get_pipeline_status shows the delegation")
    void reportThenStatus() {
        InteractionReceipt receipt = tools.reportInteraction("user", "A", "Plan the release", "delegation",
                Map.of("priority", "high"));

        assertTrue(receipt.isRecorded());
        var snapshot = tools.getPipelineStatus();
        assertEquals("user", snapshot.node("A").orElseThrow().parent());
        assertEquals(1, snapshot.interactions().size());
    }

    @Test
    @DisplayName("report_interaction rejects unknown types")
    void rejectsUnknownType() {
        InteractionReceipt receipt = tools.reportInteraction("A", "B", "hi", "chat", null);

        assertEquals("rejected", receipt.status());
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("get_agent_events for an unknown agent is not_found")
    void unknownAgent() {
        AgentEventsResult result = tools.getAgentEvents("ghost", null, null);
        assertEquals(AgentEventsResult.NOT_FOUND, result.status());
    }

    @Test
    @DisplayName("get_agent_events returns the agent's events")
    void agentEvents() {
        store.append(Event.agentStart("S-1", "A", "researcher"));

        AgentEventsResult result = tools.getAgentEvents("A", null, 10);

        assertTrue(result.isFound());
        assertEquals(1, result.events().size());
    }

    @Test
    @DisplayName("tool callbacks expose the three tools by name")
    void registersTools() {
        ToolCallbackProvider provider = new McpServerConfig().pipelineToolCallbacks(tools);

        var names = Arrays.stream(provider.getToolCallbacks())
                .map(ToolCallback::getToolDefinition)
                .map(d -> d.name())
                .sorted()
                .toList();

        assertEquals(List.of("get_agent_events", "get_pipeline_status", "report_interaction"), names);
    }

    @Test
    @DisplayName("get_agent_events schema uses snake_case argument names")
    void argumentNames() {
        ToolCallbackProvider provider = new McpServerConfig().pipelineToolCallbacks(tools);

        String schema = Arrays.stream(provider.getToolCallbacks())
                .filter(c -> c.getToolDefinition().name().equals("get_agent_events"))
                .findFirst()
                .orElseThrow()
                .getToolDefinition()
                .inputSchema();

        assertTrue(schema.contains("\"agent_id\""));
    }
}
