package com.chronograph.mcp;

import com.chronograph.core.model.PipelineSnapshot;
import com.chronograph.core.query.AgentEventsResult;
import com.chronograph.core.query.PipelineQueryService;
import com.chronograph.ingest.InteractionReceipt;
import com.chronograph.ingest.InteractionReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tools exposed to the orchestrating assistant over MCP.
 * Results are serialized with the same JSON field names as the HTTP API. Java parameter
 * names become the tool argument names, hence the snake_case parameters.
 */
@Component
public class PipelineTools {

    private static final Logger log = LoggerFactory.getLogger(PipelineTools.class);

    private final PipelineQueryService queryService;
    private final InteractionReporter interactionReporter;

    public PipelineTools(PipelineQueryService queryService, InteractionReporter interactionReporter) {
        this.queryService = queryService;
        this.interactionReporter = interactionReporter;
    }

    @Tool(name = "get_pipeline_status",
            description = "Current status card of every agent, the delegation hierarchy and the interaction timeline")
    public PipelineSnapshot getPipelineStatus() {
        return queryService.getPipelineStatus();
    }

    @Tool(name = "get_agent_events",
            description = "Most recent raw events of one agent, optionally filtered by label")
    public AgentEventsResult getAgentEvents(
            @ToolParam(description = "Agent id or agent type") String agent_id,
            @ToolParam(description = "Label filter, key=value or key", required = false) String label,
            @ToolParam(description = "Maximum number of events to return", required = false) Integer limit) {
        return queryService.getAgentEvents(agent_id, label, limit);
    }

    @Tool(name = "report_interaction",
            description = "Record an interaction between two pipeline participants. "
                    + "interaction_type is one of query, delegation, result, decision, response")
    public InteractionReceipt reportInteraction(
            @ToolParam(description = "Participant that initiated the interaction") String source,
            @ToolParam(description = "Participant that received the interaction") String target,
            @ToolParam(description = "One-line description of what was exchanged") String summary,
            @ToolParam(description = "query, delegation, result, decision or response") String interaction_type,
            @ToolParam(description = "Free-form labels", required = false) Map<String, String> labels) {
        InteractionReceipt receipt = interactionReporter.report(source, target, summary, interaction_type, labels);
        log.debug("report_interaction {} -> {}: {}", source, target, receipt.status());
        return receipt;
    }
}
