package com.chronograph.dispatch.api;

import com.chronograph.core.model.PipelineSnapshot;
import com.chronograph.core.query.AgentEventsResult;
import com.chronograph.core.query.PipelineQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Read-only pipeline state for the dashboard: snapshot, per-agent history and the live stream.
 */
@RestController
@RequestMapping("/api")
public class PipelineController {

    private final PipelineQueryService queryService;
    private final SseStreamingService sseStreamingService;

    public PipelineController(PipelineQueryService queryService, SseStreamingService sseStreamingService) {
        this.queryService = queryService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/state: Status cards, delegation forest and interaction timeline.
     */
    @GetMapping("/state")
    public ResponseEntity<PipelineSnapshot> state() {
        return ResponseEntity.ok(queryService.getPipelineStatus());
    }

    /**
     * GET /api/agents/{agentId}/events: Recent raw events for one agent.
     * Unknown agents answer 404 with a {@code not_found} result body.
     */
    @GetMapping("/agents/{agentId}/events")
    public ResponseEntity<AgentEventsResult> agentEvents(@PathVariable String agentId,
                                                         @RequestParam(required = false) String label,
                                                         @RequestParam(required = false) Integer limit) {
        AgentEventsResult result = queryService.getAgentEvents(agentId, label, limit);
        return result.isFound()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
    }

    /**
     * GET /api/events/stream: SSE stream of events committed after the connection opens.
     */
    @GetMapping(value = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return sseStreamingService.createEmitter();
    }
}
