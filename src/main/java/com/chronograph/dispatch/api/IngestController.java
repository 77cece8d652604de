package com.chronograph.dispatch.api;

import com.chronograph.ingest.HookReceiver;
import com.chronograph.ingest.IngestResult;
import com.chronograph.ingest.InteractionReceipt;
import com.chronograph.ingest.InteractionReporter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Ingestion endpoints for hook scripts.
 * <p>
 * Both endpoints answer 202 Accepted whatever happens, including unparseable bodies:
 * a hook must never see a failure that could disturb the pipeline it reports on.
 * The response body still says what was stored and what was dropped.
 */
@RestController
@RequestMapping("/api")
public class IngestController {

    private static final Logger log = LoggerFactory.getLogger(IngestController.class);
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};

    private final HookReceiver hookReceiver;
    private final InteractionReporter interactionReporter;
    private final ObjectMapper objectMapper;

    public IngestController(HookReceiver hookReceiver, InteractionReporter interactionReporter,
                            ObjectMapper objectMapper) {
        this.hookReceiver = hookReceiver;
        this.interactionReporter = interactionReporter;
        this.objectMapper = objectMapper;
    }

    /**
     * POST /api/events: Ingest a lifecycle, tool-use or phase notification.
     */
    @PostMapping(value = "/events", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<IngestResult> receiveEvent(@RequestBody(required = false) String body) {
        Map<String, Object> parsed;
        try {
            parsed = parse(body);
        } catch (JsonProcessingException e) {
            return ResponseEntity.accepted().body(hookReceiver.rejectUnreadable(e.getOriginalMessage()));
        }
        return ResponseEntity.accepted().body(hookReceiver.receive(parsed));
    }

    /**
     * POST /api/interactions: Ingest an interaction reported over HTTP.
     */
    @PostMapping(value = "/interactions", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<InteractionReceipt> receiveInteraction(@RequestBody(required = false) String body) {
        Map<String, Object> parsed;
        try {
            parsed = parse(body);
        } catch (JsonProcessingException e) {
            log.warn("Rejected unreadable interaction body: {}", e.getOriginalMessage());
            return ResponseEntity.accepted().body(InteractionReceipt.rejected("Invalid JSON body"));
        }
        return ResponseEntity.accepted().body(interactionReporter.reportFromHook(parsed));
    }

    private Map<String, Object> parse(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parsed = objectMapper.readValue(body, BODY_TYPE);
        return parsed != null ? parsed : Map.of();
    }
}
