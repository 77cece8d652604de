package com.chronograph.ingest;

import com.chronograph.core.model.Event;
import com.chronograph.core.model.EventType;
import com.chronograph.core.model.InteractionType;
import com.chronograph.core.model.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates hook notification bodies into canonical events.
 * <p>
 * Two body shapes are accepted:
 * <ul>
 *   <li>the canonical shape, identified by {@code event_type}, with fields named as in the event model;</li>
 *   <li>the assistant's raw hook shape, identified by {@code hook_event_name}
 *       ({@code SubagentStart}, {@code SubagentStop}, {@code PostToolUse}).</li>
 * </ul>
 * A raw subagent start also yields a {@code main_agent -> agent} delegation and a raw stop a
 * {@code agent -> main_agent} result, so the hierarchy builds even when nobody reports interactions.
 */
public final class HookEventMapper {

    public static final String MAIN_AGENT = "main_agent";

    static final String SUBAGENT_START = "SubagentStart";
    static final String SUBAGENT_STOP = "SubagentStop";
    static final String POST_TOOL_USE = "PostToolUse";

    private final String progressFileName;

    public HookEventMapper(String progressFileName) {
        this.progressFileName = progressFileName;
    }

    /**
     * @param body parsed JSON body
     * @return uncommitted events, in the order they should be appended
     * @throws ValidationException when the body is not a recognised hook notification
     */
    public List<Event> map(Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            throw new ValidationException("hook body is empty");
        }
        if (body.containsKey("hook_event_name")) {
            return mapRawHook(body);
        }
        return List.of(mapCanonical(body));
    }

    private Event mapCanonical(Map<String, Object> body) {
        String rawType = text(body, "event_type");
        EventType type = EventType.fromWire(rawType).orElseThrow(() -> new ValidationException(
                "Invalid event_type: '" + rawType + "'. Valid types: "
                        + Arrays.stream(EventType.values()).map(EventType::wireName).toList()));

        Event.Builder builder = Event.builder(type)
                .sessionId(text(body, "session_id"))
                .agentId(text(body, "agent_id"))
                .agentType(text(body, "agent_type"))
                .nonce(nonce(body))
                .labels(stringMap(body.get("labels")));

        switch (type) {
            case TOOL_USE -> builder
                    .payload(Event.FILE_PATH, firstNonBlank(text(body, "file_path"),
                            text(map(body.get("tool_input")), "file_path"),
                            text(map(body.get("metadata")), "file_path")))
                    .payload(Event.MESSAGE, blankToNull(text(body, "message")));
            case INTERACTION -> builder
                    .source(text(body, "source"))
                    .target(text(body, "target"))
                    .payload(Event.SUMMARY, blankToNull(text(body, "summary")))
                    .payload(Event.INTERACTION_TYPE, blankToNull(text(body, "interaction_type")));
            case PHASE_TRANSITION -> builder
                    .payload(Event.PHASE, body.get("phase"))
                    .payload(Event.TOTAL_PHASES, body.get("total_phases"))
                    .payload(Event.PHASE_NAME, blankToNull(text(body, "phase_name")))
                    .payload(Event.MESSAGE, blankToNull(text(body, "message")));
            case AGENT_START, AGENT_STOP, ERROR -> builder
                    .payload(Event.MESSAGE, blankToNull(text(body, "message")))
                    .payload(Event.STATUS, blankToNull(text(body, "status")));
        }
        Map<String, Object> metadata = map(body.get("metadata"));
        if (!metadata.isEmpty()) {
            builder.payload(Event.METADATA, metadata);
        }
        return builder.build();
    }

    private List<Event> mapRawHook(Map<String, Object> body) {
        String hook = text(body, "hook_event_name");
        String sessionId = text(body, "session_id");
        String agentId = text(body, "agent_id");
        String agentType = text(body, "agent_type");
        String label = firstNonBlank(agentType, agentId, "unknown");
        String participant = firstNonBlank(agentId, agentType, label);
        String nonce = nonce(body);

        List<Event> events = new ArrayList<>();
        switch (hook) {
            case SUBAGENT_START -> {
                events.add(Event.builder(EventType.AGENT_START)
                        .sessionId(sessionId).agentId(agentId).agentType(firstNonBlank(agentType, label))
                        .payload(Event.MESSAGE, "Agent " + label + " started")
                        .nonce(nonce)
                        .build());
                events.add(Event.builder(EventType.INTERACTION)
                        .sessionId(sessionId)
                        .source(MAIN_AGENT).target(participant)
                        .payload(Event.SUMMARY, "Delegated to " + label)
                        .payload(Event.INTERACTION_TYPE, InteractionType.DELEGATION.wireName())
                        .nonce(nonce)
                        .build());
            }
            case SUBAGENT_STOP -> {
                Event.Builder stop = Event.builder(EventType.AGENT_STOP)
                        .sessionId(sessionId).agentId(agentId).agentType(firstNonBlank(agentType, label))
                        .payload(Event.MESSAGE, "Agent " + label + " stopped")
                        .nonce(nonce);
                String transcript = text(body, "agent_transcript_path");
                if (!transcript.isBlank()) {
                    stop.payload(Event.METADATA, Map.of("agent_transcript_path", transcript));
                }
                events.add(stop.build());
                events.add(Event.builder(EventType.INTERACTION)
                        .sessionId(sessionId)
                        .source(participant).target(MAIN_AGENT)
                        .payload(Event.SUMMARY, label + " returned results")
                        .payload(Event.INTERACTION_TYPE, InteractionType.RESULT.wireName())
                        .nonce(nonce)
                        .build());
            }
            case POST_TOOL_USE -> events.add(mapToolUse(body, sessionId, agentId, nonce));
            default -> throw new ValidationException("Unsupported hook_event_name: '" + hook + "'");
        }
        return events;
    }

    private Event mapToolUse(Map<String, Object> body, String sessionId, String agentId, String nonce) {
        Map<String, Object> toolInput = map(body.get("tool_input"));
        String filePath = text(toolInput, "file_path");
        if (!filePath.isBlank() && filePath.endsWith(progressFileName)) {
            String content = firstNonBlank(text(toolInput, "content"), text(toolInput, "new_string"));
            Optional<Event> phase = ProgressLineParser.parseLast(content);
            if (phase.isPresent()) {
                Event parsed = phase.get();
                return Event.builder(EventType.PHASE_TRANSITION)
                        .sessionId(sessionId)
                        .agentId(agentId)
                        .agentType(parsed.agentType())
                        .payload(Event.PHASE, parsed.payload().get(Event.PHASE))
                        .payload(Event.TOTAL_PHASES, parsed.payload().get(Event.TOTAL_PHASES))
                        .payload(Event.PHASE_NAME, parsed.payload().get(Event.PHASE_NAME))
                        .payload(Event.MESSAGE, parsed.payload().get(Event.MESSAGE))
                        .payload(Event.REPORTED_AT, parsed.payload().get(Event.REPORTED_AT))
                        .labels(parsed.labels())
                        .nonce(parsed.nonce())
                        .build();
            }
        }
        return Event.builder(EventType.TOOL_USE)
                .sessionId(sessionId)
                .agentId(agentId)
                .agentType(text(body, "agent_type"))
                .payload(Event.FILE_PATH, blankToNull(filePath))
                .payload("tool_name", blankToNull(text(body, "tool_name")))
                .payload(Event.MESSAGE, filePath.isBlank() ? null : "Write to " + filePath)
                .nonce(nonce)
                .build();
    }

    private static String nonce(Map<String, Object> body) {
        return blankToNull(firstNonBlank(text(body, "nonce"), text(body, "tool_use_id"), text(body, "timestamp")));
    }

    static String text(Map<String, Object> body, String key) {
        Object value = body.get(key);
        return value == null ? "" : value.toString().trim();
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Object value) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        map(value).forEach((k, v) -> result.put(k, v == null ? "" : v.toString()));
        return result;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
