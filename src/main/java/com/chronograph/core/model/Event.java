package com.chronograph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable fact about something that happened in the observed pipeline.
 * <p>
 * Producers build events without identity; {@code eventId}, {@code sequence} and
 * {@code timestamp} are assigned by the event store when the event is committed.
 *
 * @param eventId   globally unique id assigned at ingestion (null before commit)
 * @param sequence  commit order within the store, starting at 1 (0 before commit)
 * @param eventType what happened
 * @param timestamp wall-clock ingestion time (null before commit)
 * @param sessionId top-level run owning the event (empty when unknown)
 * @param agentId   sub-task process id (empty for interactions)
 * @param agentType sub-task role, e.g. "researcher" (empty for interactions)
 * @param source    interaction initiator (empty for non-interactions)
 * @param target    interaction receiver (empty for non-interactions)
 * @param payload   type-specific fields, see the key constants on this class
 * @param labels    free-form annotations, {@code #tag} labels map to an empty value
 * @param nonce     producer-supplied de-duplication token, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Event(
        @JsonProperty("event_id") String eventId,
        long sequence,
        @JsonProperty("event_type") EventType eventType,
        Instant timestamp,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("agent_type") String agentType,
        String source,
        String target,
        Map<String, Object> payload,
        Map<String, String> labels,
        @JsonIgnore String nonce
) {

    public static final String FILE_PATH = "file_path";
    public static final String SUMMARY = "summary";
    public static final String INTERACTION_TYPE = "interaction_type";
    public static final String PHASE = "phase";
    public static final String TOTAL_PHASES = "total_phases";
    public static final String PHASE_NAME = "phase_name";
    public static final String MESSAGE = "message";
    public static final String STATUS = "status";
    public static final String REPORTED_AT = "reported_at";
    public static final String METADATA = "metadata";

    public Event {
        sessionId = sessionId == null ? "" : sessionId;
        agentId = agentId == null ? "" : agentId;
        agentType = agentType == null ? "" : agentType;
        source = source == null ? "" : source;
        target = target == null ? "" : target;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * Key identifying the agent this event concerns: the agent id when present,
     * otherwise the agent type. Empty for interactions.
     */
    @JsonIgnore
    public String agentKey() {
        return !agentId.isBlank() ? agentId : agentType;
    }

    @JsonIgnore
    public boolean isCommitted() {
        return eventId != null;
    }

    public Optional<String> payloadString(String key) {
        Object value = payload.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    public int payloadInt(String key) {
        Object value = payload.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    @JsonIgnore
    public Optional<InteractionType> interactionType() {
        return InteractionType.fromWire(payloadString(INTERACTION_TYPE).orElse(null));
    }

    @JsonIgnore
    public boolean isDelegation() {
        return eventType == EventType.INTERACTION
                && interactionType().filter(t -> t == InteractionType.DELEGATION).isPresent();
    }

    /**
     * Returns a copy carrying the identity assigned by the store.
     */
    public Event commit(String id, long seq, Instant at) {
        return new Event(eventId != null ? eventId : id, seq, eventType, timestamp != null ? timestamp : at,
                sessionId, agentId, agentType, source, target, payload, labels, nonce);
    }

    /**
     * Checks the fields required for this event's type.
     *
     * @return this event, for chaining
     * @throws ValidationException listing every missing or invalid field
     */
    public Event validate() {
        List<String> problems = new ArrayList<>();
        if (eventType == null) {
            throw new ValidationException("event_type is required");
        }
        switch (eventType) {
            case AGENT_START, AGENT_STOP, ERROR -> {
                if (agentKey().isBlank()) {
                    problems.add(eventType.wireName() + " requires agent_id or agent_type");
                }
            }
            case TOOL_USE -> {
                if (sessionId.isBlank()) {
                    problems.add("tool_use requires session_id");
                }
                if (payloadString(FILE_PATH).isEmpty()) {
                    problems.add("tool_use requires file_path");
                }
            }
            case INTERACTION -> {
                if (source.isBlank()) {
                    problems.add("interaction requires source");
                }
                if (target.isBlank()) {
                    problems.add("interaction requires target");
                }
                if (payloadString(SUMMARY).isEmpty()) {
                    problems.add("interaction requires summary");
                }
                if (interactionType().isEmpty()) {
                    problems.add("interaction_type must be one of " + InteractionType.wireNames()
                            + " but was '" + payload.get(INTERACTION_TYPE) + "'");
                }
            }
            case PHASE_TRANSITION -> {
                if (agentKey().isBlank()) {
                    problems.add("phase_transition requires agent_id or agent_type");
                }
                if (payloadString(PHASE_NAME).isEmpty()) {
                    problems.add("phase_transition requires phase_name");
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
        return this;
    }

    public static Builder builder(EventType type) {
        return new Builder(type);
    }

    public static Event agentStart(String sessionId, String agentId, String agentType) {
        return builder(EventType.AGENT_START).sessionId(sessionId).agentId(agentId).agentType(agentType).build();
    }

    public static Event agentStop(String sessionId, String agentId, String agentType) {
        return builder(EventType.AGENT_STOP).sessionId(sessionId).agentId(agentId).agentType(agentType).build();
    }

    public static Event interaction(String source, String target, String summary, InteractionType type) {
        return builder(EventType.INTERACTION)
                .source(source)
                .target(target)
                .payload(SUMMARY, summary)
                .payload(INTERACTION_TYPE, type.wireName())
                .build();
    }

    /**
     * Fluent builder for uncommitted events.
     */
    public static final class Builder {

        private final EventType eventType;
        private String eventId;
        private Instant timestamp;
        private String sessionId;
        private String agentId;
        private String agentType;
        private String source;
        private String target;
        private final Map<String, Object> payload = new LinkedHashMap<>();
        private final Map<String, String> labels = new LinkedHashMap<>();
        private String nonce;

        private Builder(EventType eventType) {
            this.eventType = eventType;
        }

        public Builder eventId(String eventId) { this.eventId = eventId; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder agentId(String agentId) { this.agentId = agentId; return this; }
        public Builder agentType(String agentType) { this.agentType = agentType; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder target(String target) { this.target = target; return this; }
        public Builder nonce(String nonce) { this.nonce = nonce; return this; }

        public Builder payload(String key, Object value) {
            if (value != null) {
                payload.put(key, value);
            }
            return this;
        }

        public Builder labels(Map<String, String> values) {
            if (values != null) {
                labels.putAll(values);
            }
            return this;
        }

        public Builder label(String key, String value) {
            labels.put(key, value == null ? "" : value);
            return this;
        }

        public Event build() {
            return new Event(eventId, 0L, eventType, timestamp, sessionId, agentId, agentType,
                    source, target, payload, labels, nonce);
        }
    }
}
