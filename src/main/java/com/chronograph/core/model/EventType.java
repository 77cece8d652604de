package com.chronograph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of fact recorded in the event log.
 */
public enum EventType {
    AGENT_START,
    AGENT_STOP,
    TOOL_USE,
    INTERACTION,
    PHASE_TRANSITION,  // synthesized from a progress log line
    ERROR;

    /** Lower-case name used on the wire, e.g. {@code agent_start}. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isLifecycle() {
        return this == AGENT_START || this == AGENT_STOP || this == ERROR;
    }

    public static Optional<EventType> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.wireName().equals(normalized))
                .findFirst();
    }
}
