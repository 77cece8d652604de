package com.chronograph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of interaction classifications. Only {@link #DELEGATION} changes the hierarchy.
 */
public enum InteractionType {
    QUERY,
    DELEGATION,
    RESULT,
    DECISION,
    RESPONSE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<InteractionType> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.wireName().equals(normalized))
                .findFirst();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(InteractionType::wireName).toList();
    }
}
