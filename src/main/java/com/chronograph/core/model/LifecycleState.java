package com.chronograph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of an observed agent: {@code SPAWNED -> RUNNING -> COMPLETED | FAILED}.
 * {@code ORPHANED} marks a stop that arrived without a start.
 */
public enum LifecycleState {
    SPAWNED,
    RUNNING,
    COMPLETED,
    FAILED,
    ORPHANED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ORPHANED;
    }
}
