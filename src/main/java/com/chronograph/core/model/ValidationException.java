package com.chronograph.core.model;

import java.util.List;

/**
 * Thrown when an event is structurally invalid for its type. Rejected events are never stored.
 */
public class ValidationException extends RuntimeException {

    private final List<String> problems;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
