package com.chronograph.core.events;

import com.chronograph.core.model.Event;

import java.util.function.Predicate;

/**
 * Parses label filter expressions: {@code key=value} matches an exact value,
 * a bare {@code key} matches any event carrying that label.
 */
public final class LabelFilter {

    private LabelFilter() {}

    public static Predicate<Event> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return e -> true;
        }
        String trimmed = expression.trim();
        int eq = trimmed.indexOf('=');
        if (eq < 0) {
            return e -> e.labels().containsKey(trimmed);
        }
        String key = trimmed.substring(0, eq);
        String value = trimmed.substring(eq + 1);
        return e -> value.equals(e.labels().get(key));
    }
}
