package com.chronograph.ingest;

import com.chronograph.core.model.Event;
import com.chronograph.core.model.EventType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses progress log lines into phase-transition events.
 * <p>
 * Format: {@code [TIMESTAMP] [AGENT] Phase N/M: phase-name -- summary #tag #key=value}.
 * Hashtag tokens become labels ({@code #tag} maps to an empty value); the remaining
 * words form the summary. Lines that do not match are ignored, including phase numbers
 * longer than nine digits.
 */
public final class ProgressLineParser {

    static final Pattern PHASE_LINE = Pattern.compile(
            "\\[([^\\]]+)\\]\\s+\\[([^\\]]+)\\]\\s+Phase\\s+(\\d{1,9})/(\\d{1,9}):\\s+(\\S+)\\s+--\\s+(.+)");

    private ProgressLineParser() {}

    /**
     * @param line raw line, surrounding whitespace ignored
     * @return an uncommitted phase-transition event, or empty for non-matching lines
     */
    public static Optional<Event> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.strip();
        Matcher m = PHASE_LINE.matcher(trimmed);
        if (!m.matches()) {
            return Optional.empty();
        }
        Map<String, String> labels = new LinkedHashMap<>();
        String summary = splitLabels(m.group(6), labels);

        return Optional.of(Event.builder(EventType.PHASE_TRANSITION)
                .agentType(m.group(2).strip())
                .payload(Event.PHASE, Integer.parseInt(m.group(3)))
                .payload(Event.TOTAL_PHASES, Integer.parseInt(m.group(4)))
                .payload(Event.PHASE_NAME, m.group(5))
                .payload(Event.MESSAGE, summary)
                .payload(Event.REPORTED_AT, m.group(1).strip())
                .labels(labels)
                .nonce(trimmed)
                .build());
    }

    /**
     * Parses the last non-blank line of a block of progress log content.
     */
    public static Optional<Event> parseLast(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        List<String> lines = content.strip().lines().filter(l -> !l.isBlank()).toList();
        return lines.isEmpty() ? Optional.empty() : parse(lines.get(lines.size() - 1));
    }

    /**
     * Separates hashtag labels from summary text.
     *
     * @param rest   text after the {@code --} separator
     * @param labels receives the parsed labels
     * @return the summary with label tokens removed
     */
    static String splitLabels(String rest, Map<String, String> labels) {
        List<String> words = new ArrayList<>();
        for (String word : rest.trim().split("\\s+")) {
            if (word.startsWith("#") && word.length() > 1) {
                String tag = word.substring(1);
                int eq = tag.indexOf('=');
                if (eq > 0) {
                    labels.put(tag.substring(0, eq), tag.substring(eq + 1));
                } else {
                    labels.put(tag, "");
                }
            } else if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return String.join(" ", words);
    }
}
