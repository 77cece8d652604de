package com.chronograph.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome reported back to a hook producer. Always delivered with a success status code;
 * {@code errors} only tells the producer what was dropped.
 *
 * @param status   "accepted" when every event was stored, "partial" when some were rejected,
 *                 "ignored" when nothing was stored
 * @param eventIds ids of stored (or de-duplicated) events
 * @param errors   rejection reasons
 */
public record IngestResult(
        String status,
        @JsonProperty("event_ids") List<String> eventIds,
        List<String> errors
) {

    public IngestResult {
        eventIds = List.copyOf(eventIds);
        errors = List.copyOf(errors);
    }

    static IngestResult of(List<String> eventIds, List<String> errors) {
        String status = errors.isEmpty() ? "accepted" : eventIds.isEmpty() ? "ignored" : "partial";
        return new IngestResult(status, eventIds, errors);
    }
}
