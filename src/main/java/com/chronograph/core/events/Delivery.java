package com.chronograph.core.events;

import com.chronograph.core.model.Event;

/**
 * One item handed to a live-stream consumer: either a stored event or a gap marker
 * standing in for events dropped because the consumer fell behind.
 *
 * @param event                the stored event (null for a gap)
 * @param dropped              number of events the gap replaces (0 for an event)
 * @param firstDroppedSequence sequence of the oldest dropped event (0 for an event)
 * @param lastDroppedSequence  sequence of the newest dropped event (0 for an event)
 */
public record Delivery(Event event, long dropped, long firstDroppedSequence, long lastDroppedSequence) {

    public static final String GAP_EVENT_NAME = "gap";

    public static Delivery of(Event event) {
        return new Delivery(event, 0, 0, 0);
    }

    public static Delivery gap(long dropped, long firstDroppedSequence, long lastDroppedSequence) {
        return new Delivery(null, dropped, firstDroppedSequence, lastDroppedSequence);
    }

    public boolean isGap() {
        return event == null;
    }
}
