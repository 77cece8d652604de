package com.chronograph.core.health;

import com.chronograph.core.events.EventBroadcaster;
import com.chronograph.core.events.EventStore;
import com.chronograph.ingest.ProgressLogWatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the event store and its ingestion sources.
 * The store itself is always up; a configured progress log that cannot be read
 * degrades the status because phase lines from the log-tail source are lost.
 */
@Component
public class EventStoreHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final EventStore eventStore;
    private final EventBroadcaster broadcaster;
    private final ProgressLogWatcher watcher;

    public EventStoreHealthIndicator(EventStore eventStore, EventBroadcaster broadcaster,
                                     ProgressLogWatcher watcher) {
        this.eventStore = eventStore;
        this.broadcaster = broadcaster;
        this.watcher = watcher;
    }

    @Override
    public Health health() {
        var builder = Health.up()
                .withDetail("events", eventStore.size())
                .withDetail("lastSequence", eventStore.lastSequence())
                .withDetail("subscriptions", broadcaster.activeCount());

        if (!watcher.isEnabled()) {
            return builder.withDetail("watcher", "disabled").build();
        }
        builder.withDetail("watchedFile", watcher.progressFile().toString())
                .withDetail("linesConsumed", watcher.linesConsumed());
        if (watcher.isSourceAvailable()) {
            return builder.withDetail("watcher", "UP").build();
        }
        return builder.withDetail("watcher", "source unavailable").status(DEGRADED).build();
    }
}
