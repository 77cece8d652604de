package com.chronograph.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.function.ToDoubleFunction;

/**
 * Centralised Micrometer metrics for event ingestion and live delivery.
 */
@Service
public class ChronographMetrics {

    private final MeterRegistry registry;

    public ChronographMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAppended(String eventType) {
        Counter.builder("chronograph.events.appended")
                .description("Events committed to the event log")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordDuplicate(String eventType) {
        Counter.builder("chronograph.events.duplicates")
                .description("Appends ignored because their de-dup key was already seen")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    /**
     * @param source the producer that submitted the malformed event ("hook", "rpc", "watcher")
     */
    public void recordRejected(String source) {
        Counter.builder("chronograph.events.rejected")
                .description("Events rejected by validation")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordGap() {
        Counter.builder("chronograph.stream.gaps")
                .description("Buffered events dropped because a subscriber fell behind")
                .register(registry)
                .increment();
    }

    public void recordWatchedLine(boolean matched) {
        Counter.builder("chronograph.watch.lines")
                .description("Lines read from the progress log")
                .tag("matched", String.valueOf(matched))
                .register(registry)
                .increment();
    }

    public <T> void registerSubscriptionGauge(T state, ToDoubleFunction<T> size) {
        Gauge.builder("chronograph.stream.subscriptions", state, size)
                .description("Active live-stream subscriptions")
                .register(registry);
    }
}
