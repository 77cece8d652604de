package com.chronograph.core.events;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.metrics.ChronographMetrics;
import com.chronograph.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory fan-out of committed events to live-stream subscriptions.
 * <p>
 * {@link #fanOut} is called by the event store while it holds its lock, so it only
 * enqueues; consumers drain their own {@link Subscription} on their own threads.
 */
@Service
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final ChronographMetrics metrics;
    private final int defaultCapacity;

    @Autowired
    public EventBroadcaster(ChronographMetrics metrics, ChronographProperties properties) {
        this(metrics, properties.getStream().getQueueCapacity());
    }

    EventBroadcaster(ChronographMetrics metrics, int defaultCapacity) {
        this.metrics = metrics;
        this.defaultCapacity = defaultCapacity;
        metrics.registerSubscriptionGauge(subscriptions, List::size);
    }

    /**
     * Registers a subscription with the configured queue capacity.
     */
    public Subscription subscribe() {
        return subscribe(defaultCapacity);
    }

    public Subscription subscribe(int capacity) {
        Subscription subscription = new Subscription(capacity);
        subscriptions.add(subscription);
        log.debug("Subscription {} registered (capacity={})", subscription.id(), capacity);
        return subscription;
    }

    /**
     * Removes a subscription from the fan-out set and releases its queue. Idempotent.
     */
    public void unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return;
        }
        subscription.close();
        if (subscriptions.remove(subscription)) {
            log.debug("Subscription {} removed", subscription.id());
        }
    }

    /**
     * Enqueues an event into every active subscription. Never blocks.
     */
    public void fanOut(Event event) {
        for (Subscription subscription : subscriptions) {
            if (subscription.offer(event)) {
                metrics.recordGap();
                log.debug("Subscription {} overflowed at sequence {}", subscription.id(), event.sequence());
            }
        }
    }

    public int activeCount() {
        return subscriptions.size();
    }
}
