package com.chronograph.dispatch.api;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.events.Delivery;
import com.chronograph.core.events.EventBroadcaster;
import com.chronograph.core.events.Subscription;
import com.chronograph.core.logging.MdcContext;
import com.chronograph.core.model.Event;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges {@link EventBroadcaster} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each connection gets its own {@link Subscription} and its own drain thread, so a slow
 * client only ever blocks its own thread, never ingestion or other clients. The drain
 * loop waits on the subscription with the heartbeat interval as timeout and sends an SSE
 * comment when nothing arrived, which keeps idle connections open through proxies.
 * No history is replayed: clients fetch {@code /api/state} first, then stream.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private final EventBroadcaster broadcaster;
    private final long timeoutMs;
    private final Duration heartbeatInterval;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService drainExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-drain-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBroadcaster broadcaster, ChronographProperties properties) {
        this(broadcaster, properties.getStream().getEmitterTimeout().toMillis(),
                properties.getStream().getHeartbeatInterval());
    }

    SseStreamingService(EventBroadcaster broadcaster, long timeoutMs, Duration heartbeatInterval) {
        this.broadcaster = broadcaster;
        this.timeoutMs = timeoutMs;
        this.heartbeatInterval = heartbeatInterval;
    }

    @PreDestroy
    void shutdown() {
        for (EmitterRegistration registration : activeRegistrations) {
            cleanup(registration);
        }
        drainExecutor.shutdownNow();
        try {
            drainExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("SSE streaming stopped");
    }

    /**
     * Creates an emitter streaming every event committed from now on.
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        Subscription subscription = broadcaster.subscribe();
        var registration = new EmitterRegistration(emitter, subscription, new AtomicBoolean());
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for subscription {}", subscription.id());
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for subscription {}", subscription.id());
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for subscription {}: {}", subscription.id(), ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for subscription {}: {}", subscription.id(), e.getMessage());
        }

        drainExecutor.execute(() -> drain(registration));
        log.info("SSE stream opened (subscription={}, active={})", subscription.id(), activeRegistrations.size());
        return emitter;
    }

    /**
     * Returns the number of currently active SSE emitters.
     */
    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void drain(EmitterRegistration registration) {
        Subscription subscription = registration.subscription();
        SseEmitter emitter = registration.emitter();
        MdcContext.setSubscription(subscription.id());
        try {
            while (subscription.isActive()) {
                Delivery delivery = subscription.take(heartbeatInterval);
                if (delivery == null) {
                    if (subscription.isActive()) {
                        emitter.send(SseEmitter.event().comment("heartbeat"));
                    }
                    continue;
                }
                send(emitter, delivery);
            }
        } catch (IOException | IllegalStateException e) {
            // Transport failure is confined to this connection.
            log.debug("SSE send failed for subscription {}: {}", subscription.id(), e.getMessage());
            completeQuietly(emitter, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            cleanup(registration);
            MdcContext.clear();
        }
    }

    private void send(SseEmitter emitter, Delivery delivery) throws IOException {
        if (delivery.isGap()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("dropped", delivery.dropped());
            data.put("first_dropped_sequence", delivery.firstDroppedSequence());
            data.put("last_dropped_sequence", delivery.lastDroppedSequence());
            emitter.send(SseEmitter.event()
                    .name(Delivery.GAP_EVENT_NAME)
                    .data(data, MediaType.APPLICATION_JSON));
            return;
        }
        Event event = delivery.event();
        emitter.send(SseEmitter.event()
                .id(String.valueOf(event.sequence()))
                .name(event.eventType().wireName())
                .data(event, MediaType.APPLICATION_JSON));
    }

    private void completeQuietly(SseEmitter emitter, Exception cause) {
        try {
            emitter.completeWithError(cause);
        } catch (RuntimeException e) {
            log.debug("Emitter already closed: {}", e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (!registration.closed().compareAndSet(false, true)) {
            return;
        }
        broadcaster.unsubscribe(registration.subscription());
        activeRegistrations.remove(registration);
        log.info("SSE stream closed (subscription={}, active={})",
                registration.subscription().id(), activeRegistrations.size());
    }

    private record EmitterRegistration(
            SseEmitter emitter,
            Subscription subscription,
            AtomicBoolean closed
    ) {}
}
