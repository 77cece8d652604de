package com.chronograph.core.events;

import com.chronograph.core.model.Event;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded per-consumer queue of pending events.
 * <p>
 * {@link #offer} never blocks. When the buffer is full the oldest buffered event is
 * dropped and folded into a single pending gap marker, which is handed out ahead of
 * the remaining buffered events. Consecutive overflows between two reads collapse
 * into one gap.
 */
public final class Subscription {

    private final String id = UUID.randomUUID().toString();
    private final int capacity;
    private final ArrayDeque<Event> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private long dropped;
    private long firstDroppedSequence;
    private long lastDroppedSequence;
    private volatile boolean active = true;

    Subscription(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Subscription capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public String id() {
        return id;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Enqueues an event, evicting the oldest buffered event into the gap marker on overflow.
     *
     * @return {@code true} if an event had to be dropped
     */
    boolean offer(Event event) {
        lock.lock();
        try {
            if (!active) {
                return false;
            }
            boolean overflow = false;
            if (buffer.size() >= capacity) {
                Event evicted = buffer.pollFirst();
                if (dropped == 0) {
                    firstDroppedSequence = evicted.sequence();
                }
                lastDroppedSequence = evicted.sequence();
                dropped++;
                overflow = true;
            }
            buffer.addLast(event);
            notEmpty.signal();
            return overflow;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the next pending item without waiting, or null when nothing is pending.
     */
    public Delivery poll() {
        lock.lock();
        try {
            return next();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next pending item.
     *
     * @return the next item, or null on timeout or when the subscription was closed
     */
    public Delivery take(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (active && buffer.isEmpty() && dropped == 0) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return active ? next() : null;
        } finally {
            lock.unlock();
        }
    }

    /** Number of buffered events, not counting a pending gap. */
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the subscription inactive, discards its buffer and wakes a waiting consumer.
     * Idempotent.
     */
    void close() {
        lock.lock();
        try {
            active = false;
            buffer.clear();
            dropped = 0;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private Delivery next() {
        if (dropped > 0) {
            Delivery gap = Delivery.gap(dropped, firstDroppedSequence, lastDroppedSequence);
            dropped = 0;
            firstDroppedSequence = 0;
            lastDroppedSequence = 0;
            return gap;
        }
        Event event = buffer.pollFirst();
        return event == null ? null : Delivery.of(event);
    }
}
