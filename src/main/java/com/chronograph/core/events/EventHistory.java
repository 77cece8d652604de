package com.chronograph.core.events;

import com.chronograph.core.model.Event;

import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finite, restartable view over events copied out of the store, in commit order.
 * The label filter is applied on iteration; every call to {@link #iterator()} starts over.
 */
public final class EventHistory implements Iterable<Event> {

    private final List<Event> events;
    private final Predicate<Event> filter;

    EventHistory(List<Event> events, Predicate<Event> filter) {
        this.events = List.copyOf(events);
        this.filter = filter;
    }

    @Override
    public Iterator<Event> iterator() {
        return stream().iterator();
    }

    public Stream<Event> stream() {
        return StreamSupport.stream(events.spliterator(), false).filter(filter);
    }

    public List<Event> toList() {
        return stream().toList();
    }

    /**
     * Returns the {@code limit} most recent matching events, oldest first.
     * A non-positive limit returns every match.
     */
    public List<Event> last(int limit) {
        List<Event> all = toList();
        if (limit <= 0 || all.size() <= limit) {
            return all;
        }
        return all.subList(all.size() - limit, all.size());
    }

    /**
     * Returns {@code true} if any event concerned the agent, regardless of the label filter.
     */
    public boolean hasAgentEvents() {
        return !events.isEmpty();
    }

    public boolean isEmpty() {
        return stream().findAny().isEmpty();
    }
}
