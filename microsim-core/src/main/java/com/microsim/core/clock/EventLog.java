package com.microsim.core.clock;

import com.microsim.api.Event;
import com.microsim.api.EventCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of processed events, in processing order.
 * <p>
 * This is the canonical artifact of a run: replaying it against a fresh core
 * must reproduce the run. Appends must strictly follow the previous event in
 * {@code (timestamp, sequence)} order.
 * </p>
 */
public class EventLog {

    private final List<Event> events = new ArrayList<>();

    public EventLog() {
    }

    public EventLog(List<Event> events) {
        for (Event event : events) {
            append(event);
        }
    }

    public static EventLog decode(byte[] bytes) {
        return new EventLog(EventCodec.decodeAll(bytes));
    }

    /**
     * @throws IllegalStateException if {@code event} does not sort after the
     *                               last appended event
     */
    public void append(Event event) {
        if (!events.isEmpty()) {
            Event last = events.get(events.size() - 1);
            if (!event.isAfter(last)) {
                throw new IllegalStateException("Out-of-order append: " + event + " after " + last);
            }
        }
        events.add(event);
    }

    public List<Event> events() {
        return Collections.unmodifiableList(events);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public Event last() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public byte[] encode() {
        return EventCodec.encodeAll(events);
    }
}
