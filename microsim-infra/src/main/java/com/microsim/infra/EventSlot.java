package com.microsim.infra;

import com.lmax.disruptor.EventFactory;
import com.microsim.api.Event;
import com.microsim.api.EventPayload;

/**
 * Ring buffer entry of the {@link EventTap}. Filled in place by the
 * simulation thread and read by tap consumers.
 */
public class EventSlot {
    public long eventId;
    public long timestamp;
    public long sequence;
    public byte kind;
    // Immutable, so sharing the reference across threads is safe
    public EventPayload payload;

    public void set(Event event) {
        eventId = event.eventId();
        timestamp = event.timestamp();
        sequence = event.sequence();
        kind = event.kind();
        payload = event.payload();
    }

    public Event toEvent() {
        return new Event(eventId, timestamp, sequence, payload);
    }

    public void reset() {
        eventId = 0;
        timestamp = 0;
        sequence = 0;
        kind = 0;
        payload = null;
    }

    public final static EventFactory<EventSlot> FACTORY = EventSlot::new;
}
