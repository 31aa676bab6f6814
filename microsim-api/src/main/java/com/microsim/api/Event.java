package com.microsim.api;

import java.util.Objects;

/**
 * An immutable simulated occurrence: {@code {eventId, timestamp, sequence, kind, payload}}.
 * <p>
 * Events are totally ordered by {@code (timestamp, sequence)}. The sequence is
 * handed out by the scheduler when the event is scheduled and is never reused,
 * so two events at the same timestamp always process in submission order.
 * {@code eventId} is compared last only to keep {@link #compareTo} consistent
 * with {@link #equals} for hand-built logs.
 * </p>
 */
public final class Event implements Comparable<Event> {

    private final long eventId;
    private final long timestamp;
    private final long sequence;
    private final EventPayload payload;

    public Event(long eventId, long timestamp, long sequence, EventPayload payload) {
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative: " + timestamp);
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative: " + sequence);
        }
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.sequence = sequence;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public long eventId() {
        return eventId;
    }

    public long timestamp() {
        return timestamp;
    }

    public long sequence() {
        return sequence;
    }

    public byte kind() {
        return payload.kind();
    }

    public EventPayload payload() {
        return payload;
    }

    /**
     * Typed payload access.
     *
     * @throws ClassCastException if the payload is not of the requested type
     */
    public <T extends EventPayload> T payload(Class<T> type) {
        return type.cast(payload);
    }

    /**
     * @return true if this event sorts strictly after {@code other}
     */
    public boolean isAfter(Event other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Event other) {
        int cmp = Long.compare(timestamp, other.timestamp);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Long.compare(sequence, other.sequence);
        if (cmp != 0) {
            return cmp;
        }
        return Long.compare(eventId, other.eventId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        Event that = (Event) o;
        return eventId == that.eventId && timestamp == that.timestamp && sequence == that.sequence
                && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(eventId);
        result = 31 * result + Long.hashCode(timestamp);
        result = 31 * result + Long.hashCode(sequence);
        return 31 * result + payload.hashCode();
    }

    @Override
    public String toString() {
        return "Event{" +
                "id=" + eventId +
                ", ts=" + timestamp +
                ", seq=" + sequence +
                ", kind=" + EventKind.name(kind()) +
                ", payload=" + payload +
                '}';
    }
}
