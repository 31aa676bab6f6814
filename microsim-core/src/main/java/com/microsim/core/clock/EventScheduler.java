package com.microsim.core.clock;

import com.microsim.api.Event;
import com.microsim.api.EventPayload;

import java.util.PriorityQueue;

/**
 * <h1>The Discrete-Event Scheduler</h1>
 *
 * <p>
 * Holds pending events ordered by {@code (timestamp, sequence)} and hands them
 * out one at a time. This is the only place simulated time advances.
 * </p>
 *
 * <h2>Tie-Break</h2>
 * <p>
 * The sequence number is assigned when an event is <b>scheduled</b>, from a
 * single counter per run. Two events at the same timestamp therefore process
 * in the order they were scheduled, independent of the queue's internal
 * layout. Event ids come from the same counter.
 * </p>
 *
 * <h2>Concurrency</h2>
 * <p>
 * Not thread-safe. A run drives its scheduler from a single thread;
 * "suspending" means scheduling something at a later timestamp.
 * </p>
 */
public class EventScheduler implements Clock {

    private final PriorityQueue<Event> queue = new PriorityQueue<>();

    private long now;
    private long lastSequence;

    public EventScheduler() {
        this(0L);
    }

    public EventScheduler(long startTime) {
        if (startTime < 0) {
            throw new IllegalArgumentException("Start time must be non-negative: " + startTime);
        }
        this.now = startTime;
    }

    @Override
    public long now() {
        return now;
    }

    /**
     * Creates and enqueues an event at {@code atTime}.
     *
     * @return the scheduled event, carrying its freshly assigned sequence
     * @throws IllegalArgumentException if {@code atTime} is before {@link #now()}
     */
    public Event schedule(EventPayload payload, long atTime) {
        if (atTime < now) {
            throw new IllegalArgumentException("Cannot schedule in the past: at=" + atTime + ", now=" + now);
        }
        long sequence = ++lastSequence;
        Event event = new Event(sequence, atTime, sequence, payload);
        queue.add(event);
        return event;
    }

    /**
     * Schedules at the current time; processes after everything already
     * queued for this timestamp.
     */
    public Event scheduleNow(EventPayload payload) {
        return schedule(payload, now);
    }

    /**
     * Pops the next event and advances {@link #now()} to its timestamp.
     *
     * @return the next event, or {@code null} when nothing is pending
     */
    public Event advance() {
        Event next = queue.poll();
        if (next != null) {
            now = next.timestamp();
        }
        return next;
    }

    /**
     * Moves the clock forward to {@code time} without processing anything.
     *
     * @throws IllegalArgumentException if {@code time} is before {@link #now()}
     * @throws IllegalStateException    if a pending event would be skipped
     */
    public void advanceTo(long time) {
        if (time < now) {
            throw new IllegalArgumentException("Clock cannot move backwards: to=" + time + ", now=" + now);
        }
        Event next = queue.peek();
        if (next != null && next.timestamp() < time) {
            throw new IllegalStateException("Advancing to " + time + " would skip " + next);
        }
        now = time;
    }

    /**
     * @return timestamp of the next pending event, or -1 if none
     */
    public long peekTime() {
        Event next = queue.peek();
        return next == null ? -1L : next.timestamp();
    }

    public boolean hasPending() {
        return !queue.isEmpty();
    }

    public int pending() {
        return queue.size();
    }

    /**
     * @return the last sequence number handed out (0 before any scheduling)
     */
    public long lastSequence() {
        return lastSequence;
    }
}
