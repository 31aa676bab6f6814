package com.microsim.core.clock;

import com.microsim.api.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Folds a collection of events into derived state.
 * <p>
 * Events are sorted by {@code (timestamp, sequence, eventId)} first, so the
 * input may come in any order. The reducer must be a pure function of
 * {@code (state, event)}; then the result depends on the log alone.
 * </p>
 */
public final class EventReplayer {

    private EventReplayer() {
    }

    public static <S> S replay(Iterable<Event> events, S initialState, BiFunction<S, Event, S> reducer) {
        List<Event> ordered = new ArrayList<>();
        for (Event event : events) {
            ordered.add(event);
        }
        Collections.sort(ordered);

        S state = initialState;
        for (Event event : ordered) {
            state = reducer.apply(state, event);
        }
        return state;
    }
}
