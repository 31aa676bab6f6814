package com.microsim.core.clock;

import com.microsim.api.CancelPayload;
import com.microsim.api.Event;
import com.microsim.api.FillPayload;
import com.microsim.api.NewsPayload;
import com.microsim.api.OrderPayload;
import com.microsim.api.Side;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventLogTest {

    @Test
    void appendRequiresStrictOrder() {
        EventLog log = new EventLog();
        log.append(new Event(1, 5, 1, new NewsPayload(0)));
        log.append(new Event(2, 5, 2, new NewsPayload(0)));

        assertThrows(IllegalStateException.class, () -> log.append(new Event(3, 4, 3, new NewsPayload(0))));
        assertThrows(IllegalStateException.class, () -> log.append(new Event(2, 5, 2, new NewsPayload(0))));
        assertEquals(2, log.size());
        assertEquals(2, log.last().eventId());
    }

    @Test
    void eventsViewIsReadOnly() {
        EventLog log = new EventLog();
        log.append(new Event(1, 0, 1, new NewsPayload(0)));
        assertThrows(UnsupportedOperationException.class, () -> log.events().clear());
    }

    @Test
    void encodedLogDecodesToTheSameEvents() {
        EventLog log = new EventLog();
        log.append(new Event(1, 0, 1, new OrderPayload(10, 1, Side.SELL, 101, 10)));
        log.append(new Event(2, 1, 2, new OrderPayload(11, 2, Side.BUY, 102, 15)));
        log.append(new Event(3, 1, 3, new FillPayload(1, 10, 11, 2, 1, 101, 10, 1)));
        log.append(new Event(4, 2, 4, new CancelPayload(11, 2)));

        EventLog decoded = EventLog.decode(log.encode());
        assertEquals(log.events(), decoded.events());
        assertArrayEquals(log.encode(), decoded.encode());
    }

    @Test
    void emptyLogEncodesToNothing() {
        EventLog log = new EventLog();
        assertTrue(log.isEmpty());
        assertNull(log.last());
        assertEquals(0, log.encode().length);
        assertTrue(EventLog.decode(new byte[0]).isEmpty());
    }

    @Test
    void constructorRejectsUnorderedInput() {
        List<Event> unordered = List.of(
                new Event(2, 3, 2, new NewsPayload(0)),
                new Event(1, 1, 1, new NewsPayload(0)));
        assertThrows(IllegalStateException.class, () -> new EventLog(unordered));
    }
}
