package com.microsim.api;

import org.agrona.MutableDirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EventHeaderFlyweightTest {

    @Test
    void shouldReadAndWriteHeaderFieldsOffHeap() {
        // Direct buffer to mimic the off-heap journal layout
        final MutableDirectBuffer buffer = new UnsafeBuffer(ByteBuffer.allocateDirect(64));

        final EventHeaderFlyweight header = new EventHeaderFlyweight();
        header.wrap(buffer, 0)
                .eventId(42L)
                .timestamp(1_500L)
                .sequence(7L)
                .kind(EventKind.FILL)
                .payloadLength(FillPayload.LENGTH);

        assertEquals(42L, header.eventId());
        assertEquals(1_500L, header.timestamp());
        assertEquals(7L, header.sequence());
        assertEquals(EventKind.FILL, header.kind());
        assertEquals(FillPayload.LENGTH, header.payloadLength());
        assertEquals(EventHeaderFlyweight.LENGTH, header.payloadOffset());

        // Raw layout is fixed little-endian
        assertEquals(42L, buffer.getLong(0, ByteOrder.LITTLE_ENDIAN));
        assertEquals(1_500L, buffer.getLong(8, ByteOrder.LITTLE_ENDIAN));
        assertEquals(7L, buffer.getLong(16, ByteOrder.LITTLE_ENDIAN));
        assertEquals(EventKind.FILL, buffer.getByte(24));
        assertEquals(FillPayload.LENGTH, buffer.getInt(25, ByteOrder.LITTLE_ENDIAN));
    }

    @Test
    void shouldRespectWrapOffset() {
        final MutableDirectBuffer buffer = new UnsafeBuffer(new byte[128]);
        final EventHeaderFlyweight header = new EventHeaderFlyweight();

        header.wrap(buffer, 50).sequence(99L);

        assertEquals(99L, buffer.getLong(50 + EventHeaderFlyweight.SEQUENCE_OFFSET, ByteOrder.LITTLE_ENDIAN));
        assertEquals(50 + EventHeaderFlyweight.LENGTH, header.payloadOffset());
    }
}
