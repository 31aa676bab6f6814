package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.ExpandableArrayBuffer;
import org.agrona.MutableDirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary form of the event log.
 * <p>
 * Each record is an {@link EventHeaderFlyweight} followed by the payload's
 * fixed layout. All multi-byte fields are little-endian regardless of the
 * platform, which is what makes two logs from the same seed comparable byte
 * for byte.
 * </p>
 */
public final class EventCodec {

    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private EventCodec() {
    }

    public static int encodedLength(Event event) {
        return EventHeaderFlyweight.LENGTH + event.payload().encodedLength();
    }

    /**
     * Writes one record at {@code offset}.
     *
     * @return number of bytes written
     */
    public static int encode(Event event, MutableDirectBuffer buffer, int offset) {
        EventPayload payload = event.payload();
        new EventHeaderFlyweight().wrap(buffer, offset)
                .eventId(event.eventId())
                .timestamp(event.timestamp())
                .sequence(event.sequence())
                .kind(payload.kind())
                .payloadLength(payload.encodedLength());
        payload.encode(buffer, offset + EventHeaderFlyweight.LENGTH);
        return encodedLength(event);
    }

    /**
     * Reads one record at {@code offset}.
     *
     * @throws IllegalArgumentException on an unknown kind or a payload length
     *                                  that does not match the kind's layout
     */
    public static Event decode(DirectBuffer buffer, int offset) {
        EventHeaderFlyweight header = new EventHeaderFlyweight().wrap(buffer, offset);
        byte kind = header.kind();
        int expected = payloadLength(kind);
        if (header.payloadLength() != expected) {
            throw new IllegalArgumentException("Payload length " + header.payloadLength() + " does not match "
                    + EventKind.name(kind) + " layout (" + expected + ") at offset " + offset);
        }
        return new Event(header.eventId(), header.timestamp(), header.sequence(),
                decodePayload(kind, buffer, header.payloadOffset()));
    }

    public static byte[] encodeAll(List<Event> events) {
        ExpandableArrayBuffer buffer = new ExpandableArrayBuffer(Math.max(64, events.size() * 64));
        int position = 0;
        for (Event event : events) {
            position += encode(event, buffer, position);
        }
        byte[] bytes = new byte[position];
        buffer.getBytes(0, bytes);
        return bytes;
    }

    public static List<Event> decodeAll(byte[] bytes) {
        UnsafeBuffer buffer = new UnsafeBuffer(bytes);
        EventHeaderFlyweight header = new EventHeaderFlyweight();
        List<Event> events = new ArrayList<>();
        int position = 0;
        while (position < bytes.length) {
            if (bytes.length - position < EventHeaderFlyweight.LENGTH) {
                throw new IllegalArgumentException("Truncated event header at offset " + position);
            }
            header.wrap(buffer, position);
            int recordLength = EventHeaderFlyweight.LENGTH + header.payloadLength();
            if (header.payloadLength() < 0 || bytes.length - position < recordLength) {
                throw new IllegalArgumentException("Truncated payload for event " + header.eventId());
            }
            events.add(decode(buffer, position));
            position += recordLength;
        }
        return events;
    }

    static int payloadLength(byte kind) {
        switch (kind) {
            case EventKind.NEWS:
                return NewsPayload.LENGTH;
            case EventKind.ORDER:
                return OrderPayload.LENGTH;
            case EventKind.CANCEL:
                return CancelPayload.LENGTH;
            case EventKind.FILL:
                return FillPayload.LENGTH;
            case EventKind.BATCH_CLEAR:
                return BatchClearPayload.LENGTH;
            case EventKind.RFQ_REQUEST:
                return RfqRequestPayload.LENGTH;
            case EventKind.RFQ_QUOTE:
                return RfqQuotePayload.LENGTH;
            case EventKind.RFQ_ACCEPT:
                return RfqAcceptPayload.LENGTH;
            default:
                throw new IllegalArgumentException("Unknown event kind: " + kind);
        }
    }

    private static EventPayload decodePayload(byte kind, DirectBuffer buffer, int offset) {
        switch (kind) {
            case EventKind.NEWS:
                return NewsPayload.decode(buffer, offset);
            case EventKind.ORDER:
                return OrderPayload.decode(buffer, offset);
            case EventKind.CANCEL:
                return CancelPayload.decode(buffer, offset);
            case EventKind.FILL:
                return FillPayload.decode(buffer, offset);
            case EventKind.BATCH_CLEAR:
                return BatchClearPayload.decode(buffer, offset);
            case EventKind.RFQ_REQUEST:
                return RfqRequestPayload.decode(buffer, offset);
            case EventKind.RFQ_QUOTE:
                return RfqQuotePayload.decode(buffer, offset);
            case EventKind.RFQ_ACCEPT:
                return RfqAcceptPayload.decode(buffer, offset);
            default:
                throw new IllegalArgumentException("Unknown event kind: " + kind);
        }
    }
}
