package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * <b>The Event Header Flyweight.</b>
 * <p>
 * A reusable "view" over the fixed-size header that precedes every payload
 * in the encoded event log. Wrapping moves the window; nothing is copied.
 * </p>
 *
 * <h3>Memory Layout:</h3>
 *
 * <pre>
 *   0          8          16         24   25         29
 *   +----------+----------+----------+----+----------+
 *   | EventID  |Timestamp | Sequence |Kind| PayLen   |
 *   +----------+----------+----------+----+----------+
 *   (8 bytes)  (8 bytes)  (8 bytes)  (1)   (4 bytes)
 * </pre>
 */
public class EventHeaderFlyweight {

    public static final int EVENT_ID_OFFSET = 0;
    public static final int TIMESTAMP_OFFSET = 8;
    public static final int SEQUENCE_OFFSET = 16;
    public static final int KIND_OFFSET = 24;
    public static final int PAYLOAD_LENGTH_OFFSET = 25;

    public static final int LENGTH = 29;

    private DirectBuffer buffer;
    private int offset;

    public EventHeaderFlyweight wrap(DirectBuffer buffer, int offset) {
        this.buffer = buffer;
        this.offset = offset;
        return this;
    }

    public long eventId() {
        return buffer.getLong(offset + EVENT_ID_OFFSET, BYTE_ORDER);
    }

    public EventHeaderFlyweight eventId(long eventId) {
        mutable().putLong(offset + EVENT_ID_OFFSET, eventId, BYTE_ORDER);
        return this;
    }

    public long timestamp() {
        return buffer.getLong(offset + TIMESTAMP_OFFSET, BYTE_ORDER);
    }

    public EventHeaderFlyweight timestamp(long timestamp) {
        mutable().putLong(offset + TIMESTAMP_OFFSET, timestamp, BYTE_ORDER);
        return this;
    }

    public long sequence() {
        return buffer.getLong(offset + SEQUENCE_OFFSET, BYTE_ORDER);
    }

    public EventHeaderFlyweight sequence(long sequence) {
        mutable().putLong(offset + SEQUENCE_OFFSET, sequence, BYTE_ORDER);
        return this;
    }

    public byte kind() {
        return buffer.getByte(offset + KIND_OFFSET);
    }

    public EventHeaderFlyweight kind(byte kind) {
        mutable().putByte(offset + KIND_OFFSET, kind);
        return this;
    }

    public int payloadLength() {
        return buffer.getInt(offset + PAYLOAD_LENGTH_OFFSET, BYTE_ORDER);
    }

    public EventHeaderFlyweight payloadLength(int length) {
        mutable().putInt(offset + PAYLOAD_LENGTH_OFFSET, length, BYTE_ORDER);
        return this;
    }

    /**
     * @return offset of the first payload byte following this header
     */
    public int payloadOffset() {
        return offset + LENGTH;
    }

    private MutableDirectBuffer mutable() {
        return (MutableDirectBuffer) buffer;
    }

    @Override
    public String toString() {
        if (buffer == null) {
            return "EventHeaderFlyweight{unwrapped}";
        }
        return "EventHeaderFlyweight{" +
                "id=" + eventId() +
                ", ts=" + timestamp() +
                ", seq=" + sequence() +
                ", kind=" + EventKind.name(kind()) +
                ", payloadLength=" + payloadLength() +
                '}';
    }
}
