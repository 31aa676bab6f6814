package com.microsim.api;

import org.agrona.MutableDirectBuffer;

/**
 * Kind-specific body of an {@link Event}.
 * <p>
 * Every payload has a fixed binary layout of {@link #encodedLength()} bytes.
 * Implementations are immutable value objects; decoding is a static
 * {@code decode(DirectBuffer, int)} on each class, dispatched by
 * {@link EventCodec}.
 * </p>
 */
public interface EventPayload {

    /**
     * @return one of the {@link EventKind} constants
     */
    byte kind();

    int encodedLength();

    void encode(MutableDirectBuffer buffer, int offset);
}
