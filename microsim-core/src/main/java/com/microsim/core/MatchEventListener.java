package com.microsim.core;

import com.microsim.api.FillPayload;

/**
 * Callbacks from the {@link MatchingEngine}, invoked synchronously on the
 * engine's thread while an intent is processed.
 */
public interface MatchEventListener {

    void onFill(FillPayload fill);

    /**
     * The order (or its unfilled remainder) now rests in the book.
     */
    void onOrderAccepted(long orderId, long owner, byte side, long price, long restingQuantity);

    void onOrderRejected(long orderId, long owner, String reason);

    void onOrderCanceled(long orderId, long owner, long canceledQuantity);
}
