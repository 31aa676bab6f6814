package com.microsim.core;

import com.microsim.api.FillPayload;
import com.microsim.api.OrderStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one processed intent did to the book: the order's status afterwards,
 * the fills it produced in match order and the levels it touched.
 */
public final class ExecutionResult {

    private final long orderId;
    private final byte status;
    private final long filledQuantity;
    private final long remainingQuantity;
    private final long canceledQuantity;
    private final List<FillPayload> fills;
    private final BookDelta delta;
    private final String reason;

    public ExecutionResult(long orderId, byte status, long filledQuantity, long remainingQuantity,
            long canceledQuantity, List<FillPayload> fills, BookDelta delta, String reason) {
        this.orderId = orderId;
        this.status = status;
        this.filledQuantity = filledQuantity;
        this.remainingQuantity = remainingQuantity;
        this.canceledQuantity = canceledQuantity;
        this.fills = fills.isEmpty() ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(fills));
        this.delta = delta;
        this.reason = reason;
    }

    public static ExecutionResult rejected(long orderId, String reason) {
        return new ExecutionResult(orderId, OrderStatus.REJECTED, 0, 0, 0, Collections.emptyList(),
                BookDelta.EMPTY, reason);
    }

    public long orderId() {
        return orderId;
    }

    public byte status() {
        return status;
    }

    public boolean isRejected() {
        return status == OrderStatus.REJECTED;
    }

    public long filledQuantity() {
        return filledQuantity;
    }

    /**
     * Quantity left resting in the book after processing.
     */
    public long remainingQuantity() {
        return remainingQuantity;
    }

    public long canceledQuantity() {
        return canceledQuantity;
    }

    public List<FillPayload> fills() {
        return fills;
    }

    public BookDelta delta() {
        return delta;
    }

    /**
     * @return why the intent was rejected, or null
     */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "orderId=" + orderId +
                ", status=" + OrderStatus.name(status) +
                ", filled=" + filledQuantity +
                ", remaining=" + remainingQuantity +
                ", canceled=" + canceledQuantity +
                ", fills=" + fills.size() +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                '}';
    }
}
