package com.microsim.infra;

/**
 * Immediate answer to {@code submit} or {@code cancel}. Acceptance only means
 * the intent was scheduled; what it does is decided when its event is
 * processed.
 */
public final class SubmitReceipt {

    public static final long NONE = -1L;

    private final boolean accepted;
    private final long orderId;
    private final long eventId;
    private final String reason;

    private SubmitReceipt(boolean accepted, long orderId, long eventId, String reason) {
        this.accepted = accepted;
        this.orderId = orderId;
        this.eventId = eventId;
        this.reason = reason;
    }

    static SubmitReceipt accepted(long orderId, long eventId) {
        return new SubmitReceipt(true, orderId, eventId, null);
    }

    static SubmitReceipt rejected(long orderId, String reason) {
        return new SubmitReceipt(false, orderId, NONE, reason);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public long orderId() {
        return orderId;
    }

    /**
     * @return id of the scheduled event, or {@link #NONE} when rejected
     */
    public long eventId() {
        return eventId;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return accepted
                ? "SubmitReceipt{accepted, order=" + orderId + ", event=" + eventId + '}'
                : "SubmitReceipt{rejected, order=" + orderId + ", reason='" + reason + "'}";
    }
}
