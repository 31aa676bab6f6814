package com.microsim.api;

/**
 * Order lifecycle states.
 *
 * <pre>
 * submitted -> REJECTED
 *           -> RESTING -> PARTIALLY_FILLED -> FILLED | CANCELED
 *           -> FILLED
 *           -> CANCELED
 * </pre>
 */
public final class OrderStatus {
    public static final byte RESTING = 0;
    public static final byte PARTIALLY_FILLED = 1;
    public static final byte FILLED = 2;
    public static final byte CANCELED = 3;
    public static final byte REJECTED = 4;

    /** Returned by status queries for ids the engine has never accepted. */
    public static final byte UNKNOWN = -1;

    private OrderStatus() {
    }

    public static boolean isTerminal(byte status) {
        return status == FILLED || status == CANCELED || status == REJECTED;
    }

    public static String name(byte status) {
        switch (status) {
            case RESTING:
                return "RESTING";
            case PARTIALLY_FILLED:
                return "PARTIALLY_FILLED";
            case FILLED:
                return "FILLED";
            case CANCELED:
                return "CANCELED";
            case REJECTED:
                return "REJECTED";
            default:
                return "UNKNOWN(" + status + ")";
        }
    }
}
