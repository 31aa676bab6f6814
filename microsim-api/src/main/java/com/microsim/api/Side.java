package com.microsim.api;

/**
 * <b>Side: The Direction of the Order.</b>
 * <p>
 * Represents whether an order is a BUY (Bid) or a SELL (Ask).
 * </p>
 * <p>
 * Kept as primitive {@code byte} constants rather than an {@code enum}: the
 * side is written straight into event-log buffers and intents arriving from
 * agent code may carry any byte, so validity has to be checkable on the raw
 * value ({@link #isValid(byte)}).
 * </p>
 */
public final class Side {
    /** Buy Side (Bid) */
    public static final byte BUY = 0;

    /** Sell Side (Ask) */
    public static final byte SELL = 1;

    private Side() {
        // Prevent instantiation
    }

    public static boolean isValid(byte side) {
        return side == BUY || side == SELL;
    }

    public static byte opposite(byte side) {
        return side == BUY ? SELL : BUY;
    }

    public static String name(byte side) {
        switch (side) {
            case BUY:
                return "BUY";
            case SELL:
                return "SELL";
            default:
                return "UNKNOWN(" + side + ")";
        }
    }
}
