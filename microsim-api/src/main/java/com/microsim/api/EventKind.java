package com.microsim.api;

/**
 * Event type tags. The tag is the first payload discriminator written to the
 * event log, so the numeric values are part of the log format and must never
 * be renumbered.
 */
public final class EventKind {
    public static final byte NEWS = 0;
    public static final byte ORDER = 1;
    public static final byte CANCEL = 2;
    public static final byte FILL = 3;
    public static final byte BATCH_CLEAR = 4;
    public static final byte RFQ_REQUEST = 5;
    public static final byte RFQ_QUOTE = 6;
    public static final byte RFQ_ACCEPT = 7;

    private EventKind() {
    }

    public static boolean isValid(byte kind) {
        return kind >= NEWS && kind <= RFQ_ACCEPT;
    }

    public static String name(byte kind) {
        switch (kind) {
            case NEWS:
                return "news";
            case ORDER:
                return "order";
            case CANCEL:
                return "cancel";
            case FILL:
                return "fill";
            case BATCH_CLEAR:
                return "batch_clear";
            case RFQ_REQUEST:
                return "rfq_request";
            case RFQ_QUOTE:
                return "rfq_quote";
            case RFQ_ACCEPT:
                return "rfq_accept";
            default:
                return "unknown(" + kind + ")";
        }
    }
}
