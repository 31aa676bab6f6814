package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * Dealer response to an RFQ.
 *
 * <pre>
 *   0           8           16          24          32          40
 *   +-----------+-----------+-----------+-----------+-----------+
 *   | RequestID |  QuoteID  |  Dealer   |   Price   | Quantity  |
 *   +-----------+-----------+-----------+-----------+-----------+
 * </pre>
 */
public final class RfqQuotePayload implements EventPayload {

    public static final int REQUEST_ID_OFFSET = 0;
    public static final int QUOTE_ID_OFFSET = 8;
    public static final int DEALER_OFFSET = 16;
    public static final int PRICE_OFFSET = 24;
    public static final int QUANTITY_OFFSET = 32;
    public static final int LENGTH = 40;

    private final long requestId;
    private final long quoteId;
    private final long dealer;
    private final long price;
    private final long quantity;

    public RfqQuotePayload(long requestId, long quoteId, long dealer, long price, long quantity) {
        this.requestId = requestId;
        this.quoteId = quoteId;
        this.dealer = dealer;
        this.price = price;
        this.quantity = quantity;
    }

    public static RfqQuotePayload decode(DirectBuffer buffer, int offset) {
        return new RfqQuotePayload(
                buffer.getLong(offset + REQUEST_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + QUOTE_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + DEALER_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + PRICE_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + QUANTITY_OFFSET, BYTE_ORDER));
    }

    @Override
    public byte kind() {
        return EventKind.RFQ_QUOTE;
    }

    @Override
    public int encodedLength() {
        return LENGTH;
    }

    @Override
    public void encode(MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + REQUEST_ID_OFFSET, requestId, BYTE_ORDER);
        buffer.putLong(offset + QUOTE_ID_OFFSET, quoteId, BYTE_ORDER);
        buffer.putLong(offset + DEALER_OFFSET, dealer, BYTE_ORDER);
        buffer.putLong(offset + PRICE_OFFSET, price, BYTE_ORDER);
        buffer.putLong(offset + QUANTITY_OFFSET, quantity, BYTE_ORDER);
    }

    public long requestId() {
        return requestId;
    }

    public long quoteId() {
        return quoteId;
    }

    public long dealer() {
        return dealer;
    }

    public long price() {
        return price;
    }

    public long quantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RfqQuotePayload)) {
            return false;
        }
        RfqQuotePayload that = (RfqQuotePayload) o;
        return requestId == that.requestId && quoteId == that.quoteId && dealer == that.dealer
                && price == that.price && quantity == that.quantity;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(requestId);
        result = 31 * result + Long.hashCode(quoteId);
        result = 31 * result + Long.hashCode(dealer);
        result = 31 * result + Long.hashCode(price);
        return 31 * result + Long.hashCode(quantity);
    }

    @Override
    public String toString() {
        return "RfqQuote{request=" + requestId + ", quote=" + quoteId + ", dealer=" + dealer
                + ", price=" + price + ", qty=" + quantity + '}';
    }
}
