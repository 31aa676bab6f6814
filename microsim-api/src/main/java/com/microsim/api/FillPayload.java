package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * <b>The Fill Record</b>
 * <p>
 * One trade between a resting (maker) order and an incoming (taker) order.
 * The price is always the maker's price. Buyer and seller owners are carried
 * so the ledger can settle from the fill stream alone.
 * </p>
 * <b>Layout:</b>
 *
 * <pre>
 *   0        8        16       24       32       40       48       56       64
 *   +--------+--------+--------+--------+--------+--------+--------+--------+
 *   | FillID | Maker  | Taker  | Buyer  | Seller | Price  |  Qty   |MatchTs |
 *   +--------+--------+--------+--------+--------+--------+--------+--------+
 * </pre>
 */
public final class FillPayload implements EventPayload {

    public static final int FILL_ID_OFFSET = 0;
    public static final int MAKER_ORDER_ID_OFFSET = 8;
    public static final int TAKER_ORDER_ID_OFFSET = 16;
    public static final int BUYER_OFFSET = 24;
    public static final int SELLER_OFFSET = 32;
    public static final int PRICE_OFFSET = 40;
    public static final int QUANTITY_OFFSET = 48;
    public static final int MATCH_TIMESTAMP_OFFSET = 56;

    public static final int LENGTH = 64;

    private final long fillId;
    private final long makerOrderId;
    private final long takerOrderId;
    private final long buyer;
    private final long seller;
    private final long price;
    private final long quantity;
    private final long matchTimestamp;

    public FillPayload(long fillId, long makerOrderId, long takerOrderId, long buyer, long seller,
            long price, long quantity, long matchTimestamp) {
        this.fillId = fillId;
        this.makerOrderId = makerOrderId;
        this.takerOrderId = takerOrderId;
        this.buyer = buyer;
        this.seller = seller;
        this.price = price;
        this.quantity = quantity;
        this.matchTimestamp = matchTimestamp;
    }

    public static FillPayload decode(DirectBuffer buffer, int offset) {
        return new FillPayload(
                buffer.getLong(offset + FILL_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + MAKER_ORDER_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + TAKER_ORDER_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + BUYER_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + SELLER_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + PRICE_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + QUANTITY_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + MATCH_TIMESTAMP_OFFSET, BYTE_ORDER));
    }

    @Override
    public byte kind() {
        return EventKind.FILL;
    }

    @Override
    public int encodedLength() {
        return LENGTH;
    }

    @Override
    public void encode(MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + FILL_ID_OFFSET, fillId, BYTE_ORDER);
        buffer.putLong(offset + MAKER_ORDER_ID_OFFSET, makerOrderId, BYTE_ORDER);
        buffer.putLong(offset + TAKER_ORDER_ID_OFFSET, takerOrderId, BYTE_ORDER);
        buffer.putLong(offset + BUYER_OFFSET, buyer, BYTE_ORDER);
        buffer.putLong(offset + SELLER_OFFSET, seller, BYTE_ORDER);
        buffer.putLong(offset + PRICE_OFFSET, price, BYTE_ORDER);
        buffer.putLong(offset + QUANTITY_OFFSET, quantity, BYTE_ORDER);
        buffer.putLong(offset + MATCH_TIMESTAMP_OFFSET, matchTimestamp, BYTE_ORDER);
    }

    public long fillId() {
        return fillId;
    }

    public long makerOrderId() {
        return makerOrderId;
    }

    public long takerOrderId() {
        return takerOrderId;
    }

    public long buyer() {
        return buyer;
    }

    public long seller() {
        return seller;
    }

    public long price() {
        return price;
    }

    public long quantity() {
        return quantity;
    }

    public long matchTimestamp() {
        return matchTimestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FillPayload)) {
            return false;
        }
        FillPayload that = (FillPayload) o;
        return fillId == that.fillId && makerOrderId == that.makerOrderId
                && takerOrderId == that.takerOrderId && buyer == that.buyer && seller == that.seller
                && price == that.price && quantity == that.quantity && matchTimestamp == that.matchTimestamp;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(fillId);
        result = 31 * result + Long.hashCode(makerOrderId);
        result = 31 * result + Long.hashCode(takerOrderId);
        result = 31 * result + Long.hashCode(buyer);
        result = 31 * result + Long.hashCode(seller);
        result = 31 * result + Long.hashCode(price);
        result = 31 * result + Long.hashCode(quantity);
        result = 31 * result + Long.hashCode(matchTimestamp);
        return result;
    }

    @Override
    public String toString() {
        return "Fill{" +
                "id=" + fillId +
                ", maker=" + makerOrderId +
                ", taker=" + takerOrderId +
                ", buyer=" + buyer +
                ", seller=" + seller +
                ", price=" + price +
                ", qty=" + quantity +
                ", matchTs=" + matchTimestamp +
                '}';
    }
}
