package com.microsim.core.ledger;

/**
 * Tracks the open position of one account and the cost it was built at, so
 * that closing trades can be turned into realized P&L.
 * <p>
 * Quantities are signed: positive buys, negative sells. Cost is the signed
 * total {@code price × quantity} of the open position (negative when short).
 * </p>
 */
public interface CostBasis {

    /**
     * Books a trade of {@code signedQuantity} lots at {@code price} ticks.
     *
     * @return realized P&L of the part of the trade that closed existing
     *         position, in {@code ticks × lots}
     */
    long apply(long signedQuantity, long price);

    long position();

    long openCost();
}
