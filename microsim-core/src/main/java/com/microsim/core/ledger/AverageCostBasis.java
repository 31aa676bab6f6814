package com.microsim.core.ledger;

/**
 * Average-cost convention: a closing trade releases basis in proportion to
 * the share of the position it closes. The division floors; closing the whole
 * position releases whatever basis is left so nothing is lost to rounding.
 */
public class AverageCostBasis implements CostBasis {

    private long position;
    private long openCost;

    @Override
    public long apply(long signedQuantity, long price) {
        if (signedQuantity == 0) {
            return 0L;
        }
        if (position == 0 || Long.signum(signedQuantity) == Long.signum(position)) {
            position += signedQuantity;
            openCost += Math.multiplyExact(signedQuantity, price);
            return 0L;
        }

        long direction = Long.signum(position);
        long held = Math.abs(position);
        long closing = Math.min(Math.abs(signedQuantity), held);

        long released = closing == held
                ? openCost
                : Math.floorDiv(Math.multiplyExact(openCost, closing), held);
        long realized = Math.multiplyExact(direction * closing, price) - released;

        position -= direction * closing;
        openCost -= released;

        long opening = Math.abs(signedQuantity) - closing;
        if (opening > 0) {
            // Trade flipped the position: the remainder opens at this price
            long openingQuantity = Long.signum(signedQuantity) * opening;
            position += openingQuantity;
            openCost += Math.multiplyExact(openingQuantity, price);
        }
        return realized;
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public long openCost() {
        return openCost;
    }
}
