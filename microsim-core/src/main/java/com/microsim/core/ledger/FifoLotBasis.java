package com.microsim.core.ledger;

import java.util.ArrayDeque;

/**
 * FIFO-lot convention: every opening trade is a lot, closing trades consume
 * the oldest lots first at their own prices.
 */
public class FifoLotBasis implements CostBasis {

    private final ArrayDeque<Lot> lots = new ArrayDeque<>();
    private long position;
    private long openCost;

    @Override
    public long apply(long signedQuantity, long price) {
        if (signedQuantity == 0) {
            return 0L;
        }
        long remaining = Math.abs(signedQuantity);
        long realized = 0L;

        if (position != 0 && Long.signum(signedQuantity) != Long.signum(position)) {
            long direction = Long.signum(position);
            while (remaining > 0 && !lots.isEmpty()) {
                Lot oldest = lots.peekFirst();
                long take = Math.min(remaining, oldest.quantity);

                realized += Math.multiplyExact(direction * take, price - oldest.price);
                oldest.quantity -= take;
                remaining -= take;
                position -= direction * take;
                openCost -= Math.multiplyExact(direction * take, oldest.price);

                if (oldest.quantity == 0) {
                    lots.pollFirst();
                }
            }
        }

        if (remaining > 0) {
            long direction = Long.signum(signedQuantity);
            lots.addLast(new Lot(remaining, price));
            position += direction * remaining;
            openCost += Math.multiplyExact(direction * remaining, price);
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

    int lotCount() {
        return lots.size();
    }

    private static final class Lot {
        // Unsigned: the direction is the position's
        long quantity;
        final long price;

        Lot(long quantity, long price) {
            this.quantity = quantity;
            this.price = price;
        }
    }
}
