package com.microsim.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable copy of every resting order, per side, in matching priority
 * order: bids by price descending, asks by price ascending, FIFO within a
 * price. Two books with equal snapshots match identically from here on.
 */
public final class BookSnapshot {

    private final List<OrderView> bids;
    private final List<OrderView> asks;

    public BookSnapshot(List<OrderView> bids, List<OrderView> asks) {
        this.bids = Collections.unmodifiableList(new ArrayList<>(bids));
        this.asks = Collections.unmodifiableList(new ArrayList<>(asks));
    }

    public List<OrderView> bids() {
        return bids;
    }

    public List<OrderView> asks() {
        return asks;
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BookSnapshot)) {
            return false;
        }
        BookSnapshot that = (BookSnapshot) o;
        return bids.equals(that.bids) && asks.equals(that.asks);
    }

    @Override
    public int hashCode() {
        return 31 * bids.hashCode() + asks.hashCode();
    }

    @Override
    public String toString() {
        return "BookSnapshot{bids=" + bids + ", asks=" + asks + '}';
    }
}
