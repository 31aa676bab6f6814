package com.microsim.core.ledger;

/**
 * Mutable per-participant state. Only the {@link AccountingLedger} writes to
 * it; everyone else sees an {@link AccountSnapshot}.
 */
class Account {
    final long owner;
    final long initialCash;
    final long initialInventory;
    final CostBasis costBasis;

    long cash;
    long inventory;
    long realizedPnl;
    long fillCount;

    Account(long owner, long initialCash, long initialInventory, long openingPrice, CostBasis costBasis) {
        this.owner = owner;
        this.initialCash = initialCash;
        this.initialInventory = initialInventory;
        this.costBasis = costBasis;
        this.cash = initialCash;
        this.inventory = initialInventory;
        // The opening position is carried at its opening price and realizes nothing
        costBasis.apply(initialInventory, openingPrice);
    }

    AccountSnapshot snapshot() {
        return new AccountSnapshot(owner, cash, inventory, realizedPnl, initialCash, initialInventory,
                costBasis.openCost(), fillCount);
    }
}
