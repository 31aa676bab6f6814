package com.microsim.core.ledger;

/**
 * Read-only view of one account at the moment it was taken.
 */
public final class AccountSnapshot {

    private final long owner;
    private final long cash;
    private final long inventory;
    private final long realizedPnl;
    private final long initialCash;
    private final long initialInventory;
    private final long openCost;
    private final long fillCount;

    public AccountSnapshot(long owner, long cash, long inventory, long realizedPnl, long initialCash,
            long initialInventory, long openCost, long fillCount) {
        this.owner = owner;
        this.cash = cash;
        this.inventory = inventory;
        this.realizedPnl = realizedPnl;
        this.initialCash = initialCash;
        this.initialInventory = initialInventory;
        this.openCost = openCost;
        this.fillCount = fillCount;
    }

    public long owner() {
        return owner;
    }

    public long cash() {
        return cash;
    }

    public long inventory() {
        return inventory;
    }

    public long realizedPnl() {
        return realizedPnl;
    }

    public long initialCash() {
        return initialCash;
    }

    public long initialInventory() {
        return initialInventory;
    }

    public long cashDelta() {
        return cash - initialCash;
    }

    public long inventoryDelta() {
        return inventory - initialInventory;
    }

    /**
     * Signed cost of the open position under the ledger's P&L convention.
     */
    public long openCost() {
        return openCost;
    }

    public long fillCount() {
        return fillCount;
    }

    public long equity(long markPrice) {
        return cash + inventory * markPrice;
    }

    public long unrealizedPnl(long markPrice) {
        return inventory * markPrice - openCost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccountSnapshot)) {
            return false;
        }
        AccountSnapshot that = (AccountSnapshot) o;
        return owner == that.owner && cash == that.cash && inventory == that.inventory
                && realizedPnl == that.realizedPnl && initialCash == that.initialCash
                && initialInventory == that.initialInventory && openCost == that.openCost
                && fillCount == that.fillCount;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(owner);
        result = 31 * result + Long.hashCode(cash);
        result = 31 * result + Long.hashCode(inventory);
        result = 31 * result + Long.hashCode(realizedPnl);
        result = 31 * result + Long.hashCode(initialCash);
        result = 31 * result + Long.hashCode(initialInventory);
        result = 31 * result + Long.hashCode(openCost);
        result = 31 * result + Long.hashCode(fillCount);
        return result;
    }

    @Override
    public String toString() {
        return "AccountSnapshot{" +
                "owner=" + owner +
                ", cash=" + cash +
                ", inventory=" + inventory +
                ", realizedPnl=" + realizedPnl +
                ", fills=" + fillCount +
                '}';
    }
}
