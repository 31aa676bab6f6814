package com.microsim.core.ledger;

/**
 * How realized P&L is computed. Fixed for the lifetime of a ledger.
 */
public enum PnlConvention {
    AVERAGE_COST {
        @Override
        public CostBasis newCostBasis() {
            return new AverageCostBasis();
        }
    },
    FIFO {
        @Override
        public CostBasis newCostBasis() {
            return new FifoLotBasis();
        }
    };

    public abstract CostBasis newCostBasis();
}
