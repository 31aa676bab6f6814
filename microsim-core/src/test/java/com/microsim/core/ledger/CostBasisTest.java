package com.microsim.core.ledger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CostBasisTest {

    @Test
    void averageCostReleasesBasisProportionally() {
        AverageCostBasis basis = new AverageCostBasis();
        assertEquals(0, basis.apply(3, 10));
        assertEquals(0, basis.apply(1, 14));
        assertEquals(44, basis.openCost());

        assertEquals(18, basis.apply(-2, 20));
        assertEquals(2, basis.position());
        assertEquals(22, basis.openCost());
    }

    @Test
    void averageCostFullCloseReleasesRoundingRemainder() {
        AverageCostBasis basis = new AverageCostBasis();
        basis.apply(1, 10);
        basis.apply(2, 11);

        long realized = basis.apply(-1, 12);
        realized += basis.apply(-2, 12);

        assertEquals(4, realized, "36 proceeds against 32 cost");
        assertEquals(0, basis.position());
        assertEquals(0, basis.openCost());
    }

    @Test
    void averageCostShortCoveredAtLowerPriceGains() {
        AverageCostBasis basis = new AverageCostBasis();
        basis.apply(-4, 50);
        assertEquals(5, basis.apply(1, 45));
        assertEquals(-3, basis.position());
        assertEquals(-150, basis.openCost());
    }

    @Test
    void flipOpensRemainderAtTradePrice() {
        CostBasis average = new AverageCostBasis();
        CostBasis fifo = new FifoLotBasis();
        for (CostBasis basis : new CostBasis[] {average, fifo}) {
            basis.apply(2, 10);
            assertEquals(10, basis.apply(-5, 15));
            assertEquals(-3, basis.position());
            assertEquals(-45, basis.openCost());
        }
    }

    @Test
    void fifoConsumesOldestLotsFirst() {
        FifoLotBasis basis = new FifoLotBasis();
        basis.apply(3, 10);
        basis.apply(1, 14);

        assertEquals(20, basis.apply(-2, 20));
        assertEquals(2, basis.lotCount());
        assertEquals(24, basis.openCost());

        // One lot at 10 and one at 14, sold at 12
        assertEquals(0, basis.apply(-2, 12));
        assertEquals(0, basis.lotCount());
        assertEquals(0, basis.openCost());
    }
}
