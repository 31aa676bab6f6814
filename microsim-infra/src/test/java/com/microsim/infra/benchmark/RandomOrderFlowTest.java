package com.microsim.infra.benchmark;

import com.microsim.api.FillPayload;
import com.microsim.core.OrderView;
import com.microsim.core.ledger.AccountSnapshot;
import com.microsim.infra.RunResult;
import com.microsim.infra.Simulation;
import com.microsim.infra.SimulationConfig;
import com.microsim.core.ledger.PnlConvention;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole-system properties under random flow, with fixed seeds.
 */
class RandomOrderFlowTest {

    private static RunResult run(SimulationConfig config, int agents, int ticks) {
        try (Simulation simulation = new Simulation(config)) {
            new RandomOrderFlow(agents, ticks).drive(simulation, 0);
            return simulation.finish();
        }
    }

    @Test
    void sameSeedGivesByteIdenticalLogs() {
        SimulationConfig config = SimulationConfig.builder().seed(77).submissionLatency(1).fillLatency(1).build();

        RunResult first = run(config, 5, 3_000);
        RunResult second = run(config, 5, 3_000);

        assertArrayEquals(first.eventLog().encode(), second.eventLog().encode());
        assertEquals(first.fills(), second.fills());
        assertEquals(first.accounts(), second.accounts());
        assertEquals(first.book(), second.book());
    }

    @Test
    void differentSeedsDiverge() {
        RunResult a = run(SimulationConfig.builder().seed(1).build(), 5, 1_000);
        RunResult b = run(SimulationConfig.builder().seed(2).build(), 5, 1_000);
        assertNotEquals(a.fills(), b.fills());
    }

    @Test
    void ledgerAndBookInvariantsHold() {
        for (PnlConvention convention : PnlConvention.values()) {
            RunResult result = run(SimulationConfig.builder().seed(11).pnlConvention(convention).build(), 6, 5_000);
            assertFalse(result.fills().isEmpty());

            long cash = 0;
            long inventory = 0;
            for (AccountSnapshot account : result.accounts()) {
                cash += account.cashDelta();
                inventory += account.inventoryDelta();
            }
            assertEquals(0, cash, "Cash is zero-sum");
            assertEquals(0, inventory, "Inventory is zero-sum");

            // Each order never fills more than it asked for
            Map<Long, Long> filledPerOrder = new HashMap<>();
            for (FillPayload fill : result.fills()) {
                assertTrue(fill.quantity() > 0);
                filledPerOrder.merge(fill.makerOrderId(), fill.quantity(), Long::sum);
                filledPerOrder.merge(fill.takerOrderId(), fill.quantity(), Long::sum);
            }
            for (OrderView order : result.book().bids()) {
                assertEquals(order.filledQuantity(), filledPerOrder.getOrDefault(order.orderId(), 0L));
            }

            if (!result.book().bids().isEmpty() && !result.book().asks().isEmpty()) {
                assertTrue(result.book().bids().get(0).price() < result.book().asks().get(0).price(),
                        "Best bid below best ask");
            }
            assertEquals(0, result.crossedBookResolutions());
        }
    }

    @Test
    void fillIdsAreUniqueAndIncreasing() {
        RunResult result = run(SimulationConfig.builder().seed(3).fillLatency(4).build(), 4, 2_000);
        long previous = 0;
        for (FillPayload fill : result.fills()) {
            assertTrue(fill.fillId() > previous);
            previous = fill.fillId();
        }
    }
}
