package com.microsim.infra;

import com.lmax.disruptor.EventHandler;
import com.microsim.api.Event;
import com.microsim.api.EventKind;
import com.microsim.api.FillPayload;
import com.microsim.api.NewsPayload;
import com.microsim.api.OrderPayload;
import com.microsim.api.OrderStatus;
import com.microsim.api.Side;
import com.microsim.core.ledger.AccountSnapshot;
import com.microsim.infra.logging.Logger;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SimulationTest {

    private static final long ALICE = 1;
    private static final long BOB = 2;

    private static SimulationConfig config(long submission, long fill) {
        return SimulationConfig.builder()
                .seed(42)
                .submissionLatency(submission)
                .fillLatency(fill)
                .orderPoolCapacity(64)
                .levelPoolCapacity(16)
                .build();
    }

    @Test
    void ordersMatchAndFillsReachTheLedger() {
        try (Simulation simulation = new Simulation(config(0, 0))) {
            SubmitReceipt ask = simulation.submit(ALICE, Side.SELL, 101, 10);
            simulation.runUntil(1);
            SubmitReceipt bid = simulation.submit(BOB, Side.BUY, 102, 15);

            RunResult result = simulation.finish();

            assertTrue(ask.isAccepted());
            assertTrue(bid.isAccepted());
            assertEquals(1, result.fills().size());
            FillPayload fill = result.fills().get(0);
            assertEquals(101, fill.price());
            assertEquals(10, fill.quantity());
            assertEquals(ask.orderId(), fill.makerOrderId());

            AccountSnapshot alice = result.accounts().get(0);
            AccountSnapshot bob = result.accounts().get(1);
            assertEquals(1010, alice.cash());
            assertEquals(-10, alice.inventory());
            assertEquals(-1010, bob.cash());
            assertEquals(10, bob.inventory());

            assertEquals(1, result.book().bids().size());
            assertEquals(5, result.book().bids().get(0).remainingQuantity());
            assertEquals(102, result.book().bids().get(0).price());
        }
    }

    @Test
    void latenciesDelayOrdersAndFills() {
        try (Simulation simulation = new Simulation(config(3, 2))) {
            simulation.submit(ALICE, Side.SELL, 100, 5);
            simulation.submit(BOB, Side.BUY, 100, 5);

            assertEquals(0, simulation.runUntil(2), "Nothing arrives before the submission delay");
            assertEquals(2, simulation.runUntil(3));
            assertNull(simulation.account(BOB), "Fill not yet delivered");
            assertEquals(1, simulation.pending());

            simulation.runUntil(5);
            assertEquals(5, simulation.account(BOB).inventory());

            List<Event> events = simulation.eventLog().events();
            assertEquals(EventKind.FILL, events.get(2).kind());
            assertEquals(5, events.get(2).timestamp());
            assertEquals(3, events.get(2).payload(FillPayload.class).matchTimestamp());
        }
    }

    @Test
    void invalidIntentIsRejectedWithoutAnEvent() {
        try (Simulation simulation = new Simulation(config(0, 0))) {
            SubmitReceipt receipt = simulation.submit(ALICE, Side.BUY, 0, 5);

            assertFalse(receipt.isAccepted());
            assertEquals(SubmitReceipt.NONE, receipt.eventId());
            assertNotNull(receipt.reason());
            assertEquals(0, simulation.pending());

            RunResult result = simulation.finish();
            assertEquals(1, result.rejections().size());
            assertTrue(result.eventLog().isEmpty());
        }
    }

    @Test
    void cancelOfFilledOrderIsRejectedAndRunContinues() {
        try (Simulation simulation = new Simulation(config(1, 0))) {
            SubmitReceipt ask = simulation.submit(ALICE, Side.SELL, 100, 5);
            simulation.submit(BOB, Side.BUY, 100, 5);
            simulation.runUntil(1);

            simulation.cancel(ALICE, ask.orderId());
            SubmitReceipt rest = simulation.submit(BOB, Side.BUY, 99, 1);
            RunResult result = simulation.finish();

            assertEquals(1, result.rejections().size());
            assertEquals(ask.orderId(), result.rejections().get(0).orderId());
            assertEquals(OrderStatus.RESTING, simulation.statusOf(rest.orderId()));
        }
    }

    @Test
    void cancelRemovesOrderBeforeItCanTrade() {
        try (Simulation simulation = new Simulation(config(0, 0))) {
            SubmitReceipt ask = simulation.submit(ALICE, Side.SELL, 100, 5);
            simulation.cancel(ALICE, ask.orderId());
            simulation.submit(BOB, Side.BUY, 100, 5);

            RunResult result = simulation.finish();
            assertTrue(result.fills().isEmpty());
            assertEquals(OrderStatus.CANCELED, simulation.statusOf(ask.orderId()));
            assertEquals(100, result.book().bids().get(0).price());
        }
    }

    @Test
    void collaboratorEventsAreLoggedButNotInterpreted() {
        try (Simulation simulation = new Simulation(config(0, 0))) {
            simulation.publish(new NewsPayload(7), 4);
            assertThrows(IllegalArgumentException.class,
                    () -> simulation.publish(new OrderPayload(1, ALICE, Side.BUY, 1, 1), 4));

            RunResult result = simulation.finish();
            assertEquals(1, result.eventLog().size());
            assertEquals(EventKind.NEWS, result.eventLog().events().get(0).kind());
            assertEquals(4, simulation.now());
        }
    }

    @Test
    void configuredAccountsStartWithTheirBalances() {
        SimulationConfig config = SimulationConfig.builder()
                .account(ALICE, 1_000, 10, 40)
                .build();
        try (Simulation simulation = new Simulation(config)) {
            simulation.submit(ALICE, Side.SELL, 50, 4);
            simulation.submit(BOB, Side.BUY, 50, 4);
            RunResult result = simulation.finish();

            AccountSnapshot alice = result.accounts().get(0);
            assertEquals(1_200, alice.cash());
            assertEquals(6, alice.inventory());
            assertEquals(40, alice.realizedPnl());
        }
    }

    @Test
    void finishedRunRejectsFurtherIntents() {
        Simulation simulation = new Simulation(config(0, 0));
        simulation.finish();
        assertThrows(IllegalStateException.class, () -> simulation.submit(ALICE, Side.BUY, 1, 1));
        assertThrows(IllegalStateException.class, simulation::finish);
    }

    @Test
    void eventLogIsStrictlyOrdered() {
        try (Simulation simulation = new Simulation(config(1, 1))) {
            for (int i = 0; i < 20; i++) {
                simulation.submit(i % 3, i % 2 == 0 ? Side.BUY : Side.SELL, 100 + (i % 5), 1 + i);
                simulation.runUntil(i);
            }
            RunResult result = simulation.finish();

            List<Event> events = new ArrayList<>(result.eventLog().events());
            for (int i = 1; i < events.size(); i++) {
                assertTrue(events.get(i).isAfter(events.get(i - 1)));
            }
            assertFalse(result.fills().isEmpty());
        }
    }

    @Test
    void sameStreamNameGivesSameDrawsAsAFreshManager() {
        try (Simulation a = new Simulation(config(0, 0)); Simulation b = new Simulation(config(0, 0))) {
            a.stream("agents.9").nextLong();
            assertEquals(a.stream("latent").nextLong(), b.stream("latent").nextLong());
        }
    }

    @Test
    void journalIsClosedWhenTheRunCannotBeBuilt() {
        AtomicBoolean closed = new AtomicBoolean();
        Logger journal = new Logger() {
            @Override
            public void log(CharSequence message) {
            }

            @Override
            public void log(long value) {
            }

            @Override
            public void log(CharSequence message, long value) {
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };
        SimulationConfig config = SimulationConfig.builder().tapBufferSize(16).build();

        assertThrows(NullPointerException.class,
                () -> new Simulation(config, journal, (EventHandler<EventSlot>[]) null));
        assertTrue(closed.get());
    }
}
