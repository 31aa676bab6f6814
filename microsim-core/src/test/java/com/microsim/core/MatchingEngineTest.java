package com.microsim.core;

import com.microsim.api.CancelPayload;
import com.microsim.api.Event;
import com.microsim.api.FillPayload;
import com.microsim.api.OrderPayload;
import com.microsim.api.OrderStatus;
import com.microsim.api.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchingEngineTest {

    private static final long ALICE = 1;
    private static final long BOB = 2;
    private static final long CAROL = 3;

    private final List<FillPayload> fills = new ArrayList<>();
    private final List<String> rejections = new ArrayList<>();
    private final List<Long> canceled = new ArrayList<>();
    private final List<Long> accepted = new ArrayList<>();

    private MatchingEngine engine;
    private long sequence;

    @BeforeEach
    void setup() {
        engine = new MatchingEngine(new MatchEventListener() {
            public void onFill(FillPayload fill) {
                fills.add(fill);
            }

            public void onOrderAccepted(long orderId, long owner, byte side, long price, long restingQuantity) {
                accepted.add(orderId);
            }

            public void onOrderRejected(long orderId, long owner, String reason) {
                rejections.add(reason);
            }

            public void onOrderCanceled(long orderId, long owner, long canceledQuantity) {
                canceled.add(orderId);
            }
        }, 16, 4);
    }

    private ExecutionResult submit(long id, long owner, byte side, long price, long qty, long ts) {
        return engine.acceptOrder(id, owner, side, price, qty, ts, ++sequence);
    }

    @Test
    void marketableBuyFillsAtRestingAskPrice() {
        submit(1, ALICE, Side.SELL, 101, 10, 0);
        ExecutionResult result = submit(2, BOB, Side.BUY, 102, 15, 1);

        assertEquals(1, result.fills().size());
        FillPayload fill = result.fills().get(0);
        assertEquals(101, fill.price(), "Fills execute at the maker's price");
        assertEquals(10, fill.quantity());
        assertEquals(1, fill.makerOrderId());
        assertEquals(2, fill.takerOrderId());
        assertEquals(BOB, fill.buyer());
        assertEquals(ALICE, fill.seller());
        assertEquals(1, fill.matchTimestamp());

        assertEquals(OrderStatus.PARTIALLY_FILLED, result.status());
        assertEquals(10, result.filledQuantity());
        assertEquals(5, result.remainingQuantity());
        assertEquals(102, engine.bestBid());
        assertEquals(OrderBook.NO_PRICE, engine.bestAsk());
        assertEquals(5, engine.depthAt(102));
        assertEquals(OrderStatus.FILLED, engine.statusOf(1));
    }

    @Test
    void earlierOrderAtSamePriceFillsFirst() {
        submit(1, ALICE, Side.BUY, 100, 5, 0);
        submit(2, BOB, Side.BUY, 100, 5, 1);
        ExecutionResult result = submit(3, CAROL, Side.SELL, 100, 7, 2);

        assertEquals(2, result.fills().size());
        assertEquals(1, result.fills().get(0).makerOrderId());
        assertEquals(5, result.fills().get(0).quantity());
        assertEquals(2, result.fills().get(1).makerOrderId());
        assertEquals(2, result.fills().get(1).quantity());

        assertEquals(OrderStatus.FILLED, result.status());
        assertEquals(3, engine.depthAt(Side.BUY, 100));
        assertEquals(OrderStatus.FILLED, engine.statusOf(1));
        assertEquals(OrderStatus.PARTIALLY_FILLED, engine.statusOf(2));

        BookSnapshot book = engine.snapshot();
        assertEquals(1, book.bids().size());
        assertEquals(2, book.bids().get(0).orderId());
        assertEquals(3, book.bids().get(0).remainingQuantity());
    }

    @Test
    void betterPriceBeatsEarlierTime() {
        submit(1, ALICE, Side.SELL, 105, 5, 0);
        submit(2, BOB, Side.SELL, 103, 5, 1);
        ExecutionResult result = submit(3, CAROL, Side.BUY, 105, 6, 2);

        assertEquals(2, result.fills().size());
        assertEquals(103, result.fills().get(0).price());
        assertEquals(5, result.fills().get(0).quantity());
        assertEquals(105, result.fills().get(1).price());
        assertEquals(1, result.fills().get(1).quantity());
        assertEquals(4, engine.depthAt(Side.SELL, 105));
    }

    @Test
    void nonMarketableOrderRests() {
        submit(1, ALICE, Side.SELL, 101, 10, 0);
        ExecutionResult result = submit(2, BOB, Side.BUY, 100, 10, 1);

        assertTrue(result.fills().isEmpty());
        assertEquals(OrderStatus.RESTING, result.status());
        assertEquals(100, engine.bestBid());
        assertEquals(101, engine.bestAsk());
        assertEquals(List.of(1L, 2L), accepted);
    }

    @Test
    void partialFillKeepsQueuePosition() {
        submit(1, ALICE, Side.SELL, 100, 10, 0);
        submit(2, BOB, Side.SELL, 100, 10, 1);
        submit(3, CAROL, Side.BUY, 100, 4, 2);

        ExecutionResult result = submit(4, CAROL, Side.BUY, 100, 8, 3);
        assertEquals(1, result.fills().get(0).makerOrderId(), "Partially filled order stays at the head");
        assertEquals(6, result.fills().get(0).quantity());
        assertEquals(2, result.fills().get(1).makerOrderId());
        assertEquals(2, result.fills().get(1).quantity());
    }

    @Test
    void invalidOrdersAreRejectedWithoutTouchingTheBook() {
        submit(1, ALICE, Side.SELL, 100, 10, 0);

        assertTrue(submit(2, BOB, Side.BUY, 0, 10, 1).isRejected());
        assertTrue(submit(3, BOB, Side.BUY, 100, -1, 1).isRejected());
        assertTrue(submit(4, BOB, (byte) 7, 100, 10, 1).isRejected());
        assertTrue(submit(1, BOB, Side.BUY, 100, 10, 1).isRejected(), "Duplicate id");

        assertEquals(4, rejections.size());
        assertTrue(fills.isEmpty());
        assertEquals(10, engine.depthAt(Side.SELL, 100));
        assertEquals(OrderStatus.REJECTED, engine.statusOf(2));
        assertEquals(OrderStatus.RESTING, engine.statusOf(1), "Rejected duplicate leaves the original alone");
    }

    @Test
    void filledOrderIdCannotBeReused() {
        submit(1, ALICE, Side.SELL, 100, 5, 0);
        submit(2, BOB, Side.BUY, 100, 5, 1);

        ExecutionResult result = submit(1, ALICE, Side.SELL, 100, 5, 2);
        assertTrue(result.isRejected());
        assertEquals(OrderStatus.FILLED, engine.statusOf(1));
    }

    @Test
    void terminalIdsOutliveTheirPooledOrders() {
        for (long i = 0; i < 1_000; i++) {
            submit(2 * i + 1, ALICE, Side.SELL, 100, 5, i);
            submit(2 * i + 2, BOB, Side.BUY, 100, 5, i);
        }

        OrderBook book = engine.getOrderBook();
        assertEquals(0, book.restingOrderCount());
        assertEquals(2_000, book.retiredCount());

        // Long after order 1 was recycled, its id is still spent
        assertTrue(submit(1, CAROL, Side.BUY, 100, 5, 1_000).isRejected());
        assertEquals(OrderStatus.FILLED, engine.statusOf(1));
        assertEquals(2_000, book.retiredCount());
    }

    @Test
    void cancelRemovesRestingOrder() {
        submit(1, ALICE, Side.BUY, 100, 10, 0);
        submit(2, BOB, Side.SELL, 100, 4, 1);

        ExecutionResult result = engine.cancelOrder(1, ALICE, 2);
        assertEquals(OrderStatus.CANCELED, result.status());
        assertEquals(4, result.filledQuantity(), "Earlier fills stand");
        assertEquals(6, result.canceledQuantity());
        assertEquals(0, engine.depthAt(100));
        assertEquals(OrderBook.NO_PRICE, engine.bestBid());
        assertEquals(List.of(1L), canceled);
        assertEquals(OrderStatus.CANCELED, engine.statusOf(1));
        assertEquals(1, result.delta().changes().size());
        assertEquals(0, result.delta().changes().get(0).depth());
    }

    @Test
    void cancelOfUnknownOrTerminalOrderFails() {
        submit(1, ALICE, Side.BUY, 100, 5, 0);
        submit(2, BOB, Side.SELL, 100, 5, 1);

        assertThrows(OrderNotFoundException.class, () -> engine.cancelOrder(1, ALICE, 2));
        assertThrows(OrderNotFoundException.class, () -> engine.cancelOrder(99, ALICE, 2));
    }

    @Test
    void cancelByAnotherOwnerFails() {
        submit(1, ALICE, Side.BUY, 100, 5, 0);

        assertThrows(OrderNotFoundException.class, () -> engine.cancelOrder(1, BOB, 1));
        assertEquals(5, engine.depthAt(Side.BUY, 100));
    }

    @Test
    void cancelledOrderReceivesNoLaterFills() {
        submit(1, ALICE, Side.BUY, 100, 5, 0);
        submit(2, BOB, Side.BUY, 100, 5, 1);
        engine.cancelOrder(1, ALICE, 2);

        ExecutionResult result = submit(3, CAROL, Side.SELL, 100, 5, 3);
        assertEquals(1, result.fills().size());
        assertEquals(2, result.fills().get(0).makerOrderId());
    }

    @Test
    void processDispatchesOrderAndCancelEvents() {
        ExecutionResult placed = engine.process(new Event(1, 10, 1, new OrderPayload(7, ALICE, Side.SELL, 50, 3)));
        assertEquals(OrderStatus.RESTING, placed.status());

        ExecutionResult rejected = engine.process(new Event(2, 11, 2, new CancelPayload(8, ALICE)));
        assertTrue(rejected.isRejected());
        assertEquals(1, rejections.size());

        ExecutionResult cancel = engine.process(new Event(3, 12, 3, new CancelPayload(7, ALICE)));
        assertEquals(OrderStatus.CANCELED, cancel.status());
        assertEquals(3, cancel.canceledQuantity());
    }

    @Test
    void deltaReportsDepthAfterProcessing() {
        submit(1, ALICE, Side.SELL, 101, 3, 0);
        submit(2, ALICE, Side.SELL, 102, 3, 0);
        ExecutionResult result = submit(3, BOB, Side.BUY, 102, 4, 1);

        // Fully filled taker never rested, so no bid level was touched
        assertEquals(List.of(
                new BookDelta.LevelChange(Side.SELL, 101, 0),
                new BookDelta.LevelChange(Side.SELL, 102, 2)), result.delta().changes());
    }

    @Test
    void poolOverflowStillAcceptsOrders() {
        // Pools were sized to 16 orders and 4 levels
        for (int i = 1; i <= 40; i++) {
            submit(i, ALICE, Side.BUY, 50 + (i % 10), 1, i);
        }
        assertEquals(40, engine.getOrderBook().restingOrderCount());
        assertEquals(10, engine.getOrderBook().levelCount(Side.BUY));
        assertEquals(59, engine.bestBid());
    }

    @Test
    void bookNeverStaysCrossed() {
        java.util.Random random = new java.util.Random(42);
        for (int i = 1; i <= 2_000; i++) {
            byte side = random.nextBoolean() ? Side.BUY : Side.SELL;
            submit(i, random.nextInt(5), side, 90 + random.nextInt(20), 1 + random.nextInt(10), i);
            assertFalse(engine.isCrossed(), "Crossed after order " + i);
        }
        assertEquals(0, engine.crossedBookResolutions());
    }
}
