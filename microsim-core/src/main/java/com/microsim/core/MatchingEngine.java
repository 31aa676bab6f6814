package com.microsim.core;

import com.microsim.api.CancelPayload;
import com.microsim.api.Event;
import com.microsim.api.EventKind;
import com.microsim.api.FillPayload;
import com.microsim.api.OrderPayload;
import com.microsim.api.OrderStatus;
import com.microsim.api.Side;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <h1>The Matching Engine: Continuous Double Auction</h1>
 *
 * <p>
 * The state machine for one simulated instrument. Every order and cancel
 * intent reaches it as an event already placed in the global order, and is
 * processed to completion before the next one.
 * </p>
 *
 * <h2>Design Rationality</h2>
 *
 * <h3>1. Single Writer</h3>
 * <p>
 * The engine is owned by exactly one event loop. With exclusive access to the
 * book there is nothing to lock, and two runs never share an engine.
 * </p>
 *
 * <h3>2. Time Comes From The Event</h3>
 * <p>
 * The engine has no clock of its own. Entry priority and fill timestamps are
 * taken from the {@code (timestamp, sequence)} of the event that carried the
 * intent, so re-processing a logged event reproduces the exact same book.
 * </p>
 *
 * <h3>3. Determinism & Event Sourcing</h3>
 * <p>
 * {@code State(T) = Apply(State(T-1), Event(T))}. The state of the engine is a
 * pure function of the ordered intent stream, which is what replay
 * verification relies on.
 * </p>
 *
 * <h3>4. Local Failures</h3>
 * <p>
 * A malformed intent is rejected without touching the book and the run goes
 * on. {@link #cancelOrder} throws {@link OrderNotFoundException} to direct
 * callers; {@link #process} turns it into a rejected result.
 * </p>
 */
public class MatchingEngine {

    public static final int DEFAULT_ORDER_POOL_CAPACITY = 64 * 1024;
    public static final int DEFAULT_LEVEL_POOL_CAPACITY = 4 * 1024;

    private final OrderBook orderBook;

    private final ObjectPool<Order> orderPool;
    private final ObjectPool<PriceLevel> priceLevelPool;

    private final MatchEventListener listener;

    private long crossedBookResolutions;

    public MatchingEngine(MatchEventListener listener) {
        this(listener, DEFAULT_ORDER_POOL_CAPACITY, DEFAULT_LEVEL_POOL_CAPACITY);
    }

    public MatchingEngine(MatchEventListener listener, int orderPoolCapacity, int levelPoolCapacity) {
        if (listener == null) {
            throw new NullPointerException("listener");
        }
        this.listener = listener;
        this.orderPool = new ObjectPool<>(orderPoolCapacity, Order::new, Order::reset);
        this.priceLevelPool = new ObjectPool<>(levelPoolCapacity, PriceLevel::new, PriceLevel::reset);
        this.orderBook = new OrderBook(priceLevelPool, orderPool);
    }

    /**
     * Dispatches an ORDER or CANCEL event.
     *
     * @throws IllegalArgumentException for any other kind
     */
    public ExecutionResult process(Event event) {
        switch (event.kind()) {
            case EventKind.ORDER: {
                OrderPayload order = event.payload(OrderPayload.class);
                return acceptOrder(order.orderId(), order.owner(), order.side(), order.price(), order.quantity(),
                        event.timestamp(), event.sequence());
            }
            case EventKind.CANCEL: {
                CancelPayload cancel = event.payload(CancelPayload.class);
                try {
                    return cancelOrder(cancel.orderId(), cancel.owner(), event.timestamp());
                } catch (OrderNotFoundException e) {
                    listener.onOrderRejected(cancel.orderId(), cancel.owner(), e.getMessage());
                    return ExecutionResult.rejected(cancel.orderId(), e.getMessage());
                }
            }
            default:
                throw new IllegalArgumentException("Matching engine does not process "
                        + EventKind.name(event.kind()) + " events");
        }
    }

    /**
     * The core processor method.
     * <p>
     * <b>Logic Flow:</b>
     * <ol>
     * <li><b>Validate:</b> positive price and quantity, known side, unused id.</li>
     * <li><b>Match:</b> sweep the opposite side while the order is marketable,
     * best price first, FIFO within a price, at the maker's price.</li>
     * <li><b>Rest:</b> whatever remains enters the book with priority
     * {@code (timestamp, sequence)}.</li>
     * </ol>
     * </p>
     *
     * @param orderId   unique order id, positive
     * @param owner     participant id
     * @param side      BUY or SELL
     * @param price     limit price in ticks
     * @param quantity  number of lots
     * @param timestamp simulated time of the carrying event
     * @param sequence  global sequence of the carrying event
     */
    public ExecutionResult acceptOrder(long orderId, long owner, byte side, long price, long quantity,
            long timestamp, long sequence) {
        try {
            validate(orderId, side, price, quantity);
        } catch (InvalidOrderException e) {
            orderBook.recordTerminal(orderId, OrderStatus.REJECTED);
            listener.onOrderRejected(orderId, owner, e.getMessage());
            return ExecutionResult.rejected(orderId, e.getMessage());
        }

        List<FillPayload> fills = new ArrayList<>();
        resolveCrossedBook(timestamp, fills);

        long filled = orderBook.match(orderId, owner, side, price, quantity, timestamp, fills);
        long remaining = quantity - filled;

        byte status;
        if (remaining > 0) {
            orderBook.addOrder(orderId, owner, side, price, quantity, remaining, timestamp, sequence);
            status = filled > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.RESTING;
        } else {
            orderBook.recordTerminal(orderId, OrderStatus.FILLED);
            status = OrderStatus.FILLED;
        }
        resolveCrossedBook(timestamp, fills);

        for (FillPayload fill : fills) {
            listener.onFill(fill);
        }
        if (remaining > 0) {
            listener.onOrderAccepted(orderId, owner, side, price, remaining);
        }

        return new ExecutionResult(orderId, status, filled, remaining, 0, fills, orderBook.drainDelta(), null);
    }

    /**
     * Removes a resting order. No retroactive effect on fills already produced.
     *
     * @throws OrderNotFoundException if the order is not resting, or rests
     *                                under a different owner
     */
    public ExecutionResult cancelOrder(long orderId, long owner, long timestamp) {
        Order order = orderBook.getOrder(orderId);
        if (order == null || order.owner != owner) {
            throw new OrderNotFoundException(orderId);
        }
        long filled = order.filledQuantity();
        long canceled = orderBook.cancel(orderId);

        listener.onOrderCanceled(orderId, owner, canceled);
        return new ExecutionResult(orderId, OrderStatus.CANCELED, filled, 0, canceled,
                Collections.emptyList(), orderBook.drainDelta(), null);
    }

    private void validate(long orderId, byte side, long price, long quantity) {
        if (orderId <= 0) {
            throw new InvalidOrderException(orderId, "Order id must be positive");
        }
        if (orderBook.isKnown(orderId)) {
            throw new InvalidOrderException(orderId, "Duplicate order id: " + orderId);
        }
        if (!Side.isValid(side)) {
            throw new InvalidOrderException(orderId, "Invalid side: " + side);
        }
        if (price <= 0) {
            throw new InvalidOrderException(orderId, "Price must be positive: " + price);
        }
        if (quantity <= 0) {
            throw new InvalidOrderException(orderId, "Quantity must be positive: " + quantity);
        }
    }

    /**
     * Unwinds a crossed book, appending the produced fills. Normal matching
     * never leaves the book crossed, so any resolution is counted.
     *
     * @return number of fills produced
     */
    public int resolveCrossedBook(long timestamp, List<FillPayload> fills) {
        if (!orderBook.isCrossed()) {
            return 0;
        }
        crossedBookResolutions++;
        return orderBook.uncross(timestamp, fills);
    }

    public long bestBid() {
        return orderBook.bestBid();
    }

    public long bestAsk() {
        return orderBook.bestAsk();
    }

    public long depthAt(long price) {
        return orderBook.depthAt(price);
    }

    public long depthAt(byte side, long price) {
        return orderBook.depthAt(side, price);
    }

    public BookSnapshot snapshot() {
        return orderBook.snapshot();
    }

    /**
     * @return {@link OrderStatus#UNKNOWN} for an id the engine has never seen
     */
    public byte statusOf(long orderId) {
        return orderBook.statusOf(orderId);
    }

    public boolean isCrossed() {
        return orderBook.isCrossed();
    }

    public long crossedBookResolutions() {
        return crossedBookResolutions;
    }

    /**
     * @return The OrderBook instance (for testing/inspection only)
     */
    public OrderBook getOrderBook() {
        return orderBook;
    }
}
