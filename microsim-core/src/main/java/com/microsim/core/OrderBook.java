package com.microsim.core;

import com.microsim.api.FillPayload;
import com.microsim.api.OrderStatus;
import com.microsim.api.Side;
import org.agrona.collections.Long2LongHashMap;
import org.agrona.collections.Long2ObjectHashMap;
import org.agrona.collections.LongArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * <h1>The Order Book: Price-Time Priority</h1>
 *
 * <p>
 * Holds every resting order of the single simulated instrument and performs
 * the continuous double-auction match.
 * </p>
 *
 * <h2>Layout</h2>
 * <table border="1">
 * <tr>
 * <th>Component</th>
 * <th>Technology</th>
 * <th>Purpose</th>
 * </tr>
 * <tr>
 * <td><b>Lookup</b></td>
 * <td>{@link Long2ObjectHashMap}</td>
 * <td>O(1) price to level, and order id to live order (cancels).</td>
 * </tr>
 * <tr>
 * <td><b>Ordering</b></td>
 * <td>{@link RedBlackTree} (intrusive)</td>
 * <td>O(log N) best price and next price once a level empties.</td>
 * </tr>
 * <tr>
 * <td><b>Time priority</b></td>
 * <td>{@link PriceLevel} (intrusive FIFO)</td>
 * <td>Arrival order within a price, never re-sorted.</td>
 * </tr>
 * </table>
 *
 * <h2>Matching Rules</h2>
 * <ul>
 * <li>Better price first; within a price, earliest {@code (entryTimestamp, entrySequence)} first.</li>
 * <li>Every fill executes at the resting (maker) order's price.</li>
 * <li>A partially filled resting order keeps its place in the queue.</li>
 * </ul>
 *
 * <h2>Memory</h2>
 * <p>
 * Pooled orders and levels are recycled, but the terminal status of every id
 * ever seen stays in a primitive {@link Long2LongHashMap} (about 16 bytes per
 * entry plus load-factor slack) for the life of the book. That is what lets a
 * reused id be rejected and {@code statusOf} answer for filled, canceled and
 * rejected orders, so a run of N intents holds O(N) entries here.
 * </p>
 *
 * <h2>Concurrency Model</h2>
 * <p>
 * <b>Not thread-safe.</b> Only the owning {@link MatchingEngine} mutates the
 * book, one intent at a time.
 * </p>
 */
public class OrderBook {

    /** Returned by best-price queries on an empty side. Valid prices are positive. */
    public static final long NO_PRICE = 0L;

    private final Long2ObjectHashMap<PriceLevel> bids = new Long2ObjectHashMap<>();
    private final Long2ObjectHashMap<PriceLevel> asks = new Long2ObjectHashMap<>();

    private final RedBlackTree bidTree = new RedBlackTree();
    private final RedBlackTree askTree = new RedBlackTree();

    // Live orders by id
    private final Long2ObjectHashMap<Order> orders = new Long2ObjectHashMap<>();
    // Terminal status of every order that has left (or never entered) the book
    private final Long2LongHashMap retired = new Long2LongHashMap(OrderStatus.UNKNOWN);

    private final ObjectPool<PriceLevel> priceLevelPool;
    private final ObjectPool<Order> orderPool;

    // Levels touched since the last drainDelta(), in touch order
    private final LongArrayList touchedBids = new LongArrayList();
    private final LongArrayList touchedAsks = new LongArrayList();

    private long lastFillId;

    public OrderBook(ObjectPool<PriceLevel> priceLevelPool, ObjectPool<Order> orderPool) {
        this.priceLevelPool = priceLevelPool;
        this.orderPool = orderPool;
    }

    /**
     * Rests an order at the tail of its price level. No matching is done here.
     *
     * @return the pooled order now owned by the book
     */
    public Order addOrder(long id, long owner, byte side, long price, long originalQuantity, long remainingQuantity,
            long entryTimestamp, long entrySequence) {
        if (orders.containsKey(id)) {
            throw new IllegalStateException("Order " + id + " is already resting");
        }
        Order order = orderPool.borrow();
        order.id = id;
        order.owner = owner;
        order.side = side;
        order.price = price;
        order.originalQuantity = originalQuantity;
        order.remainingQuantity = remainingQuantity;
        order.entryTimestamp = entryTimestamp;
        order.entrySequence = entrySequence;
        order.status = remainingQuantity == originalQuantity ? OrderStatus.RESTING : OrderStatus.PARTIALLY_FILLED;

        Long2ObjectHashMap<PriceLevel> sideMap = side == Side.BUY ? bids : asks;
        PriceLevel level = sideMap.get(price);
        if (level == null) {
            level = priceLevelPool.borrow();
            level.reset();
            level.price = price;
            sideMap.put(price, level);
            treeFor(side).insert(level);
        }

        level.addOrder(order);
        orders.put(id, order);
        touch(side, price);
        return order;
    }

    /**
     * Matches an incoming order against the opposite side while it is
     * marketable. Appends one fill per maker touched to {@code fills}.
     *
     * @return the quantity filled
     */
    public long match(long takerId, long takerOwner, byte takerSide, long limitPrice, long quantity, long timestamp,
            List<FillPayload> fills) {
        long remainingQty = quantity;

        if (takerSide == Side.BUY) { // Buy vs Asks
            while (remainingQty > 0) {
                PriceLevel bestLevel = askTree.getBestPrice(true);
                if (bestLevel == null || bestLevel.price > limitPrice) {
                    break;
                }
                remainingQty = matchLevel(bestLevel, Side.SELL, takerId, takerOwner, takerSide, remainingQty,
                        timestamp, fills);
            }
        } else { // Sell vs Bids
            while (remainingQty > 0) {
                PriceLevel bestLevel = bidTree.getBestPrice(false);
                // Sell at 500 against a 500 bid is marketable; against 499 it is not
                if (bestLevel == null || bestLevel.price < limitPrice) {
                    break;
                }
                remainingQty = matchLevel(bestLevel, Side.BUY, takerId, takerOwner, takerSide, remainingQty,
                        timestamp, fills);
            }
        }

        return quantity - remainingQty;
    }

    private long matchLevel(PriceLevel level, byte levelSide, long takerId, long takerOwner, byte takerSide,
            long quantity, long timestamp, List<FillPayload> fills) {
        Order head = level.head;
        while (head != null && quantity > 0) {
            long tradeQty = Math.min(quantity, head.remainingQuantity);

            fills.add(newFill(head, takerId, takerOwner, takerSide, level.price, tradeQty, timestamp));
            level.fill(head, tradeQty);
            quantity -= tradeQty;

            if (head.remainingQuantity == 0) {
                Order filled = head;
                head = head.next;
                retire(level, filled);
            }
        }

        touch(levelSide, level.price);
        releaseIfEmpty(level, levelSide);
        return quantity;
    }

    /**
     * Removes a live order from the book.
     *
     * @return the quantity that was still resting
     * @throws OrderNotFoundException if the id is not resting
     */
    public long cancel(long orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException(orderId);
        }
        byte side = order.side;
        PriceLevel level = (side == Side.BUY ? bids : asks).get(order.price);
        long canceled = order.remainingQuantity;

        order.status = OrderStatus.CANCELED;
        retire(level, order);
        touch(side, level.price);
        releaseIfEmpty(level, side);
        return canceled;
    }

    public boolean isCrossed() {
        PriceLevel bestBid = bidTree.getBestPrice(false);
        PriceLevel bestAsk = askTree.getBestPrice(true);
        return bestBid != null && bestAsk != null && bestBid.price >= bestAsk.price;
    }

    /**
     * Defensive repair of a crossed book. Repeatedly matches the head orders of
     * the best bid and best ask; whichever entered the book first is the maker
     * and sets the price. Stops once best bid &lt; best ask.
     *
     * @return number of fills produced
     */
    public int uncross(long timestamp, List<FillPayload> fills) {
        int produced = 0;
        while (isCrossed()) {
            PriceLevel bidLevel = bidTree.getBestPrice(false);
            PriceLevel askLevel = askTree.getBestPrice(true);
            Order bid = bidLevel.head;
            Order ask = askLevel.head;

            boolean bidIsMaker = bid.hasPriorityOver(ask);
            Order maker = bidIsMaker ? bid : ask;
            Order taker = bidIsMaker ? ask : bid;
            long tradeQty = Math.min(bid.remainingQuantity, ask.remainingQuantity);

            fills.add(newFill(maker, taker.id, taker.owner, taker.side, maker.price, tradeQty, timestamp));
            produced++;

            bidLevel.fill(bid, tradeQty);
            askLevel.fill(ask, tradeQty);
            if (bid.remainingQuantity == 0) {
                retire(bidLevel, bid);
            }
            if (ask.remainingQuantity == 0) {
                retire(askLevel, ask);
            }
            touch(Side.BUY, bidLevel.price);
            touch(Side.SELL, askLevel.price);
            releaseIfEmpty(bidLevel, Side.BUY);
            releaseIfEmpty(askLevel, Side.SELL);
        }
        return produced;
    }

    private FillPayload newFill(Order maker, long takerId, long takerOwner, byte takerSide, long price,
            long quantity, long timestamp) {
        long buyer = takerSide == Side.BUY ? takerOwner : maker.owner;
        long seller = takerSide == Side.BUY ? maker.owner : takerOwner;
        return new FillPayload(++lastFillId, maker.id, takerId, buyer, seller, price, quantity, timestamp);
    }

    /**
     * Unlinks a terminal order (filled or canceled), remembers its status and
     * hands it back to the pool.
     */
    private void retire(PriceLevel level, Order order) {
        level.removeOrder(order);
        orders.remove(order.id);
        retired.put(order.id, order.status);
        orderPool.returnObject(order);
    }

    private void releaseIfEmpty(PriceLevel level, byte side) {
        if (level.isEmpty()) {
            (side == Side.BUY ? bids : asks).remove(level.price);
            treeFor(side).remove(level);
            priceLevelPool.returnObject(level);
        }
    }

    /**
     * Records the terminal status of an order that never rested (fully filled
     * on entry or rejected).
     */
    public void recordTerminal(long orderId, byte status) {
        if (!orders.containsKey(orderId) && !retired.containsKey(orderId)) {
            retired.put(orderId, status);
        }
    }

    /**
     * @return true if the id is resting or has ever reached a terminal state
     */
    public boolean isKnown(long orderId) {
        return orders.containsKey(orderId) || retired.containsKey(orderId);
    }

    public byte statusOf(long orderId) {
        Order order = orders.get(orderId);
        if (order != null) {
            return order.status;
        }
        return (byte) retired.get(orderId);
    }

    /**
     * @return the live order, or null. Do not keep the reference: it goes
     *         back to the pool once the order leaves the book.
     */
    public Order getOrder(long orderId) {
        return orders.get(orderId);
    }

    public long bestBid() {
        PriceLevel level = bidTree.getBestPrice(false);
        return level == null ? NO_PRICE : level.price;
    }

    public long bestAsk() {
        PriceLevel level = askTree.getBestPrice(true);
        return level == null ? NO_PRICE : level.price;
    }

    public long depthAt(byte side, long price) {
        PriceLevel level = (side == Side.BUY ? bids : asks).get(price);
        return level == null ? 0L : level.totalQuantity;
    }

    /**
     * Resting quantity at {@code price} across both sides. Outside of a
     * crossed state at most one side has liquidity at a given price.
     */
    public long depthAt(long price) {
        return depthAt(Side.BUY, price) + depthAt(Side.SELL, price);
    }

    /**
     * @return number of ids held only for their terminal status
     */
    public int retiredCount() {
        return retired.size();
    }

    public int restingOrderCount() {
        return orders.size();
    }

    public int levelCount(byte side) {
        return treeFor(side).size();
    }

    public BookSnapshot snapshot() {
        List<OrderView> bidViews = new ArrayList<>();
        List<OrderView> askViews = new ArrayList<>();
        bidTree.forEach(false, level -> collect(level, bidViews));
        askTree.forEach(true, level -> collect(level, askViews));
        return new BookSnapshot(bidViews, askViews);
    }

    private static void collect(PriceLevel level, List<OrderView> out) {
        for (Order order = level.head; order != null; order = order.next) {
            out.add(order.toView());
        }
    }

    /**
     * Builds the delta for everything touched since the previous call and
     * starts a new one.
     */
    public BookDelta drainDelta() {
        if (touchedBids.isEmpty() && touchedAsks.isEmpty()) {
            return BookDelta.EMPTY;
        }
        List<BookDelta.LevelChange> changes = new ArrayList<>(touchedBids.size() + touchedAsks.size());
        for (int i = 0; i < touchedBids.size(); i++) {
            long price = touchedBids.getLong(i);
            changes.add(new BookDelta.LevelChange(Side.BUY, price, depthAt(Side.BUY, price)));
        }
        for (int i = 0; i < touchedAsks.size(); i++) {
            long price = touchedAsks.getLong(i);
            changes.add(new BookDelta.LevelChange(Side.SELL, price, depthAt(Side.SELL, price)));
        }
        touchedBids.clear();
        touchedAsks.clear();
        return new BookDelta(changes);
    }

    private void touch(byte side, long price) {
        LongArrayList touched = side == Side.BUY ? touchedBids : touchedAsks;
        if (!touched.containsLong(price)) {
            touched.addLong(price);
        }
    }

    private RedBlackTree treeFor(byte side) {
        return side == Side.BUY ? bidTree : askTree;
    }
}
