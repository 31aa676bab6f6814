package com.microsim.core;

/**
 * <b>The Price Level: A "Fat" Node</b>
 * <p>
 * Represents all resting orders at one price on one side, in arrival order.
 * </p>
 *
 * <h3>Intrusive Linked List & Tree Node</h3>
 * <p>
 * The {@link Order} objects are themselves the list nodes (prev/next), and
 * this object is itself a node of the side's {@link RedBlackTree}
 * (left/right/parent). Appending at the tail and consuming from the head gives
 * strict FIFO within the price without ever re-sorting.
 * </p>
 */
public class PriceLevel {
    public long price;
    // List pointers
    public Order head;
    public Order tail;
    public long totalQuantity;
    public int orderCount;

    // Red-Black Tree pointers (Intrusive)
    public PriceLevel left;
    public PriceLevel right;
    public PriceLevel parent;
    public boolean color; // true = RED, false = BLACK

    public void reset() {
        price = 0;
        head = null;
        tail = null;
        totalQuantity = 0;
        orderCount = 0;

        left = null;
        right = null;
        parent = null;
        color = false;
    }

    /**
     * Appends at the tail: the newest order has the lowest time priority.
     */
    public void addOrder(Order order) {
        if (head == null) {
            head = order;
            tail = order;
            order.prev = null;
            order.next = null;
        } else {
            tail.next = order;
            order.prev = tail;
            order.next = null;
            tail = order;
        }
        totalQuantity += order.remainingQuantity;
        orderCount++;
    }

    /**
     * Unlinks the order and subtracts its remaining quantity.
     * Assumes the order is actually in this level.
     */
    public void removeOrder(Order order) {
        if (order.prev != null) {
            order.prev.next = order.next;
        } else {
            head = order.next;
        }

        if (order.next != null) {
            order.next.prev = order.prev;
        } else {
            tail = order.prev;
        }

        totalQuantity -= order.remainingQuantity;
        orderCount--;
        order.next = null;
        order.prev = null;
    }

    /**
     * Books a fill of {@code quantity} against {@code order} without moving it
     * in the queue.
     */
    public void fill(Order order, long quantity) {
        order.fill(quantity);
        totalQuantity -= quantity;
    }

    public boolean isEmpty() {
        return head == null;
    }

    @Override
    public String toString() {
        return "PriceLevel{price=" + price + ", qty=" + totalQuantity + ", orders=" + orderCount + '}';
    }
}
