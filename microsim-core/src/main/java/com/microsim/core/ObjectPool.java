package com.microsim.core;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * <h1>Object Pool</h1>
 *
 * <p>
 * Pre-allocates {@link Order} and {@link PriceLevel} instances so a long
 * simulation does not churn the heap with short-lived book nodes.
 * </p>
 * <p>
 * Single-threaded by construction (the owning engine is the only caller), so
 * a plain array with a moving {@code head} index is enough. When the pool runs
 * dry {@link #borrow()} falls back to the factory; {@link #returnObject} keeps
 * at most {@code capacity} instances and lets the rest go.
 * </p>
 *
 * @param <T> The type of object to pool.
 */
public class ObjectPool<T> {

    private final T[] pool;
    private final Supplier<T> factory;
    private final Consumer<T> resetter;
    private int head;
    private long overflowAllocations;

    @SuppressWarnings("unchecked")
    public ObjectPool(int capacity, Supplier<T> factory, Consumer<T> resetter) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pool capacity must be positive: " + capacity);
        }
        this.factory = factory;
        this.resetter = resetter;
        this.pool = (T[]) new Object[capacity];
        this.head = capacity - 1;

        for (int i = 0; i < capacity; i++) {
            pool[i] = factory.get();
        }
    }

    public T borrow() {
        if (head < 0) {
            overflowAllocations++;
            return factory.get();
        }
        T object = pool[head];
        pool[head--] = null;
        return object;
    }

    public void returnObject(T object) {
        if (object == null) {
            return;
        }
        resetter.accept(object);
        if (head + 1 < pool.length) {
            pool[++head] = object;
        }
    }

    public int available() {
        return head + 1;
    }

    public int capacity() {
        return pool.length;
    }

    /**
     * @return how many times {@link #borrow()} had to allocate past capacity
     */
    public long overflowAllocations() {
        return overflowAllocations;
    }
}
