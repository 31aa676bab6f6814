package com.microsim.infra;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.microsim.api.Event;
import com.microsim.infra.logging.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * <b>Event Tap: Out-of-Band Delivery of the Event Log.</b>
 * <p>
 * Hands every processed event to external consumers (metrics, export,
 * dashboards) through an LMAX Disruptor ring, in log order, without letting
 * them run on the simulation thread.
 * </p>
 *
 * <h3>Topology:</h3>
 *
 * <pre>
 * [Simulation event loop] (single producer)
 *         |
 *    (Ring Buffer of EventSlot)
 *         |
 *         v
 * [Consumer 1] [Consumer 2] ... (each sees every event, in order)
 * </pre>
 *
 * <p>
 * Consumers are read-only: nothing flows back into the run, so a slow
 * consumer can delay the producer (ring full) but never change a result. An
 * exception thrown by a consumer is journaled and counted, and the consumer
 * moves on to the next event; without that its sequence would stall and the
 * producer would park on a full ring. The wait strategy blocks instead of
 * spinning; a simulation is CPU bound already.
 * </p>
 */
public class EventTap implements AutoCloseable {

    private final Disruptor<EventSlot> disruptor;
    private final RingBuffer<EventSlot> ringBuffer;
    private final AtomicLong failures = new AtomicLong();
    private volatile Throwable firstFailure;
    private boolean closed;

    @SafeVarargs
    public EventTap(int bufferSize, Logger logger, EventHandler<EventSlot>... consumers) {
        if (consumers.length == 0) {
            throw new IllegalArgumentException("Event tap needs at least one consumer");
        }
        this.disruptor = new Disruptor<>(
                EventSlot.FACTORY,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        this.disruptor.setDefaultExceptionHandler(new ConsumerFailureHandler(logger));
        this.disruptor.handleEventsWith(consumers);
        this.ringBuffer = disruptor.start();
    }

    public void publish(Event event) {
        if (closed) {
            throw new IllegalStateException("Event tap is closed");
        }
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(event);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * @return number of exceptions thrown by consumers so far
     */
    public long failureCount() {
        return failures.get();
    }

    /**
     * @return the first exception a consumer threw, or null
     */
    public Throwable firstFailure() {
        return firstFailure;
    }

    public RingBuffer<EventSlot> getRingBuffer() {
        return ringBuffer;
    }

    /**
     * Waits until every published event has reached every consumer, then
     * stops the consumer threads.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            disruptor.shutdown();
        }
    }

    private final class ConsumerFailureHandler implements ExceptionHandler<EventSlot> {

        private final Logger logger;

        ConsumerFailureHandler(Logger logger) {
            this.logger = logger;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, EventSlot event) {
            if (failures.getAndIncrement() == 0) {
                firstFailure = ex;
            }
            logger.log("tap consumer failed at event", event.eventId);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            logger.log("tap consumer failed to start");
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            logger.log("tap consumer failed to stop");
        }
    }
}
