package com.microsim.infra.logging;

import net.openhft.chronicle.queue.ChronicleQueue;
import net.openhft.chronicle.queue.impl.single.SingleChronicleQueueBuilder;

/**
 * <b>Chronicle Logger Implementation.</b>
 * <p>
 * Writes records to a memory-mapped journal using Chronicle Queue, so logging
 * from inside the event loop costs a few stores and no formatting.
 * </p>
 * <p>
 * Appenders are acquired per call. Chronicle caches one per thread, which
 * lets event tap consumers log from their own threads.
 * </p>
 */
public class ChronicleLogger implements Logger {

    private final ChronicleQueue queue;

    public ChronicleLogger(String path) {
        this.queue = SingleChronicleQueueBuilder.binary(path).build();
    }

    @Override
    public void log(CharSequence message) {
        queue.acquireAppender().writeDocument(w -> w.write("msg").text(message));
    }

    @Override
    public void log(long value) {
        queue.acquireAppender().writeDocument(w -> w.write("val").int64(value));
    }

    @Override
    public void log(CharSequence message, long value) {
        queue.acquireAppender().writeDocument(w -> w.write("evt").text(message)
                .write("val").int64(value));
    }

    /**
     * @return the queue, for tools that read the journal back
     */
    public ChronicleQueue queue() {
        return queue;
    }

    @Override
    public void close() {
        queue.close();
    }
}
