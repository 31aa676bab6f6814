package com.microsim.infra.logging;

/**
 * <b>Binary Diagnostic Logger.</b>
 * <p>
 * Log records are events, not formatted lines: a short tag plus an optional
 * numeric value (an order id, an event count, a seed). Nothing here is on the
 * determinism path; a run produces the same results with any implementation.
 * </p>
 */
public interface Logger extends AutoCloseable {
    void log(CharSequence message);

    void log(long value);

    void log(CharSequence message, long value);

    @Override
    void close();
}
