package com.microsim.infra.logging;

/**
 * Discards everything. Used when no journal path is configured.
 */
public final class NoOpLogger implements Logger {

    public static final NoOpLogger INSTANCE = new NoOpLogger();

    private NoOpLogger() {
    }

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
    }
}
