package com.microsim.infra;

import com.microsim.core.ConfigurationException;

/**
 * The same delay for every intent and every fill.
 */
public class ConstantLatencyModel implements LatencyModel {

    public static final ConstantLatencyModel ZERO = new ConstantLatencyModel(0, 0);

    private final long submissionDelay;
    private final long fillDelay;

    public ConstantLatencyModel(long submissionDelay, long fillDelay) {
        if (submissionDelay < 0) {
            throw new ConfigurationException("Submission delay must be non-negative: " + submissionDelay);
        }
        if (fillDelay < 0) {
            throw new ConfigurationException("Fill delay must be non-negative: " + fillDelay);
        }
        this.submissionDelay = submissionDelay;
        this.fillDelay = fillDelay;
    }

    @Override
    public long submissionDelay() {
        return submissionDelay;
    }

    @Override
    public long fillDelay() {
        return fillDelay;
    }

    @Override
    public String toString() {
        return "ConstantLatencyModel{submission=" + submissionDelay + ", fill=" + fillDelay + '}';
    }
}
