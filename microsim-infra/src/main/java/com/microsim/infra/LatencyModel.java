package com.microsim.infra;

/**
 * Simulated delays between an agent's decision and the core seeing it, and
 * between a match and the counterparties seeing the fill.
 */
public interface LatencyModel {

    /**
     * @return ticks between {@code submit}/{@code cancel} and the event that
     *         carries the intent
     */
    long submissionDelay();

    /**
     * @return ticks between a match and its FILL event
     */
    long fillDelay();
}
