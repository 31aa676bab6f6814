package com.microsim.infra;

/**
 * Agent activity for one repetition: submits, cancels and publishes against
 * the given simulation, advancing it as it goes. Must draw randomness only
 * from {@link Simulation#stream(String)}.
 */
@FunctionalInterface
public interface ScenarioDriver {
    void drive(Simulation simulation, int repetition);
}
