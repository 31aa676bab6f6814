package com.microsim.infra;

import com.lmax.disruptor.util.DaemonThreadFactory;
import com.microsim.core.SimulationException;
import com.microsim.core.random.StreamManager;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs independent repetitions of one scenario in parallel.
 * <p>
 * Repetition {@code i} gets root seed
 * {@code deriveRepetitionSeed(config.seed(), i)} and a {@link Simulation} of
 * its own; runs share no mutable state, so the thread count changes only the
 * wall-clock time, never a result. Results come back in repetition order.
 * </p>
 */
public class RepetitionRunner {

    private final SimulationConfig config;
    private final int repetitions;
    private final int threads;

    public RepetitionRunner(SimulationConfig config, int repetitions, int threads) {
        if (repetitions <= 0) {
            throw new IllegalArgumentException("Repetitions must be positive: " + repetitions);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("Threads must be positive: " + threads);
        }
        this.config = config;
        this.repetitions = repetitions;
        this.threads = threads;
    }

    /**
     * @throws SimulationException (or the subclass a repetition threw) if any
     *                             repetition fails
     */
    public List<RunResult> run(ScenarioDriver driver) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads, DaemonThreadFactory.INSTANCE);
        try {
            List<Future<RunResult>> futures = new ArrayList<>(repetitions);
            for (int i = 0; i < repetitions; i++) {
                final int repetition = i;
                futures.add(executor.submit(() -> runOne(driver, repetition)));
            }

            List<RunResult> results = new ArrayList<>(repetitions);
            for (int i = 0; i < repetitions; i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new SimulationException("Repetition " + i + " failed", cause);
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private RunResult runOne(ScenarioDriver driver, int repetition) {
        long seed = StreamManager.deriveRepetitionSeed(config.seed(), repetition);
        try (Simulation simulation = new Simulation(config.forRepetition(seed, repetition))) {
            driver.drive(simulation, repetition);
            return simulation.finish();
        }
    }

    public int repetitions() {
        return repetitions;
    }
}
