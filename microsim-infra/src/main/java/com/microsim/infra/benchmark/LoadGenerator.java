package com.microsim.infra.benchmark;

import com.microsim.infra.ReplayVerifier;
import com.microsim.infra.RepetitionRunner;
import com.microsim.infra.RunResult;
import com.microsim.infra.Simulation;
import com.microsim.infra.SimulationConfig;

import java.nio.file.Paths;
import java.util.List;

/**
 * Performance Testing Tool.
 * Runs random order flow through a full simulation and reports throughput.
 *
 * <pre>
 * LoadGenerator [ticks] [seed] [-repetitions N THREADS] [-scenario FILE]
 * </pre>
 */
public class LoadGenerator {

    private static final int AGENTS = 8;

    public static void main(String[] args) throws InterruptedException {
        int ticks = 100_000;
        long seed = 42;
        int repetitions = 0;
        int threads = 1;
        String scenario = null;

        for (int i = 0; i < args.length; i++) {
            try {
                if ("-repetitions".equals(args[i])) {
                    repetitions = Integer.parseInt(args[++i]);
                    threads = Integer.parseInt(args[++i]);
                } else if ("-scenario".equals(args[i])) {
                    scenario = args[++i];
                } else if (i == 0) {
                    ticks = Integer.parseInt(args[i]);
                } else if (i == 1) {
                    seed = Long.parseLong(args[i]);
                }
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                System.err.println("Invalid argument near '" + args[Math.min(i, args.length - 1)] + "', using defaults");
            }
        }

        SimulationConfig config = (scenario == null ? SimulationConfig.load() : SimulationConfig.load(Paths.get(scenario)))
                .withSeed(seed);
        RandomOrderFlow flow = new RandomOrderFlow(AGENTS, ticks);

        if (repetitions > 0) {
            System.out.println("Running " + repetitions + " repetitions of " + ticks + " ticks on " + threads + " threads...");
            long start = System.currentTimeMillis();
            List<RunResult> results = new RepetitionRunner(config, repetitions, threads).run(flow);
            long end = System.currentTimeMillis();
            for (int i = 0; i < results.size(); i++) {
                System.out.println("  #" + i + " " + results.get(i));
            }
            System.out.println("Done in " + (end - start) + " ms");
            return;
        }

        System.out.println("Starting Load Generator: " + ticks + " ticks, seed " + seed + ", " + config);
        long start = System.nanoTime();
        RunResult result;
        try (Simulation simulation = new Simulation(config)) {
            flow.drive(simulation, 0);
            result = simulation.finish();
        }
        long elapsed = System.nanoTime() - start;

        int events = result.eventLog().size();
        System.out.println("Done. " + result);
        System.out.println("Throughput: " + (long) (events / (elapsed / 1e9)) + " events/sec");
        System.out.println("Avg per event (ns): " + (events == 0 ? 0 : elapsed / events));

        System.out.println("Verifying replay...");
        long replayStart = System.nanoTime();
        ReplayVerifier.verify(result, config);
        System.out.println("Replay identical (" + (System.nanoTime() - replayStart) / 1_000_000 + " ms)");
    }
}
