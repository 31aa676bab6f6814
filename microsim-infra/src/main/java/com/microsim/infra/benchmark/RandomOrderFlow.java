package com.microsim.infra.benchmark;

import com.microsim.api.NewsPayload;
import com.microsim.api.Side;
import com.microsim.core.random.RandomStream;
import com.microsim.infra.ScenarioDriver;
import com.microsim.infra.Simulation;
import com.microsim.infra.SubmitReceipt;

import java.util.ArrayDeque;

/**
 * Random-walk order flow around a drifting mid price.
 * <p>
 * Agents take turns, one intent per tick. Each agent draws from its own
 * {@code "agents.<id>"} stream; the mid price walks on {@code "latent"}.
 * Most intents are passive limit orders inside a tight spread, some cross it,
 * and some cancel the agent's oldest order (which may already be filled).
 * </p>
 */
public class RandomOrderFlow implements ScenarioDriver {

    private static final long MIN_MID = 9_000;
    private static final long MAX_MID = 11_000;

    private final int agents;
    private final int ticks;

    public RandomOrderFlow(int agents, int ticks) {
        if (agents <= 0 || ticks <= 0) {
            throw new IllegalArgumentException("agents and ticks must be positive");
        }
        this.agents = agents;
        this.ticks = ticks;
    }

    @Override
    public void drive(Simulation simulation, int repetition) {
        RandomStream latent = simulation.stream("latent");
        RandomStream[] streams = new RandomStream[agents];
        @SuppressWarnings("unchecked")
        ArrayDeque<Long>[] working = new ArrayDeque[agents];
        for (int i = 0; i < agents; i++) {
            streams[i] = simulation.stream("agents." + (i + 1));
            working[i] = new ArrayDeque<>();
        }

        long start = simulation.now();
        long mid = 10_000;
        for (int tick = 1; tick <= ticks; tick++) {
            long now = start + tick;

            // 10% chance to move the mid
            if (latent.nextInt(100) < 10) {
                mid += latent.nextBoolean() ? 5 : -5;
                mid = Math.max(MIN_MID, Math.min(MAX_MID, mid));
            }
            if (latent.nextInt(1_000) == 0) {
                simulation.publish(new NewsPayload(mid), now);
            }

            int agent = tick % agents;
            RandomStream random = streams[agent];
            long owner = agent + 1;

            if (!working[agent].isEmpty() && random.nextInt(100) < 15) {
                simulation.cancel(owner, working[agent].pollFirst());
            } else {
                long spread = 5 + random.nextInt(10);
                boolean isBuy = random.nextBoolean();
                // 10% chance of crossing the spread
                boolean aggressive = random.nextInt(100) < 10;

                long price;
                if (isBuy) {
                    price = aggressive ? mid + spread : mid - spread;
                } else {
                    price = aggressive ? mid - spread : mid + spread;
                }
                long quantity = 10 + random.nextInt(90);

                SubmitReceipt receipt = simulation.submit(owner, isBuy ? Side.BUY : Side.SELL, price, quantity);
                if (receipt.isAccepted()) {
                    working[agent].addLast(receipt.orderId());
                }
            }

            simulation.runUntil(now);
        }
    }
}
