package com.microsim.infra;

import com.microsim.api.Event;
import com.microsim.api.FillPayload;
import com.microsim.api.Side;
import com.microsim.core.ReplayDivergenceException;
import com.microsim.core.clock.EventLog;
import com.microsim.infra.benchmark.RandomOrderFlow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplayVerifierTest {

    private static final SimulationConfig CONFIG = SimulationConfig.builder()
            .seed(2024)
            .submissionLatency(1)
            .fillLatency(2)
            .account(1, 1_000_000, 100, 10_000)
            .build();

    private static RunResult run(SimulationConfig config) {
        try (Simulation simulation = new Simulation(config)) {
            new RandomOrderFlow(4, 2_000).drive(simulation, 0);
            return simulation.finish();
        }
    }

    @Test
    void replayOfTheLogReproducesTheRun() {
        RunResult original = run(CONFIG);
        assertFalse(original.fills().isEmpty());

        RunResult replayed = ReplayVerifier.verify(original, CONFIG);
        assertEquals(original.fills(), replayed.fills());
        assertEquals(original.accounts(), replayed.accounts());
        assertEquals(original.book(), replayed.book());
    }

    @Test
    void replayWorksFromTheEncodedLog() {
        RunResult original = run(CONFIG);
        EventLog decoded = EventLog.decode(original.eventLog().encode());

        RunResult replayed = ReplayVerifier.replay(decoded, CONFIG);
        assertEquals(original.accounts(), replayed.accounts());
        assertEquals(original.book(), replayed.book());
    }

    @Test
    void tamperedFillIsReportedAtItsEvent() {
        EventLog log;
        try (Simulation simulation = new Simulation(CONFIG)) {
            simulation.submit(1, Side.SELL, 100, 5);
            simulation.submit(2, Side.BUY, 100, 5);
            log = simulation.finish().eventLog();
        }

        List<Event> events = new ArrayList<>(log.events());
        Event fillEvent = events.get(2);
        FillPayload fill = fillEvent.payload(FillPayload.class);
        events.set(2, new Event(fillEvent.eventId(), fillEvent.timestamp(), fillEvent.sequence(),
                new FillPayload(fill.fillId(), fill.makerOrderId(), fill.takerOrderId(), fill.buyer(), fill.seller(),
                        fill.price() + 1, fill.quantity(), fill.matchTimestamp())));

        ReplayDivergenceException e = assertThrows(ReplayDivergenceException.class,
                () -> ReplayVerifier.replay(new EventLog(events), CONFIG));
        assertEquals(fillEvent.eventId(), e.getEventId());
    }

    @Test
    void differentConfigurationDiverges() {
        RunResult original = run(CONFIG);
        SimulationConfig other = CONFIG.toBuilder().account(1, 0, 0, 0).build();

        assertThrows(ReplayDivergenceException.class, () -> ReplayVerifier.verify(original, other));
    }
}
