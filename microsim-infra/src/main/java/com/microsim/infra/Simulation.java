package com.microsim.infra;

import com.lmax.disruptor.EventHandler;
import com.microsim.api.CancelPayload;
import com.microsim.api.Event;
import com.microsim.api.EventKind;
import com.microsim.api.EventPayload;
import com.microsim.api.FillPayload;
import com.microsim.api.OrderPayload;
import com.microsim.api.Side;
import com.microsim.core.BookSnapshot;
import com.microsim.core.ExecutionResult;
import com.microsim.core.MatchEventListener;
import com.microsim.core.MatchingEngine;
import com.microsim.core.clock.EventLog;
import com.microsim.core.clock.EventScheduler;
import com.microsim.core.ledger.AccountSnapshot;
import com.microsim.core.ledger.AccountingLedger;
import com.microsim.core.random.RandomStream;
import com.microsim.core.random.StreamManager;
import com.microsim.infra.logging.ChronicleLogger;
import com.microsim.infra.logging.Logger;
import com.microsim.infra.logging.NoOpLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * <b>One Simulation Run.</b>
 * <p>
 * The <b>Composition Root</b>: wires the deterministic core together and
 * drives it from a single-threaded event loop.
 * </p>
 *
 * <h3>Topology:</h3>
 *
 * <pre>
 * [Agents] --submit/cancel--> (EventScheduler: ORDER/CANCEL at now + submission delay)
 *                                     |
 *                                     v
 *                             [MatchingEngine] --fills--> (FILL at match time + fill delay)
 *                                                                 |
 *                                                                 v
 *                                                        [AccountingLedger]
 *
 * every processed event --> [EventLog] --> [EventTap] (optional, Disruptor)
 * </pre>
 *
 * <h3>Key Architecture Decisions:</h3>
 * <ul>
 * <li><b>One thread per run:</b> an event is processed to completion before
 * the next is popped. Waiting is expressed only by scheduling a future
 * event.</li>
 * <li><b>Fills are events:</b> the ledger sees a fill when its FILL event is
 * processed, so fill latency is simulated and the log alone is enough to
 * rebuild the ledger.</li>
 * <li><b>Local vs fatal errors:</b> a bad intent or a cancel of a dead order
 * is recorded as a rejection and the run goes on. An accounting breach or a
 * crossed book ends the run.</li>
 * </ul>
 */
public class Simulation implements AutoCloseable {

    private final SimulationConfig config;
    private final StreamManager streams;
    private final EventScheduler scheduler;
    private final MatchingEngine matchingEngine;
    private final AccountingLedger ledger;
    private final EventLog eventLog = new EventLog();
    private final LatencyModel latency;
    private final Logger logger;
    private final EventTap tap;

    private final List<FillPayload> fills = new ArrayList<>();
    private final List<ExecutionResult> rejections = new ArrayList<>();

    private long lastOrderId;
    private long crossedBookResolutions;
    private boolean finished;

    @SafeVarargs
    public Simulation(SimulationConfig config, EventHandler<EventSlot>... tapConsumers) {
        this(config, openJournal(config), tapConsumers);
    }

    /**
     * Takes ownership of {@code logger}: it is closed with the run, or right
     * away if the run cannot be built.
     */
    @SafeVarargs
    Simulation(SimulationConfig config, Logger logger, EventHandler<EventSlot>... tapConsumers) {
        this.config = config;
        this.logger = logger;
        try {
            this.streams = StreamManager.withRootSeed(config.seed());
            this.scheduler = new EventScheduler();
            this.latency = config.latencyModel();
            this.ledger = new AccountingLedger(config.pnlConvention());
            for (Map.Entry<Long, SimulationConfig.AccountConfig> entry : config.accounts().entrySet()) {
                SimulationConfig.AccountConfig account = entry.getValue();
                ledger.openAccount(entry.getKey(), account.cash(), account.inventory(), account.openingPrice());
            }
            this.matchingEngine = new MatchingEngine(new LoggingListener(logger),
                    config.orderPoolCapacity(), config.levelPoolCapacity());
            this.tap = config.tapBufferSize() > 0 && tapConsumers.length > 0
                    ? new EventTap(config.tapBufferSize(), logger, tapConsumers)
                    : null;
        } catch (RuntimeException e) {
            logger.close();
            throw e;
        }

        logger.log("run started, seed", config.seed());
    }

    private static Logger openJournal(SimulationConfig config) {
        return config.journalPath().isEmpty()
                ? NoOpLogger.INSTANCE
                : new ChronicleLogger(config.journalPath());
    }

    /**
     * Schedules a new limit order. Malformed intents are rejected here and
     * never become events.
     */
    public SubmitReceipt submit(long owner, byte side, long price, long quantity) {
        requireRunning();
        long orderId = ++lastOrderId;
        String reason = null;
        if (!Side.isValid(side)) {
            reason = "Invalid side: " + side;
        } else if (price <= 0) {
            reason = "Price must be positive: " + price;
        } else if (quantity <= 0) {
            reason = "Quantity must be positive: " + quantity;
        }
        if (reason != null) {
            logger.log("intent rejected", orderId);
            rejections.add(ExecutionResult.rejected(orderId, reason));
            return SubmitReceipt.rejected(orderId, reason);
        }

        Event event = scheduler.schedule(new OrderPayload(orderId, owner, side, price, quantity),
                scheduler.now() + latency.submissionDelay());
        return SubmitReceipt.accepted(orderId, event.eventId());
    }

    /**
     * Schedules a cancel. Whether the order is still resting is only known
     * when the cancel is processed; if not, the cancel is rejected then.
     */
    public SubmitReceipt cancel(long owner, long orderId) {
        requireRunning();
        Event event = scheduler.schedule(new CancelPayload(orderId, owner),
                scheduler.now() + latency.submissionDelay());
        return SubmitReceipt.accepted(orderId, event.eventId());
    }

    /**
     * Schedules an event from an outside collaborator (news, batch clears,
     * RFQ traffic). The core logs and taps it without interpreting it.
     */
    public Event publish(EventPayload payload, long atTime) {
        requireRunning();
        byte kind = payload.kind();
        if (kind == EventKind.ORDER || kind == EventKind.CANCEL || kind == EventKind.FILL) {
            throw new IllegalArgumentException(EventKind.name(kind) + " events are scheduled by the simulation itself");
        }
        return scheduler.schedule(payload, atTime);
    }

    /**
     * Processes the next pending event.
     *
     * @return the event, or null when nothing is pending
     */
    public Event step() {
        Event event = scheduler.advance();
        if (event != null) {
            process(event);
        }
        return event;
    }

    /**
     * Processes every event up to and including {@code time}, then moves the
     * clock to {@code time}.
     *
     * @return number of events processed
     */
    public int runUntil(long time) {
        int processed = 0;
        while (scheduler.hasPending() && scheduler.peekTime() <= time) {
            step();
            processed++;
        }
        if (time > scheduler.now()) {
            scheduler.advanceTo(time);
        }
        return processed;
    }

    public int runToCompletion() {
        int processed = 0;
        while (step() != null) {
            processed++;
        }
        return processed;
    }

    /**
     * Drains the queue, reconciles the ledger and closes the run.
     *
     * @throws com.microsim.core.AccountingInvariantException if reconciliation
     *                                                        fails
     */
    public RunResult finish() {
        requireRunning();
        runToCompletion();
        ledger.reconcile();
        finished = true;
        logger.log("run complete, events", eventLog.size());
        if (tap != null) {
            tap.close();
            if (tap.failureCount() > 0) {
                logger.log("tap consumer failures", tap.failureCount());
            }
        }
        RunResult result = new RunResult(config.seed(), eventLog, fills, ledger.snapshots(),
                matchingEngine.snapshot(), rejections, crossedBookResolutions);
        close();
        return result;
    }

    private void process(Event event) {
        eventLog.append(event);

        switch (event.kind()) {
            case EventKind.ORDER:
            case EventKind.CANCEL:
                processIntent(event);
                break;
            case EventKind.FILL:
                FillPayload fill = event.payload(FillPayload.class);
                ledger.apply(fill, event.eventId());
                fills.add(fill);
                break;
            default:
                // Collaborator events only need to be logged and tapped
                break;
        }

        if (tap != null) {
            tap.publish(event);
        }
    }

    private void processIntent(Event event) {
        long resolutionsBefore = matchingEngine.crossedBookResolutions();
        ExecutionResult result = matchingEngine.process(event);

        if (result.isRejected()) {
            rejections.add(result);
        }
        for (FillPayload fill : result.fills()) {
            scheduler.schedule(fill, event.timestamp() + latency.fillDelay());
        }

        long resolutions = matchingEngine.crossedBookResolutions() - resolutionsBefore;
        if (resolutions > 0) {
            crossedBookResolutions += resolutions;
            logger.log("crossed book resolved at event", event.eventId());
        }
        if (matchingEngine.isCrossed()) {
            throw new IllegalStateException("Book crossed after event " + event);
        }
    }

    private void requireRunning() {
        if (finished) {
            throw new IllegalStateException("Simulation already finished");
        }
    }

    public long now() {
        return scheduler.now();
    }

    /**
     * Named random stream for an agent or mechanism collaborator.
     */
    public RandomStream stream(String name) {
        return streams.stream(name);
    }

    public long bestBid() {
        return matchingEngine.bestBid();
    }

    public long bestAsk() {
        return matchingEngine.bestAsk();
    }

    public long depthAt(long price) {
        return matchingEngine.depthAt(price);
    }

    public byte statusOf(long orderId) {
        return matchingEngine.statusOf(orderId);
    }

    public BookSnapshot book() {
        return matchingEngine.snapshot();
    }

    /**
     * @return the account, or null if the owner has none yet
     */
    public AccountSnapshot account(long owner) {
        return ledger.snapshot(owner);
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public List<FillPayload> fills() {
        return fills;
    }

    public int pending() {
        return scheduler.pending();
    }

    public SimulationConfig config() {
        return config;
    }

    public MatchingEngine getMatchingEngine() {
        return matchingEngine;
    }

    public AccountingLedger getLedger() {
        return ledger;
    }

    /**
     * @return the event tap, or null when the run has none
     */
    public EventTap getEventTap() {
        return tap;
    }

    /**
     * Stops the tap (after it has delivered everything) and closes the
     * journal. Safe to call more than once.
     */
    @Override
    public void close() {
        finished = true;
        if (tap != null) {
            tap.close();
        }
        logger.close();
    }

    /**
     * Journals engine decisions; results themselves travel through
     * {@link ExecutionResult}.
     */
    private static final class LoggingListener implements MatchEventListener {

        private final Logger logger;

        LoggingListener(Logger logger) {
            this.logger = logger;
        }

        @Override
        public void onFill(FillPayload fill) {
            logger.log("fill", fill.fillId());
        }

        @Override
        public void onOrderAccepted(long orderId, long owner, byte side, long price, long restingQuantity) {
            logger.log("order resting", orderId);
        }

        @Override
        public void onOrderRejected(long orderId, long owner, String reason) {
            logger.log(reason, orderId);
        }

        @Override
        public void onOrderCanceled(long orderId, long owner, long canceledQuantity) {
            logger.log("order canceled", orderId);
        }
    }
}
