package com.microsim.infra;

import com.microsim.api.Event;
import com.microsim.api.EventKind;
import com.microsim.api.FillPayload;
import com.microsim.core.BookSnapshot;
import com.microsim.core.ExecutionResult;
import com.microsim.core.MatchEventListener;
import com.microsim.core.MatchingEngine;
import com.microsim.core.ReplayDivergenceException;
import com.microsim.core.clock.EventLog;
import com.microsim.core.ledger.AccountSnapshot;
import com.microsim.core.ledger.AccountingLedger;
import org.agrona.collections.Long2ObjectHashMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a run from its event log alone and checks it against the
 * original.
 * <p>
 * ORDER and CANCEL events are re-processed by a fresh engine with their
 * logged timestamps and sequences. Every logged FILL must be exactly a fill
 * the replayed engine produced; it is then applied to a fresh ledger. Any
 * mismatch is a {@link ReplayDivergenceException} carrying the event id where
 * it was found.
 * </p>
 */
public final class ReplayVerifier {

    private ReplayVerifier() {
    }

    public static RunResult replay(EventLog log, SimulationConfig config) {
        MatchingEngine engine = new MatchingEngine(SilentListener.INSTANCE,
                config.orderPoolCapacity(), config.levelPoolCapacity());
        AccountingLedger ledger = new AccountingLedger(config.pnlConvention());
        for (Map.Entry<Long, SimulationConfig.AccountConfig> entry : config.accounts().entrySet()) {
            SimulationConfig.AccountConfig account = entry.getValue();
            ledger.openAccount(entry.getKey(), account.cash(), account.inventory(), account.openingPrice());
        }

        // Fills produced by the replayed engine whose FILL event is not yet seen
        Long2ObjectHashMap<FillPayload> produced = new Long2ObjectHashMap<>();
        List<FillPayload> fills = new ArrayList<>();
        List<ExecutionResult> rejections = new ArrayList<>();

        for (Event event : log.events()) {
            switch (event.kind()) {
                case EventKind.ORDER:
                case EventKind.CANCEL: {
                    ExecutionResult result = engine.process(event);
                    if (result.isRejected()) {
                        rejections.add(result);
                    }
                    for (FillPayload fill : result.fills()) {
                        produced.put(fill.fillId(), fill);
                    }
                    break;
                }
                case EventKind.FILL: {
                    FillPayload logged = event.payload(FillPayload.class);
                    FillPayload expected = produced.remove(logged.fillId());
                    if (expected == null) {
                        throw new ReplayDivergenceException(event.eventId(),
                                "Logged fill " + logged.fillId() + " was never produced by the replayed engine");
                    }
                    if (!expected.equals(logged)) {
                        throw new ReplayDivergenceException(event.eventId(),
                                "Logged " + logged + " but replay produced " + expected);
                    }
                    ledger.apply(logged, event.eventId());
                    fills.add(logged);
                    break;
                }
                default:
                    break;
            }
        }

        return new RunResult(config.seed(), log, fills, ledger.snapshots(), engine.snapshot(), rejections,
                engine.crossedBookResolutions());
    }

    /**
     * Replays {@code original}'s log and compares fills, accounts and book.
     *
     * @throws ReplayDivergenceException on the first difference
     */
    public static RunResult verify(RunResult original, SimulationConfig config) {
        RunResult replayed = replay(original.eventLog(), config);

        List<FillPayload> expectedFills = original.fills();
        List<FillPayload> actualFills = replayed.fills();
        for (int i = 0; i < Math.min(expectedFills.size(), actualFills.size()); i++) {
            if (!expectedFills.get(i).equals(actualFills.get(i))) {
                throw new ReplayDivergenceException(ReplayDivergenceException.END_OF_LOG,
                        "Fill #" + i + " differs: " + expectedFills.get(i) + " vs " + actualFills.get(i));
            }
        }
        if (expectedFills.size() != actualFills.size()) {
            throw new ReplayDivergenceException(ReplayDivergenceException.END_OF_LOG,
                    "Fill count differs: " + expectedFills.size() + " vs " + actualFills.size());
        }

        List<AccountSnapshot> expectedAccounts = original.accounts();
        if (!expectedAccounts.equals(replayed.accounts())) {
            throw new ReplayDivergenceException(ReplayDivergenceException.END_OF_LOG,
                    "Accounts differ: " + expectedAccounts + " vs " + replayed.accounts());
        }

        BookSnapshot expectedBook = original.book();
        if (!expectedBook.equals(replayed.book())) {
            throw new ReplayDivergenceException(ReplayDivergenceException.END_OF_LOG,
                    "Book differs: " + expectedBook + " vs " + replayed.book());
        }
        return replayed;
    }

    private static final class SilentListener implements MatchEventListener {

        static final SilentListener INSTANCE = new SilentListener();

        @Override
        public void onFill(FillPayload fill) {
        }

        @Override
        public void onOrderAccepted(long orderId, long owner, byte side, long price, long restingQuantity) {
        }

        @Override
        public void onOrderRejected(long orderId, long owner, String reason) {
        }

        @Override
        public void onOrderCanceled(long orderId, long owner, long canceledQuantity) {
        }
    }
}
