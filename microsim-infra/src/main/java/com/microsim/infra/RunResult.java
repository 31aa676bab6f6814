package com.microsim.infra;

import com.microsim.api.FillPayload;
import com.microsim.core.BookSnapshot;
import com.microsim.core.ExecutionResult;
import com.microsim.core.clock.EventLog;
import com.microsim.core.ledger.AccountSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a finished run hands to downstream consumers.
 */
public final class RunResult {

    private final long rootSeed;
    private final EventLog eventLog;
    private final List<FillPayload> fills;
    private final List<AccountSnapshot> accounts;
    private final BookSnapshot book;
    private final List<ExecutionResult> rejections;
    private final long crossedBookResolutions;

    public RunResult(long rootSeed, EventLog eventLog, List<FillPayload> fills, List<AccountSnapshot> accounts,
            BookSnapshot book, List<ExecutionResult> rejections, long crossedBookResolutions) {
        this.rootSeed = rootSeed;
        this.eventLog = eventLog;
        this.fills = Collections.unmodifiableList(new ArrayList<>(fills));
        this.accounts = Collections.unmodifiableList(new ArrayList<>(accounts));
        this.book = book;
        this.rejections = Collections.unmodifiableList(new ArrayList<>(rejections));
        this.crossedBookResolutions = crossedBookResolutions;
    }

    public long rootSeed() {
        return rootSeed;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    /**
     * @return fills in the order the ledger applied them
     */
    public List<FillPayload> fills() {
        return fills;
    }

    /**
     * @return final account states, ordered by owner
     */
    public List<AccountSnapshot> accounts() {
        return accounts;
    }

    public BookSnapshot book() {
        return book;
    }

    /**
     * @return rejected orders and cancels, in the order they were rejected
     */
    public List<ExecutionResult> rejections() {
        return rejections;
    }

    public long crossedBookResolutions() {
        return crossedBookResolutions;
    }

    @Override
    public String toString() {
        return "RunResult{" +
                "seed=" + rootSeed +
                ", events=" + eventLog.size() +
                ", fills=" + fills.size() +
                ", accounts=" + accounts.size() +
                ", rejections=" + rejections.size() +
                '}';
    }
}
