package com.microsim.core.ledger;

import com.microsim.api.FillPayload;
import com.microsim.core.AccountingInvariantException;
import org.agrona.collections.Long2ObjectHashMap;
import org.agrona.collections.LongArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <h1>The Accounting Ledger</h1>
 *
 * <p>
 * Turns the fill stream into per-participant cash and inventory. Every fill
 * is a transfer between exactly two accounts: the buyer pays
 * {@code price × quantity} and receives {@code quantity} lots, the seller the
 * reverse. Nothing is created or destroyed, so across all accounts the cash
 * and inventory deltas always sum to zero.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 * <li><b>Per fill:</b> the fill is valid, both legs cancel out and the totals
 * of the touched accounts are unchanged.</li>
 * <li><b>{@link #reconcile()}:</b> summed over every account, cash and
 * inventory deltas are zero.</li>
 * </ul>
 * <p>
 * Any breach throws {@link AccountingInvariantException}. It is never retried
 * or suppressed: results past that point would be meaningless.
 * </p>
 *
 * <p>
 * All arithmetic is on {@code long} ticks and lots, so every check is exact.
 * Not thread-safe; one ledger per run.
 * </p>
 */
public class AccountingLedger {

    public static final String INVALID_FILL_SIZE = "invalid_fill_size";
    public static final String INVALID_FILL_PRICE = "invalid_fill_price";
    public static final String CASH_TRANSFER_NOT_ZERO_SUM = "cash_transfer_not_zero_sum";
    public static final String INVENTORY_TRANSFER_NOT_ZERO_SUM = "inventory_transfer_not_zero_sum";
    public static final String CASH_CONSERVATION_VIOLATION = "cash_conservation_violation";
    public static final String INVENTORY_CONSERVATION_VIOLATION = "inventory_conservation_violation";
    public static final String PNL_NON_ZERO_SUM = "pnl_non_zero_sum";

    private final PnlConvention convention;
    private final Long2ObjectHashMap<Account> accounts = new Long2ObjectHashMap<>();

    // Fill ids applied since the last successful reconcile()
    private final LongArrayList unreconciledFills = new LongArrayList();

    private long processedFills;
    private long lastEventId = AccountingInvariantException.NO_EVENT;

    public AccountingLedger(PnlConvention convention) {
        if (convention == null) {
            throw new NullPointerException("convention");
        }
        this.convention = convention;
    }

    /**
     * Opens an account with its starting balances. The initial inventory is
     * carried at {@code openingPrice} for P&L purposes.
     *
     * @throws IllegalStateException if the owner already has an account
     */
    public AccountSnapshot openAccount(long owner, long initialCash, long initialInventory, long openingPrice) {
        if (accounts.containsKey(owner)) {
            throw new IllegalStateException("Account already open: " + owner);
        }
        if (initialInventory != 0 && openingPrice <= 0) {
            throw new IllegalArgumentException("Opening price must be positive for owner " + owner
                    + " with inventory " + initialInventory);
        }
        Account account = new Account(owner, initialCash, initialInventory, openingPrice,
                convention.newCostBasis());
        accounts.put(owner, account);
        return account.snapshot();
    }

    /**
     * Applies one fill to both counterparties. Owners without an account get
     * one with zero balances.
     *
     * @param eventId id of the FILL event that delivered the fill
     * @throws AccountingInvariantException on an invalid fill or a zero-sum
     *                                      breach
     */
    public void apply(FillPayload fill, long eventId) {
        long fillId = fill.fillId();
        lastEventId = eventId;
        if (fill.quantity() <= 0) {
            throw new AccountingInvariantException(INVALID_FILL_SIZE,
                    "fill size must be > 0, got " + fill.quantity(), eventId, fillId);
        }
        if (fill.price() <= 0) {
            throw new AccountingInvariantException(INVALID_FILL_PRICE,
                    "fill price must be > 0, got " + fill.price(), eventId, fillId);
        }

        Account buyer = accountFor(fill.buyer());
        Account seller = accountFor(fill.seller());

        long cashBefore = touchedCash(buyer, seller);
        long inventoryBefore = touchedInventory(buyer, seller);

        long notional = Math.multiplyExact(fill.price(), fill.quantity());
        long buyerCashDelta = -notional;
        long sellerCashDelta = notional;
        long buyerInventoryDelta = fill.quantity();
        long sellerInventoryDelta = -fill.quantity();

        if (buyerCashDelta + sellerCashDelta != 0) {
            throw new AccountingInvariantException(CASH_TRANSFER_NOT_ZERO_SUM,
                    "cash transfer drifted by " + (buyerCashDelta + sellerCashDelta), eventId, fillId);
        }
        if (buyerInventoryDelta + sellerInventoryDelta != 0) {
            throw new AccountingInvariantException(INVENTORY_TRANSFER_NOT_ZERO_SUM,
                    "inventory transfer drifted by " + (buyerInventoryDelta + sellerInventoryDelta), eventId, fillId);
        }

        buyer.cash += buyerCashDelta;
        buyer.inventory += buyerInventoryDelta;
        buyer.realizedPnl += buyer.costBasis.apply(buyerInventoryDelta, fill.price());
        buyer.fillCount++;

        seller.cash += sellerCashDelta;
        seller.inventory += sellerInventoryDelta;
        seller.realizedPnl += seller.costBasis.apply(sellerInventoryDelta, fill.price());
        seller.fillCount++;

        long cashDrift = touchedCash(buyer, seller) - cashBefore;
        if (cashDrift != 0) {
            throw new AccountingInvariantException(CASH_CONSERVATION_VIOLATION,
                    "total cash drifted by " + cashDrift, eventId, fillId);
        }
        long inventoryDrift = touchedInventory(buyer, seller) - inventoryBefore;
        if (inventoryDrift != 0) {
            throw new AccountingInvariantException(INVENTORY_CONSERVATION_VIOLATION,
                    "total inventory drifted by " + inventoryDrift, eventId, fillId);
        }

        processedFills++;
        unreconciledFills.addLong(fillId);
    }

    /**
     * Asserts that cash and inventory deltas over all accounts sum to zero.
     *
     * @throws AccountingInvariantException carrying every fill applied since
     *                                      the last successful reconciliation
     */
    public void reconcile() {
        long cashDelta = 0;
        long inventoryDelta = 0;
        for (Account account : accounts.values()) {
            cashDelta += account.cash - account.initialCash;
            inventoryDelta += account.inventory - account.initialInventory;
        }
        if (cashDelta != 0) {
            throw new AccountingInvariantException(CASH_CONSERVATION_VIOLATION,
                    "cash deltas sum to " + cashDelta, lastEventId, unreconciledFills.toLongArray());
        }
        if (inventoryDelta != 0) {
            throw new AccountingInvariantException(INVENTORY_CONSERVATION_VIOLATION,
                    "inventory deltas sum to " + inventoryDelta, lastEventId, unreconciledFills.toLongArray());
        }
        unreconciledFills.clear();
    }

    /**
     * @return the account's current state, or null if the owner has none
     */
    public AccountSnapshot snapshot(long owner) {
        Account account = accounts.get(owner);
        return account == null ? null : account.snapshot();
    }

    /**
     * @return every account, ordered by owner
     */
    public List<AccountSnapshot> snapshots() {
        List<AccountSnapshot> result = new ArrayList<>(accounts.size());
        for (long owner : sortedOwners()) {
            result.add(accounts.get(owner).snapshot());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Equity per owner, {@code cash + inventory × markPrice}, ordered by owner.
     */
    public Map<Long, Long> markToMarket(long markPrice) {
        if (markPrice < 0) {
            throw new IllegalArgumentException("Mark price must not be negative: " + markPrice);
        }
        Map<Long, Long> equity = new LinkedHashMap<>();
        for (long owner : sortedOwners()) {
            Account account = accounts.get(owner);
            equity.put(owner, account.cash + Math.multiplyExact(account.inventory, markPrice));
        }
        return equity;
    }

    /**
     * P&L per owner when a binary contract settles at {@code payout} ticks per
     * lot: the cash the owner gained or spent plus the settlement value of the
     * inventory acquired during the run.
     *
     * @throws AccountingInvariantException if the result is not zero-sum
     */
    public Map<Long, Long> settlementPnl(long payout) {
        if (payout < 0) {
            throw new IllegalArgumentException("Payout must not be negative: " + payout);
        }
        Map<Long, Long> pnl = new LinkedHashMap<>();
        long total = 0;
        for (long owner : sortedOwners()) {
            Account account = accounts.get(owner);
            long value = (account.cash - account.initialCash)
                    + Math.multiplyExact(account.inventory - account.initialInventory, payout);
            pnl.put(owner, value);
            total += value;
        }
        if (total != 0) {
            throw new AccountingInvariantException(PNL_NON_ZERO_SUM,
                    "settlement pnl sum drifted by " + total, lastEventId, unreconciledFills.toLongArray());
        }
        return pnl;
    }

    public long totalCash() {
        long total = 0;
        for (Account account : accounts.values()) {
            total += account.cash;
        }
        return total;
    }

    public long totalInventory() {
        long total = 0;
        for (Account account : accounts.values()) {
            total += account.inventory;
        }
        return total;
    }

    public long processedFills() {
        return processedFills;
    }

    public int accountCount() {
        return accounts.size();
    }

    public PnlConvention convention() {
        return convention;
    }

    // Direct access for tests that need to corrupt state
    Account accountOf(long owner) {
        return accounts.get(owner);
    }

    private Account accountFor(long owner) {
        Account account = accounts.get(owner);
        if (account == null) {
            account = new Account(owner, 0, 0, 0, convention.newCostBasis());
            accounts.put(owner, account);
        }
        return account;
    }

    private long[] sortedOwners() {
        long[] owners = new long[accounts.size()];
        int i = 0;
        Long2ObjectHashMap<Account>.KeyIterator it = accounts.keySet().iterator();
        while (it.hasNext()) {
            owners[i++] = it.nextLong();
        }
        Arrays.sort(owners);
        return owners;
    }

    // Self-trades touch a single account; count it once
    private static long touchedCash(Account buyer, Account seller) {
        return buyer == seller ? buyer.cash : buyer.cash + seller.cash;
    }

    private static long touchedInventory(Account buyer, Account seller) {
        return buyer == seller ? buyer.inventory : buyer.inventory + seller.inventory;
    }
}
