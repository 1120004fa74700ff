package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.transaction.ClientId;
import com.flagship.transaction_engine.transaction.PositiveAmount;
import com.flagship.transaction_engine.transaction.TransactionId;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Record of every deposit processed during a run, keyed by transaction id, together with its
 * dispute status.
 *
 * Deposits are the only records that dispute, resolve and chargeback may reference. Withdrawals
 * leave no trace here.
 *
 * Entries are never removed: a charged-back deposit stays in the ledger with its disputed flag set.
 * The ledger is owned by a single {@code AccountEngine} and is not thread-safe.
 */
@Slf4j
public class Ledger {

    private final Map<TransactionId, DepositRecord> deposits = new HashMap<>();

    /**
     * Records a new, undisputed deposit.
     * Callers check {@link #contains(TransactionId)} first; ids are never overwritten.
     *
     * @throws IllegalStateException if a deposit was already recorded under {@code tx}
     */
    public void recordDeposit(TransactionId tx, ClientId client, PositiveAmount amount) {
        if (deposits.containsKey(tx)) {
            throw new IllegalStateException(
                String.format("Transaction %s was already recorded as a deposit", tx));
        }
        deposits.put(tx, DepositRecord.undisputed(client, amount));
        log.trace("Recorded deposit: tx={}, client={}, amount={}", tx, client, amount);
    }

    public boolean contains(TransactionId tx) {
        return deposits.containsKey(tx);
    }

    public Optional<DepositRecord> lookup(TransactionId tx) {
        return Optional.ofNullable(deposits.get(tx));
    }

    /**
     * Sets the disputed flag. The caller has already checked that the deposit exists and is not
     * disputed.
     */
    public void markDisputed(TransactionId tx) {
        deposits.computeIfPresent(tx, (id, deposit) -> deposit.withDisputed(true));
    }

    /**
     * Clears the disputed flag so the deposit may be disputed again later.
     */
    public void markResolved(TransactionId tx) {
        deposits.computeIfPresent(tx, (id, deposit) -> deposit.withDisputed(false));
    }

    public int size() {
        return deposits.size();
    }
}
