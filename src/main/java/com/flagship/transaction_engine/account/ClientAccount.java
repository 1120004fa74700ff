package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.transaction.ClientId;
import com.flagship.transaction_engine.transaction.PositiveAmount;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Balances of a single client.
 *
 * Key invariants:
 * - total is always available + held and is never stored
 * - a locked account refuses every transition; {@link AccountEngine} calls {@link #ensureNotLocked()}
 *   before any ledger lookup, the mutators themselves do not re-check
 * - only a chargeback lowers the total without a matching withdrawal
 *
 * Mutators are package-private; {@link AccountEngine} is the only writer.
 */
@Getter
public class ClientAccount {

    private final ClientId clientId;
    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal held = BigDecimal.ZERO;
    private boolean locked;

    ClientAccount(ClientId clientId) {
        this.clientId = clientId;
    }

    public BigDecimal getTotal() {
        return available.add(held);
    }

    /**
     * @throws TransactionRejectedException with {@link RejectionReason#ACCOUNT_LOCKED}
     */
    void ensureNotLocked() {
        if (locked) {
            throw new TransactionRejectedException(RejectionReason.ACCOUNT_LOCKED,
                String.format("Account of client %s is locked, no transactions allowed", clientId));
        }
    }

    void deposit(PositiveAmount amount) {
        available = available.add(amount.getValue());
    }

    /**
     * Withdraws from the available balance. Nothing changes when funds are insufficient.
     */
    void withdraw(PositiveAmount amount) {
        if (available.compareTo(amount.getValue()) < 0) {
            throw new TransactionRejectedException(RejectionReason.INSUFFICIENT_FUNDS,
                String.format("Insufficient funds: available=%s, requested=%s",
                    available.toPlainString(), amount));
        }
        available = available.subtract(amount.getValue());
    }

    /**
     * Moves a disputed amount from available to held. Available may go negative if the disputed
     * funds were already withdrawn.
     */
    void hold(PositiveAmount amount) {
        available = available.subtract(amount.getValue());
        held = held.add(amount.getValue());
    }

    /**
     * Returns a previously held amount to available.
     */
    void release(PositiveAmount amount) {
        held = held.subtract(amount.getValue());
        available = available.add(amount.getValue());
    }

    /**
     * Removes a held amount from the account and locks it. This is the only transition that sets
     * the lock.
     */
    void chargeBack(PositiveAmount amount) {
        held = held.subtract(amount.getValue());
        locked = true;
    }

    AccountSummary toSummary() {
        return new AccountSummary(clientId, available, held, getTotal(), locked);
    }
}
