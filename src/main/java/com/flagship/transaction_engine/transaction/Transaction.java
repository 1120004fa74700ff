package com.flagship.transaction_engine.transaction;

/**
 * One record of the transaction log.
 *
 * The set of variants is closed: deposits and withdrawals carry a {@link PositiveAmount},
 * the dispute family ({@link Dispute}, {@link Resolve}, {@link Chargeback}) only references
 * an earlier deposit by its transaction id.
 */
public sealed interface Transaction permits Deposit, Withdrawal, Dispute, Resolve, Chargeback {

    /**
     * The client whose account this record targets.
     */
    ClientId getClientId();

    /**
     * For deposits and withdrawals, the id of this transaction. For the dispute family, the id of
     * the deposit being referenced.
     */
    TransactionId getTransactionId();

    TransactionType getType();
}
