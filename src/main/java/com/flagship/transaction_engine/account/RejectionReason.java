package com.flagship.transaction_engine.account;

/**
 * Reported (non-silent) reasons for refusing a transaction.
 *
 * Dispute, resolve and chargeback records that reference an unknown deposit, another client's
 * deposit or a deposit in the wrong dispute state are dropped without a reason from this list.
 */
public enum RejectionReason {
    /**
     * The account was locked by an earlier chargeback. Applies to every transaction type.
     */
    ACCOUNT_LOCKED,

    /**
     * A deposit reused a transaction id already recorded in the ledger.
     */
    DUPLICATE_TRANSACTION,

    /**
     * A withdrawal asked for more than the available balance.
     */
    INSUFFICIENT_FUNDS
}
