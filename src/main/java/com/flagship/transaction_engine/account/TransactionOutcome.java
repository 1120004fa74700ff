package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.transaction.ClientId;
import com.flagship.transaction_engine.transaction.Transaction;
import com.flagship.transaction_engine.transaction.TransactionId;
import com.flagship.transaction_engine.transaction.TransactionType;
import lombok.Value;

/**
 * What happened to one transaction handed to {@link AccountEngine#process(Transaction)}.
 */
@Value
public class TransactionOutcome {
    TransactionType type;
    ClientId clientId;
    TransactionId transactionId;
    Result result;
    RejectionReason rejectionReason;
    String detail;

    public enum Result {
        APPLIED,    // balances (and possibly the ledger) were updated
        IGNORED,    // dispute-family record that references nothing applicable; dropped silently
        REJECTED    // business rule violation, reported with a RejectionReason
    }

    public static TransactionOutcome applied(Transaction transaction) {
        return new TransactionOutcome(
            transaction.getType(),
            transaction.getClientId(),
            transaction.getTransactionId(),
            Result.APPLIED,
            null,
            null
        );
    }

    public static TransactionOutcome ignored(Transaction transaction, String detail) {
        return new TransactionOutcome(
            transaction.getType(),
            transaction.getClientId(),
            transaction.getTransactionId(),
            Result.IGNORED,
            null,
            detail
        );
    }

    public static TransactionOutcome rejected(Transaction transaction, RejectionReason reason, String detail) {
        return new TransactionOutcome(
            transaction.getType(),
            transaction.getClientId(),
            transaction.getTransactionId(),
            Result.REJECTED,
            reason,
            detail
        );
    }

    public boolean isApplied() {
        return result == Result.APPLIED;
    }

    public boolean isIgnored() {
        return result == Result.IGNORED;
    }

    public boolean isRejected() {
        return result == Result.REJECTED;
    }
}
