package com.flagship.transaction_engine.account;

import lombok.Getter;

/**
 * Raised by an account transition whose business precondition does not hold.
 * {@link AccountEngine} turns it into a rejected {@link TransactionOutcome}; it does not escape a run.
 */
@Getter
public class TransactionRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public TransactionRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
