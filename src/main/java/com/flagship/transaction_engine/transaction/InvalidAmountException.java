package com.flagship.transaction_engine.transaction;

/**
 * Thrown when an amount cannot be turned into a {@link PositiveAmount}.
 */
public class InvalidAmountException extends IllegalArgumentException {

    public InvalidAmountException(String message) {
        super(message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(message, cause);
    }
}
