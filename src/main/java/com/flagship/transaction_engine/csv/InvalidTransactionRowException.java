package com.flagship.transaction_engine.csv;

/**
 * An input row that cannot be turned into a transaction.
 */
public class InvalidTransactionRowException extends IllegalArgumentException {

    public InvalidTransactionRowException(String message) {
        super(message);
    }

    public InvalidTransactionRowException(String message, Throwable cause) {
        super(message, cause);
    }
}
