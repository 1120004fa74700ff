package com.flagship.transaction_engine.transaction;

import lombok.Value;

/**
 * Opaque identifier of a transaction, a 32-bit unsigned value held in a {@code long}.
 */
@Value
public class TransactionId implements Comparable<TransactionId> {

    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    long value;

    private TransactionId(long value) {
        this.value = value;
    }

    public static TransactionId of(long value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                String.format("Transaction id must be between 0 and %d, got %d", MAX_VALUE, value));
        }
        return new TransactionId(value);
    }

    @Override
    public int compareTo(TransactionId other) {
        return Long.compare(this.value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
