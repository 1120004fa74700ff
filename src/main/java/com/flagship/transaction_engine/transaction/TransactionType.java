package com.flagship.transaction_engine.transaction;

import java.util.Locale;

/**
 * Discriminator of the {@link Transaction} variants, also the {@code type} tag used in input files.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    DISPUTE,
    RESOLVE,
    CHARGEBACK;

    /**
     * Whether records of this type carry an amount.
     */
    public boolean carriesAmount() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    /**
     * Resolves a tag such as {@code "deposit"} (case-insensitive, surrounding whitespace ignored).
     *
     * @throws IllegalArgumentException for an unknown tag
     */
    public static TransactionType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transaction type: '" + tag + "'", e);
        }
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
