package com.flagship.transaction_engine.transaction;

import lombok.NonNull;
import lombok.Value;

/**
 * Claim against an earlier deposit of the same client. Moves the deposited amount from available
 * to held while the claim is open.
 */
@Value
public class Dispute implements Transaction {
    @NonNull ClientId clientId;
    @NonNull TransactionId transactionId;

    @Override
    public TransactionType getType() {
        return TransactionType.DISPUTE;
    }
}
