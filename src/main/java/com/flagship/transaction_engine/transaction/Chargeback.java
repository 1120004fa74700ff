package com.flagship.transaction_engine.transaction;

import lombok.NonNull;
import lombok.Value;

/**
 * Final decision on a disputed deposit in favour of the claimant: the held amount leaves the
 * account and the account is locked.
 */
@Value
public class Chargeback implements Transaction {
    @NonNull ClientId clientId;
    @NonNull TransactionId transactionId;

    @Override
    public TransactionType getType() {
        return TransactionType.CHARGEBACK;
    }
}
