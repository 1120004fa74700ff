package com.flagship.transaction_engine.transaction;

import lombok.NonNull;
import lombok.Value;

@Value
public class Resolve implements Transaction {
    @NonNull ClientId clientId;
    @NonNull TransactionId transactionId;

    @Override
    public TransactionType getType() {
        return TransactionType.RESOLVE;
    }
}
