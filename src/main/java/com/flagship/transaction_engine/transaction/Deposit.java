package com.flagship.transaction_engine.transaction;

import lombok.NonNull;
import lombok.Value;

@Value
public class Deposit implements Transaction {
    @NonNull ClientId clientId;
    @NonNull TransactionId transactionId;
    @NonNull PositiveAmount amount;

    @Override
    public TransactionType getType() {
        return TransactionType.DEPOSIT;
    }
}
