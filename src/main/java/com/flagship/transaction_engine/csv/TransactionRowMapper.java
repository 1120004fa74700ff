package com.flagship.transaction_engine.csv;

import com.flagship.transaction_engine.transaction.Chargeback;
import com.flagship.transaction_engine.transaction.ClientId;
import com.flagship.transaction_engine.transaction.Deposit;
import com.flagship.transaction_engine.transaction.Dispute;
import com.flagship.transaction_engine.transaction.PositiveAmount;
import com.flagship.transaction_engine.transaction.Resolve;
import com.flagship.transaction_engine.transaction.Transaction;
import com.flagship.transaction_engine.transaction.TransactionId;
import com.flagship.transaction_engine.transaction.TransactionType;
import com.flagship.transaction_engine.transaction.Withdrawal;

/**
 * Converts raw rows into typed transactions.
 *
 * The amount column is required for deposits and withdrawals and ignored for the dispute family.
 */
public class TransactionRowMapper {

    /**
     * @throws InvalidTransactionRowException if the type, an id or a required amount is missing or invalid
     */
    public Transaction toTransaction(RawTransactionRow row) {
        TransactionType type;
        ClientId client;
        TransactionId tx;
        try {
            type = TransactionType.fromTag(row.getType());
            client = ClientId.of(parseInt("client", row.getClient()));
            tx = TransactionId.of(parseLong("tx", row.getTx()));
        } catch (IllegalArgumentException e) {
            throw new InvalidTransactionRowException(e.getMessage(), e);
        }

        return switch (type) {
            case DEPOSIT -> new Deposit(client, tx, amountOf(type, row));
            case WITHDRAWAL -> new Withdrawal(client, tx, amountOf(type, row));
            case DISPUTE -> new Dispute(client, tx);
            case RESOLVE -> new Resolve(client, tx);
            case CHARGEBACK -> new Chargeback(client, tx);
        };
    }

    private PositiveAmount amountOf(TransactionType type, RawTransactionRow row) {
        String amount = row.getAmount();
        if (amount == null || amount.isBlank()) {
            throw new InvalidTransactionRowException(
                String.format("Missing amount for transaction type '%s'", type.tag()));
        }
        try {
            return PositiveAmount.parse(amount);
        } catch (IllegalArgumentException e) {
            throw new InvalidTransactionRowException(e.getMessage(), e);
        }
    }

    private int parseInt(String column, String value) {
        long parsed = parseLong(column, value);
        if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                String.format("Column '%s' is out of range: '%s'", column, value));
        }
        return (int) parsed;
    }

    private long parseLong(String column, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing value for column '" + column + "'");
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                String.format("Column '%s' is not an integer: '%s'", column, value), e);
        }
    }
}
