package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One input row exactly as read from the file.
 *
 * <p>CSV columns: {@code type, client, tx, amount}. Every field is kept as text; conversion and
 * validation happen in {@link TransactionRowMapper}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawTransactionRow {

    /** Transaction type tag, e.g. {@code deposit}. */
    private String type;

    /** Client id, a 16-bit unsigned integer. */
    private String client;

    /** Transaction id, a 32-bit unsigned integer. */
    private String tx;

    /** Decimal amount; empty or absent for dispute, resolve and chargeback. */
    private String amount;
}
