package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * One output row: {@code client,available,held,total,locked}.
 * Balances are pre-rendered as plain decimal strings.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountSummaryRow {
    String client;
    String available;
    String held;
    String total;
    boolean locked;
}
