package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.transaction.ClientId;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only snapshot of a client account, one row of the final report.
 */
@Value
public class AccountSummary {
    ClientId clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;
}
