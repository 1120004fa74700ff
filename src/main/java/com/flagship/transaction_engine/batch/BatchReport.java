package com.flagship.transaction_engine.batch;

import com.flagship.transaction_engine.account.AccountSummary;
import lombok.Value;

import java.util.List;

/**
 * Result of one batch run: per-outcome counts plus the final account table.
 */
@Value
public class BatchReport {
    int processed;
    int applied;
    int ignored;
    int rejected;
    int skippedRows;
    List<AccountSummary> accounts;
}
