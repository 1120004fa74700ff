package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_engine.account.AccountSummary;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Writes the final account table as CSV, header first, one row per client in the order given.
 *
 * With a negative {@code decimalPlaces} balances keep the scale produced by the arithmetic;
 * otherwise they are rescaled with {@link RoundingMode#HALF_EVEN}. Values are never written in
 * scientific notation.
 */
public class AccountSummaryCsvWriter {

    private final CsvMapper csvMapper;
    private final int decimalPlaces;

    public AccountSummaryCsvWriter(CsvMapper csvMapper, int decimalPlaces) {
        this.csvMapper = csvMapper;
        this.decimalPlaces = decimalPlaces;
    }

    /**
     * Writes all rows and flushes. The target writer is left open.
     */
    public void write(List<AccountSummary> summaries, Writer output) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(AccountSummaryRow.class).withHeader();
        try (SequenceWriter rows = csvMapper.writer(schema).writeValues(output)) {
            for (AccountSummary summary : summaries) {
                rows.write(toRow(summary));
            }
        }
        output.flush();
    }

    AccountSummaryRow toRow(AccountSummary summary) {
        return new AccountSummaryRow(
            summary.getClientId().toString(),
            format(summary.getAvailable()),
            format(summary.getHeld()),
            format(summary.getTotal()),
            summary.isLocked()
        );
    }

    private String format(BigDecimal value) {
        BigDecimal scaled = decimalPlaces < 0 ? value : value.setScale(decimalPlaces, RoundingMode.HALF_EVEN);
        return scaled.toPlainString();
    }
}
