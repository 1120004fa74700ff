package com.flagship.transaction_engine.batch;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.transaction_engine.account.AccountEngine;
import com.flagship.transaction_engine.account.AccountSummary;
import com.flagship.transaction_engine.account.TransactionOutcome;
import com.flagship.transaction_engine.csv.AccountSummaryCsvWriter;
import com.flagship.transaction_engine.csv.TransactionCsvReader;
import com.flagship.transaction_engine.ledger.Ledger;
import com.flagship.transaction_engine.observability.TransactionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.Duration;
import java.util.List;

/**
 * Runs a transaction log through a fresh {@link AccountEngine} and writes the resulting accounts.
 *
 * Each call starts from an empty ledger and no accounts; nothing carries over between runs.
 * Transactions are applied strictly in input order and no single outcome aborts the run.
 */
@Service
@Slf4j
public class TransactionBatchProcessor {

    private final CsvMapper csvMapper;
    private final TransactionMetrics metrics;
    private final boolean skipInvalidRows;
    private final int decimalPlaces;

    public TransactionBatchProcessor(CsvMapper csvMapper,
                                     TransactionMetrics metrics,
                                     @Value("${engine.reader.skip-invalid-rows:true}") boolean skipInvalidRows,
                                     @Value("${engine.writer.decimal-places:-1}") int decimalPlaces) {
        this.csvMapper = csvMapper;
        this.metrics = metrics;
        this.skipInvalidRows = skipInvalidRows;
        this.decimalPlaces = decimalPlaces;
    }

    /**
     * Reads every transaction from {@code input}, applies it, and writes the account table to
     * {@code output}. Neither stream is closed.
     *
     * @throws IOException if reading the input or writing the output fails
     */
    public BatchReport process(Reader input, Writer output) throws IOException {
        long startTime = System.currentTimeMillis();
        log.info("Starting transaction batch");

        AccountEngine engine = new AccountEngine(new Ledger(), metrics);
        int processed = 0;
        int applied = 0;
        int ignored = 0;
        int rejected = 0;
        int skippedRows;

        try (TransactionCsvReader reader = TransactionCsvReader.open(csvMapper, input, skipInvalidRows)) {
            while (reader.hasNext()) {
                TransactionOutcome outcome = engine.process(reader.next());
                processed++;
                switch (outcome.getResult()) {
                    case APPLIED -> applied++;
                    case IGNORED -> ignored++;
                    case REJECTED -> rejected++;
                }
            }
            skippedRows = reader.getSkippedRows();
        }

        metrics.recordRowsSkipped(skippedRows);

        List<AccountSummary> accounts = engine.summaries();
        new AccountSummaryCsvWriter(csvMapper, decimalPlaces).write(accounts, output);

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordBatchDuration(Duration.ofMillis(duration));
        log.info("Transaction batch finished: processed={}, applied={}, ignored={}, rejected={}, " +
                "skippedRows={}, accounts={}, duration={}ms",
            processed, applied, ignored, rejected, skippedRows, accounts.size(), duration);

        return new BatchReport(processed, applied, ignored, rejected, skippedRows, accounts);
    }
}
