package com.flagship.transaction_engine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for transaction processing.
 *
 * Metrics exposed:
 * - transactions.processed: Counter per transaction type and result (applied/ignored/rejected)
 * - transactions.rejected: Counter per rejection reason
 * - transactions.rows.skipped: Counter of input rows that could not be turned into a transaction
 * - transactions.batch.duration: Timer for a full batch run
 */
@Component
public class TransactionMetrics {

    private final MeterRegistry registry;

    private final Counter rowsSkipped;
    private final Timer batchTimer;

    public TransactionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.rowsSkipped = Counter.builder("transactions.rows.skipped")
                .description("Number of input rows skipped as invalid")
                .register(registry);

        this.batchTimer = Timer.builder("transactions.batch.duration")
                .description("Time taken to process a transaction batch")
                .register(registry);
    }

    // ==================== Counter Methods ====================

    public void recordProcessed(String type, String result) {
        registry.counter("transactions.processed",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordRejected(String reason) {
        registry.counter("transactions.rejected",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordRowsSkipped(int count) {
        rowsSkipped.increment(count);
    }

    // ==================== Timer Methods ====================

    public void recordBatchDuration(Duration duration) {
        batchTimer.record(duration);
    }

    // ==================== Query Methods ====================

    public double processedCount(String type, String result) {
        return registry.counter("transactions.processed",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).count();
    }

    public double rowsSkippedCount() {
        return rowsSkipped.count();
    }

    public double rejectedCount(String reason) {
        return registry.counter("transactions.rejected", "reason", sanitizeTag(reason)).count();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
