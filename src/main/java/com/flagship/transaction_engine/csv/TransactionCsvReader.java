package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_engine.transaction.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Streams transactions out of a CSV document with a {@code type, client, tx, amount} header.
 *
 * Rows that cannot be converted are logged and skipped when {@code skipInvalidRows} is set;
 * otherwise the first one ends the iteration with an {@link InvalidTransactionRowException}.
 * I/O failures of the underlying reader surface as {@link UncheckedIOException}.
 */
@Slf4j
public class TransactionCsvReader implements Iterator<Transaction>, Closeable {

    private final MappingIterator<RawTransactionRow> rows;
    private final TransactionRowMapper rowMapper;
    private final boolean skipInvalidRows;

    private Transaction next;
    private long rowNumber;
    private int skippedRows;

    private TransactionCsvReader(MappingIterator<RawTransactionRow> rows, TransactionRowMapper rowMapper,
                                 boolean skipInvalidRows) {
        this.rows = rows;
        this.rowMapper = rowMapper;
        this.skipInvalidRows = skipInvalidRows;
    }

    public static TransactionCsvReader open(CsvMapper csvMapper, Reader input, boolean skipInvalidRows)
            throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        MappingIterator<RawTransactionRow> rows = csvMapper
            .readerFor(RawTransactionRow.class)
            .with(schema)
            .readValues(input);
        return new TransactionCsvReader(rows, new TransactionRowMapper(), skipInvalidRows);
    }

    @Override
    public boolean hasNext() {
        while (next == null) {
            RawTransactionRow row = nextRow();
            if (row == null) {
                return false;
            }
            next = convert(row);
        }
        return true;
    }

    @Override
    public Transaction next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Transaction transaction = next;
        next = null;
        return transaction;
    }

    /**
     * Number of rows skipped as invalid so far.
     */
    public int getSkippedRows() {
        return skippedRows;
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }

    private RawTransactionRow nextRow() {
        try {
            if (!rows.hasNextValue()) {
                return null;
            }
            rowNumber++;
            return rows.nextValue();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read transaction row " + (rowNumber + 1), e);
        }
    }

    private Transaction convert(RawTransactionRow row) {
        try {
            return rowMapper.toTransaction(row);
        } catch (InvalidTransactionRowException e) {
            if (!skipInvalidRows) {
                throw new InvalidTransactionRowException(
                    String.format("Invalid transaction at row %d: %s", rowNumber, e.getMessage()), e);
            }
            skippedRows++;
            log.warn("Skipping invalid transaction at row {}: {}", rowNumber, e.getMessage());
            return null;
        }
    }
}
