package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.transaction_engine.account.AccountSummary;
import com.flagship.transaction_engine.config.CsvConfig;
import com.flagship.transaction_engine.transaction.ClientId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountSummaryCsvWriterTest {

    private final CsvMapper csvMapper = new CsvConfig().csvMapper();

    private final List<AccountSummary> summaries = List.of(
        new AccountSummary(ClientId.of(1), new BigDecimal("1.5"), BigDecimal.ZERO, new BigDecimal("1.5"), false),
        new AccountSummary(ClientId.of(2), new BigDecimal("1E+3"), new BigDecimal("0.00005"),
            new BigDecimal("1000.00005"), true)
    );

    @Test
    @DisplayName("Balances keep their computed scale and are never scientific")
    void testWriteAsComputed() throws IOException {
        StringWriter output = new StringWriter();

        new AccountSummaryCsvWriter(csvMapper, -1).write(summaries, output);

        assertEquals(
            "client,available,held,total,locked\n" +
            "1,1.5,0,1.5,false\n" +
            "2,1000,0.00005,1000.00005,true\n",
            output.toString());
    }

    @Test
    @DisplayName("Balances are rescaled with half-even rounding when decimal places are configured")
    void testWriteWithDecimalPlaces() throws IOException {
        StringWriter output = new StringWriter();

        new AccountSummaryCsvWriter(csvMapper, 4).write(summaries, output);

        assertEquals(
            "client,available,held,total,locked\n" +
            "1,1.5000,0.0000,1.5000,false\n" +
            "2,1000.0000,0.0000,1000.0000,true\n",
            output.toString());
    }
}
