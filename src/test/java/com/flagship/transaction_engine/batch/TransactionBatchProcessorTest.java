package com.flagship.transaction_engine.batch;

import com.flagship.transaction_engine.account.AccountSummary;
import com.flagship.transaction_engine.transaction.ClientId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Batch tests: replay a full transaction file through the wired application.
 *
 * These tests verify that:
 * - Every valid row reaches the engine in file order
 * - Invalid rows are skipped without stopping the run
 * - The account table matches the expected output
 * - Runs do not share state
 */
@SpringBootTest(properties = {
    "engine.runner.enabled=false",
    "engine.writer.decimal-places=4"
})
class TransactionBatchProcessorTest {

    @Autowired
    private TransactionBatchProcessor batchProcessor;

    @Autowired
    private ApplicationContext context;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private String readFixture(String name) throws IOException {
        return new ClassPathResource("fixtures/" + name)
            .getContentAsString(StandardCharsets.UTF_8);
    }

    private Reader openFixture(String name) throws IOException {
        return new InputStreamReader(new ClassPathResource("fixtures/" + name).getInputStream(),
            StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Fixture file produces the expected account table")
    void testFixtureMatchesExpectedOutput() throws IOException {
        printTestHeader("Fixture Replay");

        StringWriter output = new StringWriter();
        BatchReport report;
        try (Reader input = openFixture("transactions.csv")) {
            report = batchProcessor.process(input, output);
        }

        System.out.println(output);
        assertEquals(readFixture("expected_accounts.csv"), output.toString());

        assertEquals(12, report.getProcessed());
        assertEquals(9, report.getApplied());
        assertEquals(1, report.getIgnored());
        assertEquals(2, report.getRejected());
        assertEquals(2, report.getSkippedRows());
        assertEquals(3, report.getAccounts().size());
    }

    @Test
    @DisplayName("An amount with unbounded scale is skipped and keeps the output short")
    void testUnboundedScaleAmountSkipped() throws IOException {
        printTestHeader("Unbounded Scale Amount");

        StringWriter output = new StringWriter();
        BatchReport report = batchProcessor.process(new StringReader(
            "type,client,tx,amount\n" +
            "deposit,1,1,1e-5000000\n" +
            "deposit,1,2,1\n"), output);

        assertEquals("client,available,held,total,locked\n" +
            "1,1.0000,0.0000,1.0000,false\n", output.toString());
        assertEquals(1, report.getSkippedRows());
        assertEquals(1, report.getApplied());
    }

    @Test
    @DisplayName("Each run starts from an empty ledger")
    void testRunsAreIndependent() throws IOException {
        String csv = "type,client,tx,amount\ndeposit,1,1,5.0\n";

        BatchReport first = batchProcessor.process(new StringReader(csv), new StringWriter());
        BatchReport second = batchProcessor.process(new StringReader(csv), new StringWriter());

        assertEquals(1, first.getApplied());
        assertEquals(1, second.getApplied(), "Same deposit id is not a duplicate in a new run");
        AccountSummary account = second.getAccounts().get(0);
        assertEquals(ClientId.of(1), account.getClientId());
        assertEquals(0, account.getTotal().compareTo(new BigDecimal("5")));
    }

    @Test
    @DisplayName("Command-line runner is not started when disabled")
    void testRunnerDisabled() {
        assertTrue(context.getBeansOfType(TransactionEngineRunner.class).isEmpty());
    }
}
