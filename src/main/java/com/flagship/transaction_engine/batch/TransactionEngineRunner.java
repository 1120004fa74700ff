package com.flagship.transaction_engine.batch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: {@code transaction-engine <transactions.csv>}.
 *
 * Reads the file named by the single positional argument and prints the account table to stdout.
 * A missing argument or an unreadable file fails the application.
 */
@Component
@ConditionalOnProperty(name = "engine.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TransactionEngineRunner implements ApplicationRunner {

    private final TransactionBatchProcessor batchProcessor;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        run(args, System.out);
    }

    void run(ApplicationArguments args, OutputStream stdout) throws IOException {
        List<String> files = args.getNonOptionArgs();
        if (files.size() != 1) {
            throw new IllegalArgumentException(
                "Expected exactly one argument, the path of the transactions CSV file, got " + files.size());
        }

        Path path = Path.of(files.get(0));
        log.debug("Reading transactions from {}", path);

        Writer output = new BufferedWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
        try (Reader input = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            batchProcessor.process(input, output);
        } catch (IOException e) {
            log.error("Failed to process transactions from {}: {}", path, e.getMessage());
            throw e;
        }
        output.flush();
    }
}
