package com.flagship.transaction_ledger.cli;

import com.flagship.transaction_ledger.replay.ReplayReport;
import com.flagship.transaction_ledger.replay.TransactionReplayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage: {@code java -jar transaction-ledger.jar transactions.csv > accounts.csv}
 *
 * Summaries go to stdout; all logging goes to stderr. A missing argument or
 * an unreadable file fails startup, so the process exits non-zero.
 */
@Component
@ConditionalOnProperty(name = "ledger.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerCommandLineRunner implements ApplicationRunner {

    private final TransactionReplayService replayService;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> files = args.getNonOptionArgs();
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No input file provided. Usage: transaction-ledger <transactions.csv>");
        }

        Path inputFile = Path.of(files.get(0));
        log.info("Replaying transactions from {}", inputFile);

        Writer stdout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        try (Reader input = Files.newBufferedReader(inputFile, StandardCharsets.UTF_8)) {
            ReplayReport report = replayService.replay(input, stdout);
            log.debug("Replay report for {}: {}", inputFile, report);
        } finally {
            stdout.flush();
        }
    }
}
