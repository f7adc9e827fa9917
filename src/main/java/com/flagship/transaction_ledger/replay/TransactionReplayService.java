package com.flagship.transaction_ledger.replay;

import com.flagship.transaction_ledger.config.LedgerProperties;
import com.flagship.transaction_ledger.ingest.TransactionCommand;
import com.flagship.transaction_ledger.ingest.TransactionCsvReader;
import com.flagship.transaction_ledger.ledger.AccountSummary;
import com.flagship.transaction_ledger.ledger.Ledger;
import com.flagship.transaction_ledger.ledger.exception.LedgerException;
import com.flagship.transaction_ledger.observability.LedgerMetrics;
import com.flagship.transaction_ledger.output.AccountSummaryCsvWriter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Iterator;

/**
 * Replays a transaction file over a fresh ledger.
 *
 * Records are applied strictly in input order, one at a time. Each replay
 * owns its own {@link Ledger}; nothing is shared between replays.
 *
 * Failure handling:
 * - Rows that cannot be parsed are skipped by the reader
 * - Ledger rejections (insufficient available or held funds, unknown or
 *   wrongly-stated transactions) are logged at DEBUG and counted. They
 *   produce no output row
 * - Contract violations and I/O errors are not caught and end the replay
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionReplayService {

    static final String TX_ID_MDC_KEY = "txId";
    static final String CLIENT_ID_MDC_KEY = "clientId";

    private final TransactionCsvReader reader;
    private final AccountSummaryCsvWriter writer;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    /**
     * Replays every record of the input and writes account summaries.
     *
     * With output mode PER_TRANSACTION, one summary is written per applied
     * record. With FINAL_SNAPSHOT, every account is written once at the end,
     * ordered by client id.
     *
     * @param input transaction CSV
     * @param output destination for summary CSV, flushed but not closed
     * @return counts of applied, rejected and skipped records
     * @throws IOException if the input cannot be read or the output written
     */
    public ReplayReport replay(Reader input, Writer output) throws IOException {
        Ledger ledger = new Ledger(properties.getDuplicatePolicy(), properties.isVerifyClientOwnership());
        boolean perTransaction = properties.getOutput().getMode() == LedgerProperties.OutputMode.PER_TRANSACTION;
        ReplayCounter counter = new ReplayCounter();

        Timer.Sample sample = metrics.startReplay();
        long skipped;
        try (AccountSummaryCsvWriter.Session session = writer.open(output)) {
            skipped = reader.read(input, command -> {
                AccountSummary summary = apply(ledger, command, counter);
                if (summary != null && perTransaction) {
                    session.write(summary);
                }
            });

            if (!perTransaction) {
                Iterator<AccountSummary> accounts = ledger.listAccounts().iterator();
                while (accounts.hasNext()) {
                    session.write(accounts.next());
                }
            }
        } finally {
            metrics.stopReplay(sample);
        }

        ReplayReport report = new ReplayReport(counter.applied, counter.rejected, skipped, ledger.accountCount());
        log.info("Replay finished: applied={}, rejected={}, skipped={}, accounts={}",
            report.getApplied(), report.getRejected(), report.getSkipped(), report.getAccounts());
        return report;
    }

    /**
     * Applies one command to the ledger.
     *
     * @return the affected account's summary, or null if the ledger rejected the command
     */
    private AccountSummary apply(Ledger ledger, TransactionCommand command, ReplayCounter counter) {
        try (MDC.MDCCloseable tx = MDC.putCloseable(TX_ID_MDC_KEY, String.valueOf(command.getTxId()));
             MDC.MDCCloseable client = MDC.putCloseable(CLIENT_ID_MDC_KEY, String.valueOf(command.getClientId()))) {
            try {
                AccountSummary summary = dispatch(ledger, command);
                counter.applied++;
                metrics.recordApplied(command.getType());
                return summary;
            } catch (LedgerException e) {
                // Log before the MDC entries are closed
                counter.rejected++;
                metrics.recordRejected(command.getType(), e.getReason());
                log.debug("Rejected {} for client {} tx {}: {}",
                    command.getType().getCode(), command.getClientId(), command.getTxId(), e.getMessage());
                return null;
            }
        }
    }

    private static AccountSummary dispatch(Ledger ledger, TransactionCommand command) throws LedgerException {
        return switch (command.getType()) {
            case DEPOSIT -> ledger.deposit(command.getTxId(), command.getClientId(), command.getAmount());
            case WITHDRAWAL -> ledger.withdrawal(command.getTxId(), command.getClientId(), command.getAmount());
            case DISPUTE -> ledger.dispute(command.getClientId(), command.getTxId());
            case RESOLVE -> ledger.resolve(command.getClientId(), command.getTxId());
            case CHARGEBACK -> ledger.chargeback(command.getClientId(), command.getTxId());
        };
    }

    private static class ReplayCounter {
        long applied;
        long rejected;
    }
}
