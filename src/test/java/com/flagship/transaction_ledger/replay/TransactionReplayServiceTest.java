package com.flagship.transaction_ledger.replay;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.transaction_ledger.config.JacksonConfig;
import com.flagship.transaction_ledger.config.LedgerProperties;
import com.flagship.transaction_ledger.ingest.TransactionCsvReader;
import com.flagship.transaction_ledger.ledger.DuplicateTransactionPolicy;
import com.flagship.transaction_ledger.observability.LedgerMetrics;
import com.flagship.transaction_ledger.output.AccountSummaryCsvWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end replay tests: CSV in, summaries out.
 */
class TransactionReplayServiceTest {

    private static final String HEADER = "client,available,held,total,locked";

    private SimpleMeterRegistry registry;
    private LedgerProperties properties;
    private TransactionReplayService service;
    private Logger serviceLogger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> logEvents;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new LedgerProperties();
        LedgerMetrics metrics = new LedgerMetrics(registry);
        CsvMapper csvMapper = new JacksonConfig().csvMapper();
        service = new TransactionReplayService(
            new TransactionCsvReader(csvMapper, properties, metrics),
            new AccountSummaryCsvWriter(csvMapper),
            properties,
            metrics
        );

        serviceLogger = (Logger) LoggerFactory.getLogger(TransactionReplayService.class);
        previousLevel = serviceLogger.getLevel();
        serviceLogger.setLevel(Level.DEBUG);
        logEvents = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                // Snapshot the MDC while the event is being logged
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        logEvents.start();
        serviceLogger.addAppender(logEvents);
    }

    @AfterEach
    void tearDown() {
        serviceLogger.detachAppender(logEvents);
        serviceLogger.setLevel(previousLevel);
    }

    private List<String> replay(String csv) throws Exception {
        StringWriter out = new StringWriter();
        service.replay(new StringReader(csv), out);
        return List.of(out.toString().split("\\R"));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("One summary row per applied record, rejected records produce nothing")
    void testPerTransactionOutput() throws Exception {
        printTestHeader("Per-transaction output");
        String csv = "type,client,tx,amount\n"
            + "deposit,1,1,1.0\n"
            + "deposit,2,2,2.0\n"
            + "deposit,1,3,2.0\n"
            + "withdrawal,1,4,1.5\n"
            + "withdrawal,2,5,3.0\n";

        List<String> lines = replay(csv);
        lines.forEach(System.out::println);

        assertEquals(List.of(
            HEADER,
            "1,1.0,0,1.0,false",
            "2,2.0,0,2.0,false",
            "1,3.0,0,3.0,false",
            "1,1.5,0,1.5,false"
        ), lines);
    }

    @Test
    @DisplayName("Dispute then chargeback locks the account and a second chargeback is rejected")
    void testChargebackScenario() throws Exception {
        printTestHeader("Dispute and chargeback");
        String csv = "type,client,tx,amount\n"
            + "deposit,100,1,5.12345\n"
            + "withdrawal,100,2,6\n"
            + "deposit,100,3,3\n"
            + "dispute,100,3,\n"
            + "chargeback,100,3,\n"
            + "chargeback,100,3,\n"
            + "dispute,100,999,\n";

        StringWriter out = new StringWriter();
        ReplayReport report = service.replay(new StringReader(csv), out);
        List<String> lines = List.of(out.toString().split("\\R"));
        lines.forEach(System.out::println);

        assertEquals(List.of(
            HEADER,
            "100,5.12345,0,5.12345,false",
            "100,8.12345,0,8.12345,false",
            "100,5.12345,3,8.12345,false",
            "100,5.12345,0,5.12345,true"
        ), lines);
        assertEquals(new ReplayReport(4, 3, 0, 1), report);
        assertEquals(1.0, registry.get("ledger.transactions")
            .tags("type", "chargeback", "outcome", "rejected", "reason", "tx_in_wrong_state").counter().count());
        assertEquals(1.0, registry.get("ledger.transactions")
            .tags("type", "dispute", "outcome", "rejected", "reason", "tx_not_found").counter().count());
        assertEquals(1, registry.get("ledger.replay.duration").timer().count());
    }

    @Test
    @DisplayName("Final snapshot writes each account once, ordered by client id")
    void testFinalSnapshotOutput() throws Exception {
        properties.getOutput().setMode(LedgerProperties.OutputMode.FINAL_SNAPSHOT);
        String csv = "type,client,tx,amount\n"
            + "deposit,3,1,10\n"
            + "deposit,1,2,4.5\n"
            + "deposit,2,3,1\n"
            + "withdrawal,3,4,2.5\n"
            + "dispute,1,2,\n"
            + "resolve,1,2,\n";

        List<String> lines = replay(csv);

        assertEquals(List.of(
            HEADER,
            "1,4.5,0.0,4.5,false",
            "2,1,0,1,false",
            "3,7.5,0,7.5,false"
        ), lines);
    }

    @Test
    @DisplayName("Malformed rows are skipped without stopping the replay")
    void testSkippedRows() throws Exception {
        String csv = "type,client,tx,amount\n"
            + "deposit,1,1,abc\n"
            + "refund,1,2,1\n"
            + "deposit,1,3,2\n";

        StringWriter out = new StringWriter();
        ReplayReport report = service.replay(new StringReader(csv), out);

        assertEquals(new ReplayReport(1, 0, 2, 1), report);
        assertTrue(out.toString().contains("1,2,0,2,false"));
    }

    @Test
    @DisplayName("REJECT duplicate policy is taken from configuration")
    void testDuplicatePolicyFromProperties() throws Exception {
        properties.setDuplicatePolicy(DuplicateTransactionPolicy.REJECT);
        String csv = "type,client,tx,amount\n"
            + "deposit,1,1,1\n"
            + "deposit,1,1,5\n";

        StringWriter out = new StringWriter();
        ReplayReport report = service.replay(new StringReader(csv), out);

        assertEquals(1, report.getApplied());
        assertEquals(1, report.getRejected());
        assertEquals(1.0, registry.get("ledger.transactions")
            .tags("type", "deposit", "outcome", "rejected", "reason", "duplicate_tx").counter().count());
    }

    @Test
    @DisplayName("Client ownership verification is taken from configuration")
    void testOwnershipFromProperties() throws Exception {
        properties.setVerifyClientOwnership(true);
        String csv = "type,client,tx,amount\n"
            + "deposit,1,1,1\n"
            + "deposit,2,2,5\n"
            + "dispute,2,1,\n";

        ReplayReport report = service.replay(new StringReader(csv), new StringWriter());

        assertEquals(2, report.getApplied());
        assertEquals(1, report.getRejected());
    }

    @Test
    @DisplayName("Each replay starts from an empty ledger")
    void testReplaysAreIndependent() throws Exception {
        String csv = "type,client,tx,amount\ndeposit,1,1,1\n";

        replay(csv);
        List<String> second = replay(csv);

        assertEquals(List.of(HEADER, "1,1,0,1,false"), second);
    }

    @Test
    @DisplayName("Resolve by a client holding nothing is rejected and the replay continues")
    void testForeignClientResolveDoesNotAbortReplay() throws Exception {
        printTestHeader("Foreign client resolve");
        String csv = "type,client,tx,amount\n"
            + "deposit,1,1,5\n"
            + "dispute,1,1,\n"
            + "resolve,3,1,\n"
            + "chargeback,3,1,\n"
            + "deposit,1,2,1\n";

        StringWriter out = new StringWriter();
        ReplayReport report = service.replay(new StringReader(csv), out);
        List<String> lines = List.of(out.toString().split("\\R"));
        lines.forEach(System.out::println);

        assertEquals(List.of(
            HEADER,
            "1,5,0,5,false",
            "1,0,5,5,false",
            "1,1,5,6,false"
        ), lines);
        assertEquals(new ReplayReport(3, 2, 0, 1), report);
        assertEquals(1.0, registry.get("ledger.transactions")
            .tags("type", "resolve", "outcome", "rejected", "reason", "insufficient_held").counter().count());
        assertEquals(1.0, registry.get("ledger.transactions")
            .tags("type", "chargeback", "outcome", "rejected", "reason", "insufficient_held").counter().count());
    }

    @Test
    @DisplayName("Rejection log events carry the record's txId and clientId in the MDC")
    void testRejectionLoggedWithMdc() throws Exception {
        service.replay(new StringReader("type,client,tx,amount\ndispute,7,42,\n"), new StringWriter());

        ILoggingEvent rejection = logEvents.list.stream()
            .filter(event -> event.getFormattedMessage().startsWith("Rejected dispute"))
            .findFirst()
            .orElseThrow();
        Map<String, String> mdc = rejection.getMDCPropertyMap();

        assertEquals(Level.DEBUG, rejection.getLevel());
        assertEquals("42", mdc.get("txId"));
        assertEquals("7", mdc.get("clientId"));
        assertNull(MDC.get("txId"));
        assertNull(MDC.get("clientId"));
    }
}
