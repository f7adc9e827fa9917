package com.flagship.transaction_ledger.observability;

import com.flagship.transaction_ledger.ledger.TransactionType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized metrics for ledger replays.
 *
 * Metrics exposed:
 * - ledger.transactions: Counter of replayed records, tagged by type and outcome
 * - ledger.rows.skipped: Counter of input rows that could not be parsed
 * - ledger.replay.duration: Timer for whole replays
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer replayTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.replayTimer = Timer.builder("ledger.replay.duration")
                .description("Time taken to replay one transaction file")
                .register(registry);
    }

    public void recordApplied(TransactionType type) {
        registry.counter("ledger.transactions",
                "type", tagOf(type),
                "outcome", "applied",
                "reason", "none"
        ).increment();
    }

    public void recordRejected(TransactionType type, String reason) {
        registry.counter("ledger.transactions",
                "type", tagOf(type),
                "outcome", "rejected",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordSkipped(String reason) {
        registry.counter("ledger.rows.skipped", "reason", sanitizeTag(reason)).increment();
    }

    public Timer.Sample startReplay() {
        return Timer.start(registry);
    }

    public void stopReplay(Timer.Sample sample) {
        sample.stop(replayTimer);
    }

    private static String tagOf(TransactionType type) {
        return type.getCode();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
