package com.flagship.transaction_ledger.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_ledger.config.LedgerProperties;
import com.flagship.transaction_ledger.ledger.TransactionType;
import com.flagship.transaction_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;

/**
 * Reads transaction records from CSV, in file order.
 *
 * Rows that cannot be parsed are skipped: they are logged, counted, and never
 * reach the ledger. This keeps contract violations such as negative amounts
 * out of the core. A broken stream is not a bad row and fails the whole read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionCsvReader {

    private static final long MAX_TX_ID = 0xFFFF_FFFFL;
    private static final int MAX_CLIENT_ID = 0xFFFF;

    private final CsvMapper csvMapper;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    /**
     * Streams every valid row of the input to the sink.
     *
     * @param input CSV with columns type, client, tx, amount
     * @param sink receives commands one at a time, in input order
     * @return number of rows skipped as malformed
     * @throws IOException if the input cannot be read or the sink fails
     */
    public long read(Reader input, TransactionSink sink) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(TransactionCsvRow.class)
            .withSkipFirstDataRow(properties.getInput().isHasHeader());

        long skipped = 0;
        // Data records after the header, not file lines: blank lines are skipped silently
        long recordNumber = 0;

        try (MappingIterator<TransactionCsvRow> rows = csvMapper
                .readerFor(TransactionCsvRow.class)
                .with(schema)
                .readValues(input)) {
            while (rows.hasNextValue()) {
                TransactionCsvRow row = rows.nextValue();
                recordNumber++;
                try {
                    sink.accept(parse(row));
                } catch (MalformedRowException e) {
                    skipped++;
                    metrics.recordSkipped(e.getReason());
                    log.warn("Skipping record {}: {}", recordNumber, e.getMessage());
                }
            }
        }
        return skipped;
    }

    /**
     * Validates a raw row and converts it to a command.
     *
     * @throws MalformedRowException if any field is missing or out of range
     */
    TransactionCommand parse(TransactionCsvRow row) throws MalformedRowException {
        TransactionType type = TransactionType.fromCode(row.getType())
            .orElseThrow(() -> new MalformedRowException("unknown_type",
                "unknown transaction type '" + row.getType() + "'"));

        int clientId = (int) parseUnsigned(row.getClient(), MAX_CLIENT_ID, "client");
        long txId = parseUnsigned(row.getTx(), MAX_TX_ID, "tx");

        if (!type.carriesAmount()) {
            return new TransactionCommand(type, clientId, txId, null);
        }
        return new TransactionCommand(type, clientId, txId, parseAmount(row.getAmount()));
    }

    private static long parseUnsigned(String value, long max, String column) throws MalformedRowException {
        if (value == null || value.isBlank()) {
            throw new MalformedRowException("missing_" + column, "missing " + column + " column");
        }
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRowException("invalid_" + column,
                "invalid " + column + " '" + value + "'");
        }
        if (parsed < 0 || parsed > max) {
            throw new MalformedRowException("invalid_" + column,
                column + " out of range: " + parsed);
        }
        return parsed;
    }

    private static BigDecimal parseAmount(String value) throws MalformedRowException {
        if (value == null || value.isBlank()) {
            throw new MalformedRowException("missing_amount", "missing amount");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRowException("invalid_amount", "invalid amount '" + value + "'");
        }
        if (amount.signum() < 0) {
            throw new MalformedRowException("negative_amount", "negative amount " + value.trim());
        }
        return amount;
    }
}
