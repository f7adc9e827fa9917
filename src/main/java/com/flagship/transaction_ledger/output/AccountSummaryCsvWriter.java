package com.flagship.transaction_ledger.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_ledger.ledger.AccountSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes account summaries as CSV with a single header row.
 *
 * Usage:
 * <pre>
 * try (AccountSummaryCsvWriter.Session session = writer.open(out)) {
 *     session.write(summary);
 * }
 * </pre>
 * Closing a session flushes it but leaves the target writer open.
 */
@Component
@RequiredArgsConstructor
public class AccountSummaryCsvWriter {

    private final CsvMapper csvMapper;

    public Session open(Writer target) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(AccountSummaryRow.class).withHeader();
        SequenceWriter sequenceWriter = csvMapper.writer(schema).writeValues(target);
        return new Session(sequenceWriter);
    }

    public static class Session implements Closeable {

        private final SequenceWriter sequenceWriter;

        private Session(SequenceWriter sequenceWriter) {
            this.sequenceWriter = sequenceWriter;
        }

        public void write(AccountSummary summary) throws IOException {
            sequenceWriter.write(AccountSummaryRow.from(summary));
        }

        @Override
        public void close() throws IOException {
            sequenceWriter.flush();
            sequenceWriter.close();
        }
    }
}
