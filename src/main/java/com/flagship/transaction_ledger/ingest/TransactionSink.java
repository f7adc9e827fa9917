package com.flagship.transaction_ledger.ingest;

import java.io.IOException;

/**
 * Receives parsed commands in input order.
 */
@FunctionalInterface
public interface TransactionSink {

    void accept(TransactionCommand command) throws IOException;
}
