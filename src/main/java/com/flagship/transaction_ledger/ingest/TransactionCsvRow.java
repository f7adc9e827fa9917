package com.flagship.transaction_ledger.ingest;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw CSV row as read from the input, before any validation.
 * Columns are positional: type, client, tx, amount.
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"type", "client", "tx", "amount"})
public class TransactionCsvRow {
    private String type;
    private String client;
    private String tx;
    private String amount;
}
