package com.flagship.transaction_ledger.ledger.exception;

import lombok.Getter;

/**
 * A deposit or withdrawal reused a transaction id already in history.
 * Only raised when the ledger runs with the REJECT duplicate policy.
 */
@Getter
public class DuplicateTransactionException extends LedgerException {

    private final long txId;

    public DuplicateTransactionException(long txId) {
        super("Duplicate transaction id: " + txId);
        this.txId = txId;
    }

    @Override
    public String getReason() {
        return "duplicate_tx";
    }
}
