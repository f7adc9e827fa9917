package com.flagship.transaction_ledger.ledger.exception;

import lombok.Getter;

/**
 * A dispute, resolve or chargeback referenced a transaction the ledger has
 * never recorded.
 */
@Getter
public class TransactionNotFoundException extends LedgerException {

    private final long txId;

    public TransactionNotFoundException(long txId) {
        super("Transaction not found: " + txId);
        this.txId = txId;
    }

    @Override
    public String getReason() {
        return "tx_not_found";
    }
}
