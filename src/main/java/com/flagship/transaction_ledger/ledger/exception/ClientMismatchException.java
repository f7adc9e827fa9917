package com.flagship.transaction_ledger.ledger.exception;

import lombok.Getter;

/**
 * A dispute, resolve or chargeback named a client other than the one that
 * owns the transaction. Only raised when ownership verification is enabled.
 */
@Getter
public class ClientMismatchException extends LedgerException {

    private final long txId;
    private final int ownerClientId;
    private final int requestedClientId;

    public ClientMismatchException(long txId, int ownerClientId, int requestedClientId) {
        super(String.format("Transaction %d belongs to client %d, not client %d",
            txId, ownerClientId, requestedClientId));
        this.txId = txId;
        this.ownerClientId = ownerClientId;
        this.requestedClientId = requestedClientId;
    }

    @Override
    public String getReason() {
        return "client_mismatch";
    }
}
