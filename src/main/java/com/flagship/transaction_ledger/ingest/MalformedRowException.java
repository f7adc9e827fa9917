package com.flagship.transaction_ledger.ingest;

import lombok.Getter;

/**
 * An input row that cannot be turned into a {@link TransactionCommand}.
 */
@Getter
public class MalformedRowException extends Exception {

    private final String reason;

    public MalformedRowException(String reason, String message) {
        super(message);
        this.reason = reason;
    }
}
