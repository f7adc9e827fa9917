package com.flagship.transaction_ledger.ledger.exception;

/**
 * Base type for expected ledger failures.
 *
 * These are outcomes of replaying adversarial or out-of-order input, not
 * bugs. An operation that throws one has left the ledger untouched.
 * Contract violations are reported with IllegalArgumentException or
 * IllegalStateException instead.
 */
public abstract class LedgerException extends Exception {

    protected LedgerException(String message) {
        super(message);
    }

    /**
     * Short, stable name of the failure, used as a metric tag.
     */
    public abstract String getReason();
}
