package com.flagship.transaction_ledger.ledger;

/**
 * What the ledger does when a deposit or withdrawal reuses a transaction id.
 */
public enum DuplicateTransactionPolicy {
    /**
     * The new record replaces the old history entry. Balances of the earlier
     * transaction are not rolled back.
     */
    OVERWRITE,

    /**
     * The new record is rejected and the ledger is left unchanged.
     */
    REJECT
}
