package com.flagship.transaction_ledger.ledger.exception;

import com.flagship.transaction_ledger.ledger.DisputeState;
import com.flagship.transaction_ledger.ledger.TransactionType;
import lombok.Getter;

/**
 * The referenced transaction is not in the dispute state the action requires.
 */
@Getter
public class TransactionInWrongStateException extends LedgerException {

    private final long txId;
    private final TransactionType action;
    private final DisputeState state;

    public TransactionInWrongStateException(long txId, TransactionType action, DisputeState state) {
        super(String.format("Cannot %s transaction %d in %s state",
            action.getCode(), txId, state));
        this.txId = txId;
        this.action = action;
        this.state = state;
    }

    @Override
    public String getReason() {
        return "tx_in_wrong_state";
    }
}
