package com.flagship.transaction_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * The account does not hold enough disputed funds to resolve or charge back
 * the transaction, typically because the dispute was raised on another client.
 */
@Getter
public class InsufficientHeldFundsException extends LedgerException {

    private final int clientId;
    private final BigDecimal held;
    private final BigDecimal required;

    public InsufficientHeldFundsException(int clientId, BigDecimal held, BigDecimal required) {
        super(String.format("Insufficient held funds on client %d: held=%s, required=%s",
            clientId, held.toPlainString(), required.toPlainString()));
        this.clientId = clientId;
        this.held = held;
        this.required = required;
    }

    @Override
    public String getReason() {
        return "insufficient_held";
    }
}
