package com.flagship.transaction_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * The account does not have enough available funds for the operation.
 */
@Getter
public class InsufficientFundsException extends LedgerException {

    private final int clientId;
    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientFundsException(int clientId, BigDecimal available, BigDecimal required) {
        super(String.format("Insufficient funds on client %d: available=%s, required=%s",
            clientId, available.toPlainString(), required.toPlainString()));
        this.clientId = clientId;
        this.available = available;
        this.required = required;
    }

    @Override
    public String getReason() {
        return "insufficient_funds";
    }
}
