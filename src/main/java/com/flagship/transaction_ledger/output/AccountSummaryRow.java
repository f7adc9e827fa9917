package com.flagship.transaction_ledger.output;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.transaction_ledger.ledger.AccountSummary;
import lombok.Value;

import java.math.BigDecimal;

/**
 * CSV shape of an account summary.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountSummaryRow {
    int client;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;

    public static AccountSummaryRow from(AccountSummary summary) {
        return new AccountSummaryRow(
            summary.getClientId(),
            summary.getAvailable(),
            summary.getHeld(),
            summary.getTotal(),
            summary.isLocked()
        );
    }
}
