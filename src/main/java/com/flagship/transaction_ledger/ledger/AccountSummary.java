package com.flagship.transaction_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only view of an account, computed on demand.
 */
@Value
public class AccountSummary {
    int clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;
}
