package com.flagship.transaction_ledger.ledger;

import java.util.Locale;
import java.util.Optional;

/**
 * The five kinds of records a ledger replays.
 *
 * Only DEPOSIT and WITHDRAWAL are kept in history. The other three act on an
 * existing history entry.
 */
public enum TransactionType {
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    DISPUTE("dispute"),
    RESOLVE("resolve"),
    CHARGEBACK("chargeback");

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether records of this type carry an amount and are stored in history.
     */
    public boolean carriesAmount() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    /**
     * Resolves a wire tag such as {@code "deposit"} (case-insensitive).
     * {@code "withdraw"} is accepted as an alias for WITHDRAWAL.
     */
    public static Optional<TransactionType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        if ("withdraw".equals(normalized)) {
            return Optional.of(WITHDRAWAL);
        }
        for (TransactionType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
