package com.flagship.transaction_ledger.ingest;

import com.flagship.transaction_ledger.ledger.TransactionType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One validated input record, ready to be applied to a ledger.
 *
 * amount is null for dispute, resolve and chargeback records.
 */
@Value
public class TransactionCommand {
    TransactionType type;
    int clientId;
    long txId;
    BigDecimal amount;

    public static TransactionCommand deposit(int clientId, long txId, BigDecimal amount) {
        return new TransactionCommand(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static TransactionCommand withdrawal(int clientId, long txId, BigDecimal amount) {
        return new TransactionCommand(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static TransactionCommand dispute(int clientId, long txId) {
        return new TransactionCommand(TransactionType.DISPUTE, clientId, txId, null);
    }

    public static TransactionCommand resolve(int clientId, long txId) {
        return new TransactionCommand(TransactionType.RESOLVE, clientId, txId, null);
    }

    public static TransactionCommand chargeback(int clientId, long txId) {
        return new TransactionCommand(TransactionType.CHARGEBACK, clientId, txId, null);
    }
}
