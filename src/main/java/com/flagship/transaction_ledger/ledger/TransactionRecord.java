package com.flagship.transaction_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * History entry for a deposit or withdrawal.
 *
 * Records are immutable: each dispute transition returns a new instance,
 * which the ledger swaps into its history once the whole operation has
 * been validated.
 */
@Value
public class TransactionRecord {
    long txId;
    TransactionType type;
    int clientId;
    BigDecimal amount;
    DisputeState disputeState;

    public static TransactionRecord deposit(long txId, int clientId, BigDecimal amount) {
        return new TransactionRecord(txId, TransactionType.DEPOSIT, clientId, amount, DisputeState.NORMAL);
    }

    public static TransactionRecord withdrawal(long txId, int clientId, BigDecimal amount) {
        return new TransactionRecord(txId, TransactionType.WITHDRAWAL, clientId, amount, DisputeState.NORMAL);
    }

    /**
     * Transitions the record to DISPUTED.
     * Only valid from NORMAL.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public TransactionRecord markDisputed() {
        return transitionTo(DisputeState.DISPUTED);
    }

    /**
     * Transitions the record to RESOLVED.
     * Only valid from DISPUTED.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public TransactionRecord markResolved() {
        return transitionTo(DisputeState.RESOLVED);
    }

    /**
     * Transitions the record to CHARGED_BACK.
     * Only valid from DISPUTED.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public TransactionRecord markChargedBack() {
        return transitionTo(DisputeState.CHARGED_BACK);
    }

    private TransactionRecord transitionTo(DisputeState target) {
        if (disputeState.isTerminal()) {
            throw new IllegalStateException(
                String.format("Transaction %d is already %s", txId, disputeState));
        }
        if (!disputeState.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move transaction %d from %s to %s", txId, disputeState, target));
        }
        return new TransactionRecord(txId, type, clientId, amount, target);
    }
}
