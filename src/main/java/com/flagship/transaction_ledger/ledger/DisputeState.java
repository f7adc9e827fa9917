package com.flagship.transaction_ledger.ledger;

/**
 * Dispute state of a recorded deposit or withdrawal.
 *
 * Transitions only move forward:
 * - NORMAL → DISPUTED
 * - DISPUTED → RESOLVED / CHARGED_BACK
 * - Terminal states (RESOLVED, CHARGED_BACK) cannot transition
 */
public enum DisputeState {
    /**
     * Transaction has been recorded and never disputed.
     * Initial state for all history entries.
     */
    NORMAL,

    /**
     * Transaction amount is held on the account pending a decision.
     * Can transition to RESOLVED or CHARGED_BACK.
     */
    DISPUTED,

    /**
     * Dispute was withdrawn and the held amount released.
     * Terminal state - no further transitions allowed.
     */
    RESOLVED,

    /**
     * Dispute was settled against the account, which is now locked.
     * Terminal state - no further transitions allowed.
     */
    CHARGED_BACK;

    public boolean isTerminal() {
        return this == RESOLVED || this == CHARGED_BACK;
    }

    /**
     * Checks if a transition from this state to the target state is allowed.
     */
    public boolean canTransitionTo(DisputeState target) {
        return switch (this) {
            case NORMAL -> target == DISPUTED;
            case DISPUTED -> target == RESOLVED || target == CHARGED_BACK;
            case RESOLVED, CHARGED_BACK -> false;
        };
    }
}
