package com.flagship.transaction_ledger.ledger;

import com.flagship.transaction_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.transaction_ledger.ledger.exception.InsufficientHeldFundsException;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Balance record of a single client.
 *
 * Immutable: every balance change returns a new Account, so the ledger can
 * validate a whole operation before anything becomes visible.
 *
 * Key invariant: total is always available + held and is never stored.
 */
@Value
public class Account {
    int clientId;
    BigDecimal available;
    BigDecimal held;
    boolean locked;

    /**
     * Creates an empty, unlocked account.
     */
    public static Account open(int clientId) {
        return new Account(clientId, BigDecimal.ZERO, BigDecimal.ZERO, false);
    }

    public BigDecimal getTotal() {
        return available.add(held);
    }

    public AccountSummary summary() {
        return new AccountSummary(clientId, available, held, getTotal(), locked);
    }

    /**
     * Checks that at least {@code amount} is available. Never mutates.
     *
     * @throws InsufficientFundsException if available is below amount
     */
    public void requireAvailable(BigDecimal amount) throws InsufficientFundsException {
        if (available.compareTo(amount) < 0) {
            throw new InsufficientFundsException(clientId, available, amount);
        }
    }

    /**
     * Checks that at least {@code amount} is held. Never mutates.
     *
     * @throws InsufficientHeldFundsException if held is below amount
     */
    public void requireHeld(BigDecimal amount) throws InsufficientHeldFundsException {
        if (held.compareTo(amount) < 0) {
            throw new InsufficientHeldFundsException(clientId, held, amount);
        }
    }

    public Account credit(BigDecimal amount) {
        return new Account(clientId, available.add(amount), held, locked);
    }

    /**
     * Callers check {@link #requireAvailable(BigDecimal)} first.
     */
    public Account debit(BigDecimal amount) {
        return new Account(clientId, available.subtract(amount), held, locked);
    }

    /**
     * Moves amount from available to held.
     */
    public Account hold(BigDecimal amount) {
        return new Account(clientId, available.subtract(amount), held.add(amount), locked);
    }

    /**
     * Moves amount from held back to available.
     * Callers check {@link #requireHeld(BigDecimal)} first.
     *
     * @throws IllegalStateException if held would go negative
     */
    public Account release(BigDecimal amount) {
        return new Account(clientId, available.add(amount), reduceHeld(amount), locked);
    }

    /**
     * Removes amount from held and locks the account for good.
     * Callers check {@link #requireHeld(BigDecimal)} first.
     *
     * @throws IllegalStateException if held would go negative
     */
    public Account chargeBack(BigDecimal amount) {
        return new Account(clientId, available, reduceHeld(amount), true);
    }

    private BigDecimal reduceHeld(BigDecimal amount) {
        if (held.compareTo(amount) < 0) {
            throw new IllegalStateException(
                String.format("Held funds on client %d would underflow: held=%s, amount=%s",
                    clientId, held.toPlainString(), amount.toPlainString()));
        }
        return held.subtract(amount);
    }
}
