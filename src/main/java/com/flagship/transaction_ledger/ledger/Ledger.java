package com.flagship.transaction_ledger.ledger;

import com.flagship.transaction_ledger.ledger.exception.ClientMismatchException;
import com.flagship.transaction_ledger.ledger.exception.DuplicateTransactionException;
import com.flagship.transaction_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.transaction_ledger.ledger.exception.InsufficientHeldFundsException;
import com.flagship.transaction_ledger.ledger.exception.LedgerException;
import com.flagship.transaction_ledger.ledger.exception.TransactionInWrongStateException;
import com.flagship.transaction_ledger.ledger.exception.TransactionNotFoundException;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * In-memory ledger of client accounts and their transaction history.
 *
 * This class enforces the core invariants:
 * 1. held is never negative and equals the sum of the DISPUTED amounts held against it
 * 2. Dispute states only move forward (NORMAL → DISPUTED → RESOLVED / CHARGED_BACK)
 * 3. A locked account never unlocks
 * 4. Every operation is all-or-nothing
 *
 * Operations return the affected account's summary on success. Expected
 * failures are thrown as {@link LedgerException} and leave both maps exactly
 * as they were. The ledger never logs; callers decide what to do with
 * failures.
 *
 * Not thread-safe. Records must be applied in input order, since a dispute
 * can only find a transaction that was already recorded.
 */
public class Ledger {

    private static final long MAX_TX_ID = 0xFFFF_FFFFL;
    private static final int MAX_CLIENT_ID = 0xFFFF;

    private final Map<Integer, Account> accounts = new TreeMap<>();
    private final Map<Long, TransactionRecord> history = new HashMap<>();

    private final DuplicateTransactionPolicy duplicatePolicy;
    private final boolean verifyClientOwnership;

    public Ledger() {
        this(DuplicateTransactionPolicy.OVERWRITE, false);
    }

    public Ledger(DuplicateTransactionPolicy duplicatePolicy, boolean verifyClientOwnership) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy);
        this.verifyClientOwnership = verifyClientOwnership;
    }

    /**
     * Credits a client's available funds and records the deposit.
     *
     * @throws DuplicateTransactionException if txId is reused under the REJECT policy
     * @throws IllegalArgumentException if amount is negative or an id is out of range
     */
    public AccountSummary deposit(long txId, int clientId, BigDecimal amount)
            throws DuplicateTransactionException {
        requireTxId(txId);
        requireClientId(clientId);
        requireAmount(amount);
        checkDuplicate(txId);

        Account updated = accountFor(clientId).credit(amount);
        commit(updated, TransactionRecord.deposit(txId, clientId, amount));
        return updated.summary();
    }

    /**
     * Debits a client's available funds and records the withdrawal.
     *
     * @throws InsufficientFundsException if available is below amount
     * @throws DuplicateTransactionException if txId is reused under the REJECT policy
     * @throws IllegalArgumentException if amount is negative or an id is out of range
     */
    public AccountSummary withdrawal(long txId, int clientId, BigDecimal amount)
            throws InsufficientFundsException, DuplicateTransactionException {
        requireTxId(txId);
        requireClientId(clientId);
        requireAmount(amount);
        checkDuplicate(txId);

        Account account = accountFor(clientId);
        account.requireAvailable(amount);
        Account updated = account.debit(amount);
        commit(updated, TransactionRecord.withdrawal(txId, clientId, amount));
        return updated.summary();
    }

    /**
     * Holds the amount of a NORMAL transaction on the client's account.
     *
     * The same arithmetic applies to disputed withdrawals, even though the
     * withdrawn funds have already left the account.
     *
     * @throws TransactionNotFoundException if txId was never recorded
     * @throws TransactionInWrongStateException if the transaction is not NORMAL
     * @throws InsufficientFundsException if available is below the transaction amount
     * @throws ClientMismatchException if ownership verification is on and the client differs
     */
    public AccountSummary dispute(int clientId, long txId) throws LedgerException {
        TransactionRecord tx = findReferenced(clientId, txId, TransactionType.DISPUTE, DisputeState.NORMAL);

        Account account = accountFor(clientId);
        account.requireAvailable(tx.getAmount());
        Account updated = account.hold(tx.getAmount());
        commit(updated, tx.markDisputed());
        return updated.summary();
    }

    /**
     * Releases the held amount of a DISPUTED transaction back to available.
     *
     * @throws TransactionNotFoundException if txId was never recorded
     * @throws TransactionInWrongStateException if the transaction is not DISPUTED
     * @throws ClientMismatchException if ownership verification is on and the client differs
     * @throws InsufficientHeldFundsException if the client holds less than the transaction amount
     */
    public AccountSummary resolve(int clientId, long txId) throws LedgerException {
        TransactionRecord tx = findReferenced(clientId, txId, TransactionType.RESOLVE, DisputeState.DISPUTED);

        Account account = accountFor(clientId);
        account.requireHeld(tx.getAmount());
        Account updated = account.release(tx.getAmount());
        commit(updated, tx.markResolved());
        return updated.summary();
    }

    /**
     * Removes the held amount of a DISPUTED transaction and locks the account.
     *
     * @throws TransactionNotFoundException if txId was never recorded
     * @throws TransactionInWrongStateException if the transaction is not DISPUTED
     * @throws ClientMismatchException if ownership verification is on and the client differs
     * @throws InsufficientHeldFundsException if the client holds less than the transaction amount
     */
    public AccountSummary chargeback(int clientId, long txId) throws LedgerException {
        TransactionRecord tx = findReferenced(clientId, txId, TransactionType.CHARGEBACK, DisputeState.DISPUTED);

        Account account = accountFor(clientId);
        account.requireHeld(tx.getAmount());
        Account updated = account.chargeBack(tx.getAmount());
        commit(updated, tx.markChargedBack());
        return updated.summary();
    }

    /**
     * Summaries of all known accounts, ordered by client id.
     * Each call returns a new stream over the current state.
     */
    public Stream<AccountSummary> listAccounts() {
        return accounts.values().stream().map(Account::summary);
    }

    public Optional<AccountSummary> findAccount(int clientId) {
        return Optional.ofNullable(accounts.get(clientId)).map(Account::summary);
    }

    public Optional<TransactionRecord> findTransaction(long txId) {
        return Optional.ofNullable(history.get(txId));
    }

    public int accountCount() {
        return accounts.size();
    }

    private TransactionRecord findReferenced(int clientId, long txId, TransactionType action,
                                             DisputeState requiredState) throws LedgerException {
        requireTxId(txId);
        requireClientId(clientId);

        TransactionRecord tx = history.get(txId);
        if (tx == null) {
            throw new TransactionNotFoundException(txId);
        }
        if (verifyClientOwnership && tx.getClientId() != clientId) {
            throw new ClientMismatchException(txId, tx.getClientId(), clientId);
        }
        if (tx.getDisputeState() != requiredState) {
            throw new TransactionInWrongStateException(txId, action, tx.getDisputeState());
        }
        return tx;
    }

    private void checkDuplicate(long txId) throws DuplicateTransactionException {
        if (duplicatePolicy == DuplicateTransactionPolicy.REJECT && history.containsKey(txId)) {
            throw new DuplicateTransactionException(txId);
        }
    }

    /**
     * Existing account, or a new empty one that is only stored on commit.
     */
    private Account accountFor(int clientId) {
        Account account = accounts.get(clientId);
        return account != null ? account : Account.open(clientId);
    }

    private void commit(Account account, TransactionRecord record) {
        accounts.put(account.getClientId(), account);
        history.put(record.getTxId(), record);
    }

    private static void requireAmount(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative, got " + amount);
        }
    }

    private static void requireTxId(long txId) {
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + txId);
        }
    }

    private static void requireClientId(int clientId) {
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + clientId);
        }
    }
}
