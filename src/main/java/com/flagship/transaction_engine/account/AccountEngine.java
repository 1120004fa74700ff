package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.ledger.DepositRecord;
import com.flagship.transaction_engine.ledger.Ledger;
import com.flagship.transaction_engine.observability.TransactionMetrics;
import com.flagship.transaction_engine.transaction.Chargeback;
import com.flagship.transaction_engine.transaction.ClientId;
import com.flagship.transaction_engine.transaction.Deposit;
import com.flagship.transaction_engine.transaction.Dispute;
import com.flagship.transaction_engine.transaction.Resolve;
import com.flagship.transaction_engine.transaction.Transaction;
import com.flagship.transaction_engine.transaction.Withdrawal;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Applies transactions, one at a time and in the order given, to per-client accounts.
 *
 * State machine per account (every transition first requires the account to be unlocked):
 * - DEPOSIT: available += amount, deposit recorded in the ledger
 * - WITHDRAWAL: available -= amount, only if available >= amount
 * - DISPUTE: available -= amount, held += amount, for an undisputed deposit of the same client
 * - RESOLVE: held -= amount, available += amount, for a disputed deposit of the same client
 * - CHARGEBACK: held -= amount and the account locks, for a disputed deposit of the same client
 *
 * Failure split:
 * - locked account, duplicate deposit id and insufficient funds are REJECTED and logged at warn
 * - a dispute-family record whose deposit is unknown, belongs to another client or is in the
 *   wrong dispute state is IGNORED and only logged at debug
 *
 * No outcome stops the run. An engine instance owns its ledger and accounts exclusively and is
 * not thread-safe.
 */
@Slf4j
public class AccountEngine {

    static final String CLIENT_ID_MDC_KEY = "clientId";
    static final String TX_ID_MDC_KEY = "txId";

    private final Ledger ledger;
    private final TransactionMetrics metrics;
    private final Map<ClientId, ClientAccount> accounts = new TreeMap<>();

    public AccountEngine(Ledger ledger, TransactionMetrics metrics) {
        this.ledger = ledger;
        this.metrics = metrics;
    }

    /**
     * Applies one transaction. The target account is created on first sight, even when the
     * transaction itself ends up ignored or rejected.
     *
     * @param transaction the next record of the log
     * @return what happened to it; never null
     */
    public TransactionOutcome process(Transaction transaction) {
        ClientAccount account = accounts.computeIfAbsent(transaction.getClientId(), ClientAccount::new);

        MDC.put(CLIENT_ID_MDC_KEY, transaction.getClientId().toString());
        MDC.put(TX_ID_MDC_KEY, transaction.getTransactionId().toString());
        try {
            TransactionOutcome outcome = apply(account, transaction);
            record(outcome);
            return outcome;
        } finally {
            MDC.remove(CLIENT_ID_MDC_KEY);
            MDC.remove(TX_ID_MDC_KEY);
        }
    }

    private TransactionOutcome apply(ClientAccount account, Transaction transaction) {
        log.trace("Processing {}", transaction);
        try {
            return switch (transaction.getType()) {
                case DEPOSIT -> deposit(account, (Deposit) transaction);
                case WITHDRAWAL -> withdraw(account, (Withdrawal) transaction);
                case DISPUTE -> dispute(account, (Dispute) transaction);
                case RESOLVE -> resolve(account, (Resolve) transaction);
                case CHARGEBACK -> chargeBack(account, (Chargeback) transaction);
            };
        } catch (TransactionRejectedException e) {
            return TransactionOutcome.rejected(transaction, e.getReason(), e.getMessage());
        }
    }

    private TransactionOutcome deposit(ClientAccount account, Deposit deposit) {
        account.ensureNotLocked();
        if (ledger.contains(deposit.getTransactionId())) {
            throw new TransactionRejectedException(RejectionReason.DUPLICATE_TRANSACTION,
                String.format("Transaction %s was already recorded as a deposit", deposit.getTransactionId()));
        }

        account.deposit(deposit.getAmount());
        ledger.recordDeposit(deposit.getTransactionId(), deposit.getClientId(), deposit.getAmount());
        return TransactionOutcome.applied(deposit);
    }

    private TransactionOutcome withdraw(ClientAccount account, Withdrawal withdrawal) {
        account.ensureNotLocked();
        account.withdraw(withdrawal.getAmount());
        return TransactionOutcome.applied(withdrawal);
    }

    private TransactionOutcome dispute(ClientAccount account, Dispute dispute) {
        account.ensureNotLocked();

        Optional<DepositRecord> found = ledger.lookup(dispute.getTransactionId());
        if (found.isEmpty()) {
            return TransactionOutcome.ignored(dispute, "deposit not found");
        }
        DepositRecord deposit = found.get();
        if (!deposit.belongsTo(dispute.getClientId())) {
            return TransactionOutcome.ignored(dispute, "deposit belongs to another client");
        }
        if (deposit.isDisputed()) {
            return TransactionOutcome.ignored(dispute, "deposit already disputed");
        }

        account.hold(deposit.getAmount());
        ledger.markDisputed(dispute.getTransactionId());
        return TransactionOutcome.applied(dispute);
    }

    private TransactionOutcome resolve(ClientAccount account, Resolve resolve) {
        account.ensureNotLocked();

        Optional<DepositRecord> found = disputedDepositOf(resolve);
        if (found.isEmpty()) {
            return TransactionOutcome.ignored(resolve, "no disputed deposit of this client");
        }

        account.release(found.get().getAmount());
        ledger.markResolved(resolve.getTransactionId());
        return TransactionOutcome.applied(resolve);
    }

    private TransactionOutcome chargeBack(ClientAccount account, Chargeback chargeback) {
        account.ensureNotLocked();

        Optional<DepositRecord> found = disputedDepositOf(chargeback);
        if (found.isEmpty()) {
            return TransactionOutcome.ignored(chargeback, "no disputed deposit of this client");
        }

        // the ledger entry stays disputed; the account is locked from here on
        account.chargeBack(found.get().getAmount());
        return TransactionOutcome.applied(chargeback);
    }

    private Optional<DepositRecord> disputedDepositOf(Transaction transaction) {
        return ledger.lookup(transaction.getTransactionId())
            .filter(deposit -> deposit.belongsTo(transaction.getClientId()))
            .filter(DepositRecord::isDisputed);
    }

    private void record(TransactionOutcome outcome) {
        metrics.recordProcessed(outcome.getType().name(), outcome.getResult().name());

        switch (outcome.getResult()) {
            case APPLIED -> log.debug("Applied {} {}", outcome.getType(), outcome.getTransactionId());
            case IGNORED -> log.debug("Ignored {} {}: {}",
                outcome.getType(), outcome.getTransactionId(), outcome.getDetail());
            case REJECTED -> {
                metrics.recordRejected(outcome.getRejectionReason().name());
                log.warn("Rejected {} {}: reason={}, {}",
                    outcome.getType(), outcome.getTransactionId(),
                    outcome.getRejectionReason(), outcome.getDetail());
            }
        }
    }

    /**
     * Snapshots of every account seen so far, ordered by client id.
     */
    public List<AccountSummary> summaries() {
        return accounts.values().stream()
            .map(ClientAccount::toSummary)
            .toList();
    }

    public Optional<AccountSummary> findSummary(ClientId clientId) {
        return Optional.ofNullable(accounts.get(clientId)).map(ClientAccount::toSummary);
    }

    public int accountCount() {
        return accounts.size();
    }
}
