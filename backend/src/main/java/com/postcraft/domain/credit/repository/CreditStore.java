package com.postcraft.domain.credit.repository;

import com.postcraft.domain.credit.model.CreditLedgerEntry;
import com.postcraft.domain.credit.model.LedgerState;
import com.postcraft.domain.credit.model.ReservationOutcome;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Account-balance store. Every mutation is a single atomic operation keyed by request id.
 */
public interface CreditStore {

    /**
     * Current spendable balance; zero for unknown accounts.
     */
    BigDecimal getBalance(String accountId);

    /**
     * Debit {@code amount} and record a reservation, unless the request id already holds a live
     * (reserved or committed) entry, in which case nothing changes and the original outcome is replayed.
     */
    ReservationOutcome reserve(String accountId, String requestId, BigDecimal amount);

    /**
     * Turn a reservation into a permanent debit.
     *
     * @return the entry state after the call; unchanged when the entry was not reserved
     * @throws IllegalStateException if no entry exists for the request id
     */
    LedgerState commit(String requestId);

    /**
     * Release a reservation back to the balance.
     *
     * @return the entry state after the call; unchanged when the entry was not reserved
     * @throws IllegalStateException if no entry exists for the request id
     */
    LedgerState refund(String requestId);

    Optional<CreditLedgerEntry> findEntry(String requestId);

    List<CreditLedgerEntry> findReservedBefore(Instant cutoff);

    /**
     * Every ledger entry of an account, newest first.
     */
    List<CreditLedgerEntry> findEntriesByAccount(String accountId);

    /**
     * Add credits to an account, creating it if needed.
     *
     * @return the new balance
     */
    BigDecimal deposit(String accountId, BigDecimal amount);
}
