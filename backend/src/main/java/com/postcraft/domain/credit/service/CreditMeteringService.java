package com.postcraft.domain.credit.service;

import com.postcraft.domain.credit.model.CreditLedgerEntry;
import com.postcraft.domain.credit.model.LedgerState;
import com.postcraft.domain.credit.model.ReservationOutcome;
import com.postcraft.domain.credit.repository.CreditStore;
import com.postcraft.domain.generation.model.ModelTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Credit arithmetic around a {@link CreditStore}: quoting, reservation, settlement and top-ups.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditMeteringService {

    private final CreditStore creditStore;
    private final Clock clock;

    /**
     * Cost of a request: {@code creditCost x max(1, variantCount)}. Fractional costs are kept as-is.
     */
    public BigDecimal quote(ModelTier tier, int variantCount) {
        return tier.creditCost().multiply(BigDecimal.valueOf(Math.max(1, variantCount)));
    }

    public ReservationOutcome reserve(String accountId, BigDecimal amount, String requestId) {
        requireText(accountId, "accountId");
        requireText(requestId, "requestId");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Reservation amount must be positive: " + amount);
        }

        ReservationOutcome outcome;
        try {
            outcome = creditStore.reserve(accountId, requestId, amount);
        } catch (DataIntegrityViolationException e) {
            // Lost a race on the unique request id; the winner's entry is the outcome.
            CreditLedgerEntry winner = creditStore.findEntry(requestId).orElseThrow(() -> e);
            outcome = ReservationOutcome.replayOf(winner, creditStore.getBalance(accountId));
        }

        switch (outcome.status()) {
            case RESERVED -> log.info("[Credits] Reserved {} for request {} (account {}, remaining {})",
                    amount, requestId, accountId, outcome.remainingBalance());
            case INSUFFICIENT_CREDITS -> log.info("[Credits] Insufficient credits for request {} (account {}, needed {}, balance {})",
                    requestId, accountId, amount, outcome.remainingBalance());
            default -> log.warn("[Credits] Replayed reservation for request {}: {}", requestId, outcome.status());
        }
        return outcome;
    }

    public LedgerState commit(String requestId) {
        LedgerState state = creditStore.commit(requestId);
        log.info("[Credits] Commit request {} -> {}", requestId, state);
        return state;
    }

    public LedgerState refund(String requestId) {
        LedgerState state = creditStore.refund(requestId);
        log.info("[Credits] Refund request {} -> {}", requestId, state);
        return state;
    }

    public BigDecimal balance(String accountId) {
        requireText(accountId, "accountId");
        return creditStore.getBalance(accountId);
    }

    public Optional<CreditLedgerEntry> findEntry(String requestId) {
        return creditStore.findEntry(requestId);
    }

    /**
     * Reservation history of an account, newest first.
     */
    public List<CreditLedgerEntry> history(String accountId) {
        requireText(accountId, "accountId");
        return creditStore.findEntriesByAccount(accountId);
    }

    /**
     * Top-up arithmetic only; payment is handled elsewhere.
     */
    public BigDecimal grant(String accountId, BigDecimal amount) {
        requireText(accountId, "accountId");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Grant amount must be positive: " + amount);
        }
        BigDecimal balance = creditStore.deposit(accountId, amount);
        log.info("[Credits] Granted {} to account {} (balance {})", amount, accountId, balance);
        return balance;
    }

    /**
     * Refund reservations that have stayed reserved longer than {@code olderThan}.
     *
     * @return number of reservations refunded
     */
    public int releaseStaleReservations(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        List<CreditLedgerEntry> stale = creditStore.findReservedBefore(cutoff);
        int released = 0;
        for (CreditLedgerEntry entry : stale) {
            if (creditStore.refund(entry.getRequestId()) == LedgerState.REFUNDED) {
                released++;
                log.warn("[Credits] Released stale reservation {} ({} credits, account {}, created {})",
                        entry.getRequestId(), entry.getAmount(), entry.getAccountId(), entry.getCreatedAt());
            }
        }
        return released;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
