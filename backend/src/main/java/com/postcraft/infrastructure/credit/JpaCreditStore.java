package com.postcraft.infrastructure.credit;

import com.postcraft.domain.credit.model.CreditAccount;
import com.postcraft.domain.credit.model.CreditLedgerEntry;
import com.postcraft.domain.credit.model.LedgerState;
import com.postcraft.domain.credit.model.ReservationOutcome;
import com.postcraft.domain.credit.repository.CreditAccountRepository;
import com.postcraft.domain.credit.repository.CreditLedgerRepository;
import com.postcraft.domain.credit.repository.CreditStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Database-backed credit store. The debit is a conditional UPDATE, so concurrent reservations
 * against one account can never drive the balance negative; the unique request id column
 * rejects a second entry for the same request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "credit.store", havingValue = "jpa")
public class JpaCreditStore implements CreditStore {

    private final CreditAccountRepository accountRepository;
    private final CreditLedgerRepository ledgerRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public BigDecimal getBalance(String accountId) {
        return accountRepository.findById(accountId)
                .map(CreditAccount::getBalance)
                .orElse(BigDecimal.ZERO);
    }

    @Override
    @Transactional
    public ReservationOutcome reserve(String accountId, String requestId, BigDecimal amount) {
        Optional<CreditLedgerEntry> existing = ledgerRepository.findByRequestIdForUpdate(requestId);
        if (existing.isPresent() && existing.get().getState() != LedgerState.REFUNDED) {
            CreditLedgerEntry entry = existing.get();
            return ReservationOutcome.replayOf(entry, getBalance(entry.getAccountId()));
        }

        Instant now = clock.instant();
        if (accountRepository.debitIfSufficient(accountId, amount, now) == 0) {
            return ReservationOutcome.insufficient(requestId, amount, getBalance(accountId));
        }

        CreditLedgerEntry entry;
        if (existing.isPresent()) {
            entry = existing.get();
            entry.rearm(accountId, amount, now);
        } else {
            entry = CreditLedgerEntry.builder()
                    .accountId(accountId)
                    .requestId(requestId)
                    .amount(amount)
                    .createdAt(now)
                    .build();
        }
        ledgerRepository.save(entry);
        return ReservationOutcome.reserved(requestId, amount, getBalance(accountId));
    }

    @Override
    @Transactional
    public LedgerState commit(String requestId) {
        CreditLedgerEntry entry = requireEntry(requestId);
        if (entry.isReserved()) {
            entry.markCommitted(clock.instant());
            ledgerRepository.save(entry);
        } else {
            log.debug("[Credits] Commit ignored for {} in state {}", requestId, entry.getState());
        }
        return entry.getState();
    }

    @Override
    @Transactional
    public LedgerState refund(String requestId) {
        CreditLedgerEntry entry = requireEntry(requestId);
        if (entry.isReserved()) {
            entry.markRefunded(clock.instant());
            ledgerRepository.save(entry);
            accountRepository.credit(entry.getAccountId(), entry.getAmount(), clock.instant());
        } else {
            log.debug("[Credits] Refund ignored for {} in state {}", requestId, entry.getState());
        }
        return entry.getState();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CreditLedgerEntry> findEntry(String requestId) {
        return ledgerRepository.findByRequestId(requestId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CreditLedgerEntry> findReservedBefore(Instant cutoff) {
        return ledgerRepository.findByStateAndCreatedAtBefore(LedgerState.RESERVED, cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CreditLedgerEntry> findEntriesByAccount(String accountId) {
        return ledgerRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
    }

    @Override
    @Transactional
    public BigDecimal deposit(String accountId, BigDecimal amount) {
        Instant now = clock.instant();
        if (accountRepository.credit(accountId, amount, now) == 0) {
            accountRepository.save(new CreditAccount(accountId, amount, now));
            return amount;
        }
        return getBalance(accountId);
    }

    private CreditLedgerEntry requireEntry(String requestId) {
        return ledgerRepository.findByRequestIdForUpdate(requestId)
                .orElseThrow(() -> new IllegalStateException("No credit reservation for request " + requestId));
    }
}
