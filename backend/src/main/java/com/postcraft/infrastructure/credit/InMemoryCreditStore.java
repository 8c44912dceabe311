package com.postcraft.infrastructure.credit;

import com.postcraft.domain.credit.model.CreditLedgerEntry;
import com.postcraft.domain.credit.model.LedgerState;
import com.postcraft.domain.credit.model.ReservationOutcome;
import com.postcraft.domain.credit.repository.CreditStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local credit store. All mutations are serialised on the instance monitor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "credit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryCreditStore implements CreditStore {

    private final Clock clock;

    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final Map<String, CreditLedgerEntry> ledger = new LinkedHashMap<>();

    @Override
    public synchronized BigDecimal getBalance(String accountId) {
        return balances.getOrDefault(accountId, BigDecimal.ZERO);
    }

    @Override
    public synchronized ReservationOutcome reserve(String accountId, String requestId, BigDecimal amount) {
        CreditLedgerEntry existing = ledger.get(requestId);
        if (existing != null && existing.getState() != LedgerState.REFUNDED) {
            return ReservationOutcome.replayOf(existing, getBalance(existing.getAccountId()));
        }

        BigDecimal balance = getBalance(accountId);
        if (balance.compareTo(amount) < 0) {
            return ReservationOutcome.insufficient(requestId, amount, balance);
        }

        Instant now = clock.instant();
        BigDecimal remaining = balance.subtract(amount);
        balances.put(accountId, remaining);
        if (existing != null) {
            existing.rearm(accountId, amount, now);
        } else {
            ledger.put(requestId, CreditLedgerEntry.builder()
                    .accountId(accountId)
                    .requestId(requestId)
                    .amount(amount)
                    .createdAt(now)
                    .build());
        }
        return ReservationOutcome.reserved(requestId, amount, remaining);
    }

    @Override
    public synchronized LedgerState commit(String requestId) {
        CreditLedgerEntry entry = requireEntry(requestId);
        if (entry.isReserved()) {
            entry.markCommitted(clock.instant());
        } else {
            log.debug("[Credits] Commit ignored for {} in state {}", requestId, entry.getState());
        }
        return entry.getState();
    }

    @Override
    public synchronized LedgerState refund(String requestId) {
        CreditLedgerEntry entry = requireEntry(requestId);
        if (entry.isReserved()) {
            entry.markRefunded(clock.instant());
            balances.merge(entry.getAccountId(), entry.getAmount(), BigDecimal::add);
        } else {
            log.debug("[Credits] Refund ignored for {} in state {}", requestId, entry.getState());
        }
        return entry.getState();
    }

    @Override
    public synchronized Optional<CreditLedgerEntry> findEntry(String requestId) {
        return Optional.ofNullable(ledger.get(requestId)).map(CreditLedgerEntry::copy);
    }

    @Override
    public synchronized List<CreditLedgerEntry> findReservedBefore(Instant cutoff) {
        return ledger.values().stream()
                .filter(CreditLedgerEntry::isReserved)
                .filter(e -> e.getCreatedAt().isBefore(cutoff))
                .map(CreditLedgerEntry::copy)
                .toList();
    }

    @Override
    public synchronized List<CreditLedgerEntry> findEntriesByAccount(String accountId) {
        List<CreditLedgerEntry> entries = new ArrayList<>();
        for (CreditLedgerEntry entry : ledger.values()) {
            if (entry.getAccountId().equals(accountId)) {
                entries.add(entry.copy());
            }
        }
        // Reverse insertion order first so equal timestamps still list the latest entry first
        Collections.reverse(entries);
        entries.sort(Comparator.comparing(CreditLedgerEntry::getCreatedAt).reversed());
        return entries;
    }

    @Override
    public synchronized BigDecimal deposit(String accountId, BigDecimal amount) {
        return balances.merge(accountId, amount, BigDecimal::add);
    }

    private CreditLedgerEntry requireEntry(String requestId) {
        CreditLedgerEntry entry = ledger.get(requestId);
        if (entry == null) {
            throw new IllegalStateException("No credit reservation for request " + requestId);
        }
        return entry;
    }
}
