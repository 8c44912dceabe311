package com.postcraft.domain.credit.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One credit movement keyed by request id. The unique request id is the idempotency anchor:
 * a request owns at most one entry, and only a refunded entry may be re-armed.
 */
@Entity
@Table(name = "credit_ledger_entries",
        indexes = @Index(name = "idx_ledger_state_created", columnList = "state, createdAt"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CreditLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "request_id", nullable = false, unique = true, length = 128)
    private String requestId;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private LedgerState state;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Builder
    public CreditLedgerEntry(String accountId, String requestId, BigDecimal amount, Instant createdAt) {
        this.accountId = accountId;
        this.requestId = requestId;
        this.amount = amount;
        this.state = LedgerState.RESERVED;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean isReserved() {
        return state == LedgerState.RESERVED;
    }

    public void markCommitted(Instant at) {
        requireState(LedgerState.RESERVED);
        this.state = LedgerState.COMMITTED;
        this.updatedAt = at;
    }

    public void markRefunded(Instant at) {
        requireState(LedgerState.RESERVED);
        this.state = LedgerState.REFUNDED;
        this.updatedAt = at;
    }

    /**
     * Reuse a refunded entry for a new reservation under the same request id.
     */
    public void rearm(String accountId, BigDecimal amount, Instant at) {
        requireState(LedgerState.REFUNDED);
        this.accountId = accountId;
        this.amount = amount;
        this.state = LedgerState.RESERVED;
        this.createdAt = at;
        this.updatedAt = at;
    }

    /**
     * Detached copy for callers outside the store.
     */
    public CreditLedgerEntry copy() {
        CreditLedgerEntry copy = new CreditLedgerEntry(accountId, requestId, amount, createdAt);
        copy.id = id;
        copy.state = state;
        copy.updatedAt = updatedAt;
        return copy;
    }

    private void requireState(LedgerState expected) {
        if (state != expected) {
            throw new IllegalStateException(
                    "Ledger entry " + requestId + " is " + state + ", expected " + expected);
        }
    }
}
