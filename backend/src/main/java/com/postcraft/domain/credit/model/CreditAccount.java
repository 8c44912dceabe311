package com.postcraft.domain.credit.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "credit_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CreditAccount {

    @Id
    @Column(name = "account_id", length = 64)
    private String accountId;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal balance;

    @Column(nullable = false)
    private Instant updatedAt;

    public CreditAccount(String accountId, BigDecimal balance, Instant updatedAt) {
        this.accountId = accountId;
        this.balance = balance;
        this.updatedAt = updatedAt;
    }
}
