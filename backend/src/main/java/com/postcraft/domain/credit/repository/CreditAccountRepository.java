package com.postcraft.domain.credit.repository;

import com.postcraft.domain.credit.model.CreditAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;

public interface CreditAccountRepository extends JpaRepository<CreditAccount, String> {

    /**
     * Conditional decrement; returns 0 when the balance does not cover the amount.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update CreditAccount a set a.balance = a.balance - :amount, a.updatedAt = :now " +
            "where a.accountId = :accountId and a.balance >= :amount")
    int debitIfSufficient(@Param("accountId") String accountId,
                          @Param("amount") BigDecimal amount,
                          @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update CreditAccount a set a.balance = a.balance + :amount, a.updatedAt = :now " +
            "where a.accountId = :accountId")
    int credit(@Param("accountId") String accountId,
               @Param("amount") BigDecimal amount,
               @Param("now") Instant now);
}
