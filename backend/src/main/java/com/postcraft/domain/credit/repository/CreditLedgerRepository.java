package com.postcraft.domain.credit.repository;

import com.postcraft.domain.credit.model.CreditLedgerEntry;
import com.postcraft.domain.credit.model.LedgerState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CreditLedgerRepository extends JpaRepository<CreditLedgerEntry, Long> {

    Optional<CreditLedgerEntry> findByRequestId(String requestId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from CreditLedgerEntry e where e.requestId = :requestId")
    Optional<CreditLedgerEntry> findByRequestIdForUpdate(@Param("requestId") String requestId);

    List<CreditLedgerEntry> findByStateAndCreatedAtBefore(LedgerState state, Instant cutoff);

    List<CreditLedgerEntry> findByAccountIdOrderByCreatedAtDesc(String accountId);
}
