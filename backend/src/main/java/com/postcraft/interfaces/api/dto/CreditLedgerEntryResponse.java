package com.postcraft.interfaces.api.dto;

import com.postcraft.domain.credit.model.CreditLedgerEntry;

import java.math.BigDecimal;
import java.time.Instant;

public record CreditLedgerEntryResponse(
        String requestId,
        BigDecimal amount,
        String state,
        Instant createdAt,
        Instant updatedAt
) {
    public static CreditLedgerEntryResponse from(CreditLedgerEntry entry) {
        return new CreditLedgerEntryResponse(
                entry.getRequestId(),
                entry.getAmount(),
                entry.getState().name(),
                entry.getCreatedAt(),
                entry.getUpdatedAt());
    }
}
