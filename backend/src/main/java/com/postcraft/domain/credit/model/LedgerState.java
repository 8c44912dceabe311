package com.postcraft.domain.credit.model;

public enum LedgerState {
    RESERVED,
    COMMITTED,
    REFUNDED
}
