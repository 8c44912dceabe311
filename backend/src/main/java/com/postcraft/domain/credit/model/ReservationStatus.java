package com.postcraft.domain.credit.model;

public enum ReservationStatus {
    /** A new reservation debited the balance. */
    RESERVED,
    /** The request id already holds a live reservation; nothing was debited. */
    REPLAYED_RESERVED,
    /** The request id was already charged; nothing was debited. */
    REPLAYED_COMMITTED,
    INSUFFICIENT_CREDITS
}
