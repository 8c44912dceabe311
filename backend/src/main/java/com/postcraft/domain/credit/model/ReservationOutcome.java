package com.postcraft.domain.credit.model;

import java.math.BigDecimal;

/**
 * Result of a reserve call.
 *
 * @param status           what the call did
 * @param requestId        reservation key
 * @param amount           reserved amount (the original amount on replay)
 * @param remainingBalance account balance after the call
 */
public record ReservationOutcome(
        ReservationStatus status,
        String requestId,
        BigDecimal amount,
        BigDecimal remainingBalance
) {
    public static ReservationOutcome reserved(String requestId, BigDecimal amount, BigDecimal remainingBalance) {
        return new ReservationOutcome(ReservationStatus.RESERVED, requestId, amount, remainingBalance);
    }

    public static ReservationOutcome insufficient(String requestId, BigDecimal amount, BigDecimal remainingBalance) {
        return new ReservationOutcome(ReservationStatus.INSUFFICIENT_CREDITS, requestId, amount, remainingBalance);
    }

    public static ReservationOutcome replayOf(CreditLedgerEntry entry, BigDecimal remainingBalance) {
        ReservationStatus status = switch (entry.getState()) {
            case RESERVED -> ReservationStatus.REPLAYED_RESERVED;
            case COMMITTED -> ReservationStatus.REPLAYED_COMMITTED;
            case REFUNDED -> throw new IllegalArgumentException(
                    "Refunded entry " + entry.getRequestId() + " is not a replay");
        };
        return new ReservationOutcome(status, entry.getRequestId(), entry.getAmount(), remainingBalance);
    }

    public boolean ok() {
        return status != ReservationStatus.INSUFFICIENT_CREDITS;
    }

    public boolean replayed() {
        return status == ReservationStatus.REPLAYED_RESERVED || status == ReservationStatus.REPLAYED_COMMITTED;
    }
}
