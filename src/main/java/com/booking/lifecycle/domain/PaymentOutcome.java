package com.booking.lifecycle.domain;

/**
 * Payment side effect of a lifecycle operation, reported next to the booking so callers can
 * tell "the charge failed" apart from "the payout failed".
 */
public enum PaymentOutcome {
    /** No gateway call was needed. */
    NONE,
    DEPOSIT_CAPTURED,
    /** A capture (deposit or remaining amount) failed. */
    CHARGE_FAILED,
    REFUNDED,
    REFUND_FAILED,
    TRANSFER_COMPLETED,
    /** Customer was charged but the provider payout failed. */
    TRANSFER_FAILED,
    HOLD_RELEASED,
    RELEASE_FAILED;

    public boolean isFailure() {
        return this == CHARGE_FAILED || this == REFUND_FAILED || this == TRANSFER_FAILED || this == RELEASE_FAILED;
    }
}
