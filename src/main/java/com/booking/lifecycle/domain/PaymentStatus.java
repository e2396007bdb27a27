package com.booking.lifecycle.domain;

/**
 * Money-movement state of a booking, tracked independently of {@link BookingStatus}.
 * A booking can be ACCEPTED with CAPTURE_FAILED, or COMPLETED with CAPTURE_FAILED when
 * the provider payout could not be made; those rows are flagged for reconciliation.
 */
public enum PaymentStatus {
    /** Authorization hold placed for the full amount, nothing captured. */
    AUTHORIZED,
    /** Deposit captured on acceptance. */
    DEPOSIT_CAPTURED,
    /** Remaining amount captured and provider paid. */
    COMPLETED,
    /** A capture or payout step failed; see the booking's failure detail. */
    CAPTURE_FAILED,
    /** Captured deposit returned to the customer. */
    REFUNDED
}
