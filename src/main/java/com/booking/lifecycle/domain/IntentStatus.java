package com.booking.lifecycle.domain;

/**
 * Gateway-side state of a payment intent.
 */
public enum IntentStatus {
    REQUIRES_CAPTURE,
    PARTIALLY_CAPTURED,
    SUCCEEDED,
    CANCELED
}
