package com.booking.lifecycle.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Captures part of an authorization hold.
 */
@Value
@Builder
public class CaptureRequest {

    String idempotencyKey;
    String paymentIntentId;
    /** Amount to capture in this call, minor units. */
    long amount;
    /**
     * Total the intent should have captured once this call has taken effect. Used to
     * recognise an already-applied capture when re-querying the gateway.
     */
    long expectedCapturedTotal;
    String bookingId;
}
