package com.booking.lifecycle.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RefundRequest {

    String idempotencyKey;
    String paymentIntentId;
    long amount;
    String bookingId;
    /** Reason recorded with the gateway refund (optional). */
    String reason;
}
