package com.booking.lifecycle.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Authoritative view of a payment intent as reported by the gateway. Used to settle
 * calls whose outcome is unknown (timeouts) before acting on them again.
 */
@Value
@Builder
public class IntentSnapshot {

    String paymentIntentId;
    IntentStatus status;
    long authorizedAmount;
    long capturedAmount;
    long refundedAmount;
    /** Id of the most recent capture on the intent; null while nothing is captured. */
    String latestCaptureId;

    public long getCapturableAmount() {
        return status == IntentStatus.CANCELED ? 0 : Math.max(0, authorizedAmount - capturedAmount);
    }
}
