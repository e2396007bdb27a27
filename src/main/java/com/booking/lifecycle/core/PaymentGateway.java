package com.booking.lifecycle.core;

import com.booking.lifecycle.domain.AuthorizationRequest;
import com.booking.lifecycle.domain.AuthorizationResult;
import com.booking.lifecycle.domain.CaptureRequest;
import com.booking.lifecycle.domain.CaptureResult;
import com.booking.lifecycle.domain.IntentSnapshot;
import com.booking.lifecycle.domain.RefundRequest;
import com.booking.lifecycle.domain.RefundResult;
import com.booking.lifecycle.domain.ReleaseResult;
import com.booking.lifecycle.domain.TransferRequest;
import com.booking.lifecycle.domain.TransferResult;

import java.util.List;
import java.util.Optional;

/**
 * What a payment gateway integration has to provide. Every money-moving call carries the
 * caller's idempotency key and must be safe to repeat with the same key.
 * Failures are reported as {@link com.booking.lifecycle.error.GatewayException} carrying a
 * classified {@link com.booking.lifecycle.domain.GatewayError}.
 */
public interface PaymentGateway {

    default String getGatewayName() {
        return this.getClass().getSimpleName();
    }

    /** Places a manual-capture hold for the full amount and returns the new intent. */
    AuthorizationResult authorize(AuthorizationRequest request);

    /** Captures part of an authorized intent. */
    CaptureResult capture(CaptureRequest request);

    RefundResult refund(RefundRequest request);

    /** Pays funds out to a connected account. */
    TransferResult transfer(TransferRequest request);

    /** Cancels whatever is still uncaptured on the intent. */
    ReleaseResult release(String paymentIntentId, String idempotencyKey);

    /** Current gateway-side state of an intent. */
    IntentSnapshot retrieveIntent(String paymentIntentId);

    /** Refunds made against the intent, oldest first. */
    List<RefundResult> listRefunds(String paymentIntentId);

    /** Transfer previously made under the given group, if any. */
    Optional<TransferResult> findTransfer(String transferGroup);
}
