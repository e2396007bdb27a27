package com.booking.lifecycle.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Places an authorization hold for the full booking amount on the customer's payment method.
 */
@Value
@Builder
public class AuthorizationRequest {

    String idempotencyKey;
    /** Amount in minor units (pence). */
    long amount;
    String currencyCode;
    /** Gateway payment method token supplied by the customer's client. */
    String paymentMethodId;
    String customerId;
}
