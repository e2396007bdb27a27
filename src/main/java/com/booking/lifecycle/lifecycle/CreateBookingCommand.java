package com.booking.lifecycle.lifecycle;

import lombok.Builder;
import lombok.Value;

/**
 * Input for creating a booking. Amounts are minor units.
 */
@Value
@Builder
public class CreateBookingCommand {

    /** Client idempotency key; a repeated value returns the booking already created for it. */
    String requestId;
    String customerId;
    String providerId;
    String serviceId;
    String providerAccountId;
    long baseAmount;
    long totalAmount;
    /** Defaults to the configured currency when null. */
    String currencyCode;
    /** Defaults to the configured percentage when null. */
    Integer depositPercentage;
    String paymentMethodId;
}
