package com.booking.lifecycle.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * REST API request body for creating a booking. Amounts are minor units (pence).
 */
@Data
public class CreateBookingRequestDto {

    /** Client idempotency key; repeat it to retry safely. Optional. */
    private String requestId;

    @NotBlank(message = "customerId is required")
    private String customerId;

    @NotBlank(message = "providerId is required")
    private String providerId;

    @NotBlank(message = "serviceId is required")
    private String serviceId;

    /** Provider's connected payout account. Required before the booking can be completed. */
    private String providerAccountId;

    /** Provider's price. */
    @Positive(message = "baseAmount must be positive")
    private long baseAmount;

    /** What the customer pays: base price plus platform fee. */
    @Positive(message = "totalAmount must be positive")
    private long totalAmount;

    @Pattern(regexp = "[A-Z]{3}", message = "currencyCode must be an ISO 4217 code")
    private String currencyCode;

    @Min(0)
    @Max(100)
    private Integer depositPercentage;

    @NotBlank(message = "paymentMethodId is required")
    private String paymentMethodId;
}
