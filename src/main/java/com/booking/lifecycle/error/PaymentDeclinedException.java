package com.booking.lifecycle.error;

import com.booking.lifecycle.domain.GatewayError;
import lombok.Getter;

/**
 * Authorization hold could not be placed when creating a booking; nothing was stored.
 */
@Getter
public class PaymentDeclinedException extends BookingException {

    private final GatewayError gatewayError;

    public PaymentDeclinedException(GatewayError gatewayError) {
        super(ErrorCode.PAYMENT_DECLINED, "Authorization failed: " + gatewayError.describe());
        this.gatewayError = gatewayError;
    }
}
