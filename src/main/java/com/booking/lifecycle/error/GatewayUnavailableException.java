package com.booking.lifecycle.error;

import com.booking.lifecycle.domain.GatewayError;
import lombok.Getter;

/**
 * Authorization could not be placed because the gateway kept failing with retryable errors.
 * The same request may be repeated with the same request id.
 */
@Getter
public class GatewayUnavailableException extends BookingException {

    private final GatewayError gatewayError;

    public GatewayUnavailableException(GatewayError gatewayError) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, "Payment gateway unavailable: " + gatewayError.describe());
        this.gatewayError = gatewayError;
    }
}
