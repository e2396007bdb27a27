package com.booking.lifecycle.error;

import com.booking.lifecycle.domain.GatewayError;
import lombok.Getter;

/**
 * Raised by {@link com.booking.lifecycle.core.PaymentGateway} implementations. The client
 * retries it when {@link GatewayError#isRetryable()} and otherwise turns it into a
 * failed {@link com.booking.lifecycle.domain.GatewayOutcome}.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final GatewayError error;

    public GatewayException(GatewayError error) {
        super(error.describe());
        this.error = error;
    }

    public GatewayException(GatewayError error, Throwable cause) {
        super(error.describe(), cause);
        this.error = error;
    }

    public boolean isRetryable() {
        return error.isRetryable();
    }
}
