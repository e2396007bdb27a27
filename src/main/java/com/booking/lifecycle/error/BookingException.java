package com.booking.lifecycle.error;

import lombok.Getter;

/**
 * Base of the engine's precondition failures. Payment side-effect failures are not
 * exceptions; they travel as {@link com.booking.lifecycle.domain.GatewayError} values.
 */
@Getter
public abstract class BookingException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BookingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
