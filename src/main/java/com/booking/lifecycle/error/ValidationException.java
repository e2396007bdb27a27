package com.booking.lifecycle.error;

/**
 * Malformed input (blank ids, negative amounts, oversized text). Never retried.
 */
public class ValidationException extends BookingException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }
}
