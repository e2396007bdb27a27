package com.booking.lifecycle.error;

/**
 * Caller is not the assigned provider (or customer, where allowed) of the booking.
 */
public class ForbiddenException extends BookingException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
