package com.booking.lifecycle.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    VALIDATION_FAILED(400),
    PAYMENT_DECLINED(402),
    FORBIDDEN(403),
    BOOKING_NOT_FOUND(404),
    CONFLICT(409),
    GATEWAY_UNAVAILABLE(503);

    private final int status;
}
