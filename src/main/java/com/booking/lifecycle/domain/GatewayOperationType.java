package com.booking.lifecycle.domain;

public enum GatewayOperationType {
    AUTHORIZE,
    CAPTURE,
    REFUND,
    TRANSFER,
    RELEASE
}
