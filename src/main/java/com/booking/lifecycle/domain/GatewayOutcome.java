package com.booking.lifecycle.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either the value returned by a gateway call or the structured error it failed with.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GatewayOutcome<T> {

    T value;
    GatewayError error;

    public static <T> GatewayOutcome<T> success(T value) {
        return new GatewayOutcome<>(value, null);
    }

    public static <T> GatewayOutcome<T> failure(GatewayError error) {
        return new GatewayOutcome<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
