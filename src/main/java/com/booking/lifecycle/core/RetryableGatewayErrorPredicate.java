package com.booking.lifecycle.core;

import com.booking.lifecycle.error.GatewayException;

import java.util.function.Predicate;

/**
 * Retry and circuit-breaker predicate: only gateway failures classified as retryable count.
 * Declines and other terminal errors are neither retried nor held against the gateway's health.
 */
public class RetryableGatewayErrorPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof GatewayException) {
            return ((GatewayException) throwable).isRetryable();
        }
        return false;
    }
}
