package com.booking.lifecycle.domain;

/**
 * Classification of payment gateway failures.
 */
public enum GatewayErrorKind {
    /** 5xx-class or connection failure; the call did not take effect. Retryable. */
    TRANSIENT,
    /** Timed out; the call may or may not have taken effect. Retryable after re-querying the gateway. */
    TIMEOUT,
    /** Card declined, account closed, insufficient funds. Not retryable. */
    TERMINAL,
    /** Gateway reports the operation was already performed (e.g. intent already captured). */
    ALREADY_PROCESSED
}
