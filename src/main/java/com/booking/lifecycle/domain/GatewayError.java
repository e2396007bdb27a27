package com.booking.lifecycle.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

/**
 * Structured gateway failure. Adapters build these directly from the gateway response so
 * nothing downstream has to parse error strings.
 */
@Value
@Builder
@JsonDeserialize(builder = GatewayError.GatewayErrorBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class GatewayError {

    GatewayErrorKind kind;
    boolean retryable;
    /** Gateway error code (e.g. card_declined), may be null. */
    String code;
    String message;

    public static GatewayError transientError(String code, String message) {
        return new GatewayError(GatewayErrorKind.TRANSIENT, true, code, message);
    }

    public static GatewayError timeout(String message) {
        return new GatewayError(GatewayErrorKind.TIMEOUT, true, "timeout", message);
    }

    public static GatewayError terminal(String code, String message) {
        return new GatewayError(GatewayErrorKind.TERMINAL, false, code, message);
    }

    public static GatewayError alreadyProcessed(String message) {
        return new GatewayError(GatewayErrorKind.ALREADY_PROCESSED, false, "already_processed", message);
    }

    /** True when the gateway may have applied the call even though we saw a failure. */
    public boolean isOutcomeUnknown() {
        return kind == GatewayErrorKind.TIMEOUT;
    }

    /** One-line form stored on the booking as failure detail. */
    public String describe() {
        return kind + (code != null ? "/" + code : "") + ": " + message;
    }
}
