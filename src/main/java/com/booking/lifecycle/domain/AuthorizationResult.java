package com.booking.lifecycle.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonDeserialize(builder = AuthorizationResult.AuthorizationResultBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class AuthorizationResult {

    String idempotencyKey;
    String paymentIntentId;
    long amount;
    String currencyCode;
    Instant timestamp;
}
