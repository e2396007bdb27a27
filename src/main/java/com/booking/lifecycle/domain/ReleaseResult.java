package com.booking.lifecycle.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of releasing the uncaptured remainder of an authorization hold.
 */
@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = ReleaseResult.ReleaseResultBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class ReleaseResult {

    String idempotencyKey;
    String paymentIntentId;
    long releasedAmount;
    boolean replayed;
    Instant timestamp;
}
