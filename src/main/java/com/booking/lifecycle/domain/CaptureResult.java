package com.booking.lifecycle.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = CaptureResult.CaptureResultBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class CaptureResult {

    String idempotencyKey;
    String paymentIntentId;
    String captureId;
    long capturedAmount;
    /** True when the result was served from an earlier call instead of a new charge. */
    boolean replayed;
    Instant timestamp;
}
