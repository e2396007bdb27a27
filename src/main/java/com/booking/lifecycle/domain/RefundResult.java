package com.booking.lifecycle.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = RefundResult.RefundResultBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class RefundResult {

    String idempotencyKey;
    String paymentIntentId;
    String refundId;
    long amount;
    boolean replayed;
    Instant timestamp;
}
