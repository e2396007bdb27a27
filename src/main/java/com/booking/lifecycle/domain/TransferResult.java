package com.booking.lifecycle.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = TransferResult.TransferResultBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class TransferResult {

    String idempotencyKey;
    String transferId;
    long amount;
    String destinationAccountId;
    String transferGroup;
    boolean replayed;
    Instant timestamp;
}
