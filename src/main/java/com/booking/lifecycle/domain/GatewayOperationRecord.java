package com.booking.lifecycle.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A successful gateway call as remembered by the idempotency ledger.
 */
@Value
@Builder
@JsonDeserialize(builder = GatewayOperationRecord.GatewayOperationRecordBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class GatewayOperationRecord {

    String idempotencyKey;
    GatewayOperationType operation;
    String bookingId;
    String paymentIntentId;
    /** Capture, refund, transfer or intent id returned by the gateway. */
    String gatewayReference;
    long amount;
    String destinationAccountId;
    Instant timestamp;
}
