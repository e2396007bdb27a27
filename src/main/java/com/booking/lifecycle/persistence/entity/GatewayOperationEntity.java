package com.booking.lifecycle.persistence.entity;

import com.booking.lifecycle.domain.GatewayOperationType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger of successful gateway calls keyed by idempotency key. A replayed call is answered
 * from here instead of reaching the gateway again.
 */
@Entity
@Table(name = "gateway_operations", indexes = {
    @Index(name = "idx_gateway_op_booking", columnList = "booking_id"),
    @Index(name = "idx_gateway_op_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayOperationEntity {

    @Id
    @Column(name = "idempotency_key", unique = true, nullable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", nullable = false, length = 20)
    private GatewayOperationType operation;

    @Column(name = "booking_id")
    private String bookingId;

    @Column(name = "payment_intent_id")
    private String paymentIntentId;

    /** Capture, refund or transfer id returned by the gateway. */
    @Column(name = "gateway_reference")
    private String gatewayReference;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "destination_account_id")
    private String destinationAccountId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
