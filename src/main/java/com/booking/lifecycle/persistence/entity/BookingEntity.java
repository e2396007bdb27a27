package com.booking.lifecycle.persistence.entity;

import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A service booking and its staged payment bookkeeping. Rows are never deleted; terminal
 * rows are kept as history. Amounts are minor units (pence).
 */
@Entity
@Table(name = "bookings", indexes = {
    @Index(name = "idx_booking_status_deadline", columnList = "status, provider_response_deadline"),
    @Index(name = "idx_booking_provider_id", columnList = "provider_id"),
    @Index(name = "idx_booking_customer_id", columnList = "customer_id"),
    @Index(name = "idx_booking_payment_status", columnList = "payment_status")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BookingEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    /** Client key of the create request; a replayed request returns this row. */
    @Column(name = "request_id", unique = true, updatable = false)
    private String requestId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private String customerId;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private String providerId;

    @Column(name = "service_id", nullable = false, updatable = false)
    private String serviceId;

    @Column(name = "provider_account_id")
    private String providerAccountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "base_amount", nullable = false, updatable = false)
    private long baseAmount;

    @Column(name = "total_amount", nullable = false, updatable = false)
    private long totalAmount;

    @Column(name = "currency_code", nullable = false, length = 3, updatable = false)
    private String currencyCode;

    @Column(name = "deposit_amount", nullable = false, updatable = false)
    private long depositAmount;

    @Column(name = "captured_deposit", nullable = false)
    private long capturedDeposit;

    @Column(name = "remaining_to_capture", nullable = false)
    private long remainingToCapture;

    @Column(name = "payment_intent_id", nullable = false, updatable = false)
    private String paymentIntentId;

    @Column(name = "provider_response_deadline")
    private Instant providerResponseDeadline;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "refund_id")
    private String refundId;

    @Column(name = "provider_transfer_id")
    private String providerTransferId;

    @Column(name = "decline_reason", length = 500)
    private String declineReason;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "payment_failure_detail", length = 1000)
    private String paymentFailureDetail;

    @Column(name = "deposit_captured_at")
    private Instant depositCapturedAt;

    @Column(name = "remaining_captured_at")
    private Instant remainingCapturedAt;

    @Column(name = "provider_paid_at")
    private Instant providerPaidAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    /** Platform's share: whatever the customer pays above the provider's base price. */
    public long getPlatformFee() {
        return totalAmount - baseAmount;
    }

    /** Amount still uncaptured on the hold once the service is complete. */
    public long getOutstandingAmount() {
        return totalAmount - capturedDeposit;
    }

    /**
     * Throws if the amount bookkeeping is inconsistent. Checked before every write.
     */
    public void checkInvariants() {
        if (baseAmount <= 0 || totalAmount < baseAmount) {
            throw new IllegalStateException("Booking " + id + ": invalid amounts base=" + baseAmount + " total=" + totalAmount);
        }
        if (depositAmount < 0 || depositAmount > totalAmount) {
            throw new IllegalStateException("Booking " + id + ": deposit " + depositAmount + " outside [0, " + totalAmount + "]");
        }
        if (capturedDeposit < 0 || remainingToCapture < 0
                || capturedDeposit + remainingToCapture > totalAmount) {
            throw new IllegalStateException("Booking " + id + ": captured_deposit=" + capturedDeposit
                    + " + remaining_to_capture=" + remainingToCapture + " exceeds total=" + totalAmount);
        }
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }
}
