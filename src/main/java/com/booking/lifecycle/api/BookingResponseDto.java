package com.booking.lifecycle.api;

import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * REST API view of a booking.
 */
@Value
@Builder
public class BookingResponseDto {

    String id;
    String customerId;
    String providerId;
    String serviceId;
    BookingStatus status;
    long baseAmount;
    long totalAmount;
    long platformFee;
    String currencyCode;
    long depositAmount;
    long capturedDeposit;
    long remainingToCapture;
    PaymentStatus paymentStatus;
    Instant providerResponseDeadline;
    String declineReason;
    String cancellationReason;
    String paymentFailureDetail;
    Instant createdAt;
    Instant completedAt;
    Instant cancelledAt;

    public static BookingResponseDto from(BookingEntity booking) {
        return BookingResponseDto.builder()
                .id(booking.getId())
                .customerId(booking.getCustomerId())
                .providerId(booking.getProviderId())
                .serviceId(booking.getServiceId())
                .status(booking.getStatus())
                .baseAmount(booking.getBaseAmount())
                .totalAmount(booking.getTotalAmount())
                .platformFee(booking.getPlatformFee())
                .currencyCode(booking.getCurrencyCode())
                .depositAmount(booking.getDepositAmount())
                .capturedDeposit(booking.getCapturedDeposit())
                .remainingToCapture(booking.getRemainingToCapture())
                .paymentStatus(booking.getPaymentStatus())
                .providerResponseDeadline(booking.getProviderResponseDeadline())
                .declineReason(booking.getDeclineReason())
                .cancellationReason(booking.getCancellationReason())
                .paymentFailureDetail(booking.getPaymentFailureDetail())
                .createdAt(booking.getCreatedAt())
                .completedAt(booking.getCompletedAt())
                .cancelledAt(booking.getCancelledAt())
                .build();
    }
}
