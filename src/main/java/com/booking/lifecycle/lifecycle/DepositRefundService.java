package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.domain.RefundRequest;
import com.booking.lifecycle.domain.RefundResult;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.persistence.service.BookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Returns a captured deposit to the customer once a booking was declined or expired.
 * A failed refund is recorded on the booking for reconciliation and never reverses the status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DepositRefundService {

    private final BookingStore bookingStore;
    private final PaymentGatewayClient gatewayClient;
    private final BookingEventProducer eventProducer;

    public BookingActionResult refundCapturedDeposit(BookingEntity booking) {
        if (booking.getStatus() != BookingStatus.DECLINED && booking.getStatus() != BookingStatus.EXPIRED) {
            throw new IllegalStateException("Deposit refunds apply to declined or expired bookings, not " + booking.getStatus());
        }
        if (booking.getCapturedDeposit() <= 0) {
            log.debug("No deposit captured for bookingId={}, nothing to refund", booking.getId());
            return BookingActionResult.of(booking, PaymentOutcome.NONE);
        }

        RefundRequest request = RefundRequest.builder()
                .idempotencyKey(IdempotencyKeys.refund(booking.getId()))
                .paymentIntentId(booking.getPaymentIntentId())
                .amount(booking.getCapturedDeposit())
                .bookingId(booking.getId())
                .reason("Booking " + booking.getStatus().name().toLowerCase())
                .build();
        GatewayOutcome<RefundResult> outcome = gatewayClient.refund(request);

        if (outcome.isSuccess()) {
            String refundId = outcome.getValue().getRefundId();
            BookingEntity refunded = bookingStore.update(booking.getId(), b -> {
                b.setPaymentStatus(PaymentStatus.REFUNDED);
                b.setRefundId(refundId);
                b.setPaymentFailureDetail(null);
            });
            log.info("Deposit refunded: bookingId={}, amount={}, refundId={}", booking.getId(), request.getAmount(), refundId);
            eventProducer.publishPaymentUpdated(refunded, PaymentOutcome.REFUNDED);
            return BookingActionResult.of(refunded, PaymentOutcome.REFUNDED);
        }

        BookingEntity flagged = bookingStore.update(booking.getId(),
                b -> b.setPaymentFailureDetail("Deposit refund failed: " + outcome.getError().describe()));
        log.error("Deposit refund failed: bookingId={}, amount={}, error={}",
                booking.getId(), request.getAmount(), outcome.getError().describe());
        eventProducer.publishPaymentUpdated(flagged, PaymentOutcome.REFUND_FAILED);
        return BookingActionResult.failed(flagged, PaymentOutcome.REFUND_FAILED, outcome.getError());
    }
}
