package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.CaptureRequest;
import com.booking.lifecycle.domain.CaptureResult;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.persistence.service.BookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;

/**
 * Provider accepts a pending booking. The status change commits first; the deposit is captured
 * afterwards and its result written back separately, so a failed capture leaves the booking
 * ACCEPTED with payment status CAPTURE_FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcceptBookingHandler {

    private static final Set<BookingStatus> FROM_PENDING = EnumSet.of(BookingStatus.PENDING);

    private final BookingStore bookingStore;
    private final PaymentGatewayClient gatewayClient;
    private final BookingEventProducer eventProducer;
    private final Clock clock;

    /**
     * @throws com.booking.lifecycle.error.BookingNotFoundException unknown booking
     * @throws com.booking.lifecycle.error.ForbiddenException caller is not the booking's provider
     * @throws com.booking.lifecycle.error.ConflictException booking is no longer pending
     */
    public BookingActionResult accept(String bookingId, String providerId) {
        BookingAccess.requireProvider(bookingStore.get(bookingId), providerId);

        BookingEntity accepted = bookingStore.transition(bookingId, FROM_PENDING, BookingStatus.ACCEPTED,
                b -> b.setProviderResponseDeadline(null));
        log.info("Booking accepted: bookingId={}, providerId={}", bookingId, providerId);
        eventProducer.publishStatusChanged(accepted, BookingStatus.PENDING);

        long deposit = accepted.getDepositAmount();
        if (deposit == 0) {
            return BookingActionResult.of(accepted, PaymentOutcome.NONE);
        }

        CaptureRequest request = CaptureRequest.builder()
                .idempotencyKey(IdempotencyKeys.depositCapture(bookingId))
                .paymentIntentId(accepted.getPaymentIntentId())
                .amount(deposit)
                .expectedCapturedTotal(deposit)
                .bookingId(bookingId)
                .build();
        GatewayOutcome<CaptureResult> outcome = gatewayClient.capture(request);

        if (outcome.isSuccess()) {
            BookingEntity captured = bookingStore.update(bookingId, b -> {
                b.setCapturedDeposit(deposit);
                b.setRemainingToCapture(b.getTotalAmount() - deposit);
                b.setPaymentStatus(PaymentStatus.DEPOSIT_CAPTURED);
                b.setDepositCapturedAt(clock.instant());
                b.setPaymentFailureDetail(null);
            });
            log.info("Deposit captured: bookingId={}, amount={}, replayed={}",
                    bookingId, deposit, outcome.getValue().isReplayed());
            eventProducer.publishPaymentUpdated(captured, PaymentOutcome.DEPOSIT_CAPTURED);
            return BookingActionResult.of(captured, PaymentOutcome.DEPOSIT_CAPTURED);
        }

        BookingEntity flagged = bookingStore.update(bookingId, b -> {
            b.setPaymentStatus(PaymentStatus.CAPTURE_FAILED);
            b.setPaymentFailureDetail("Deposit capture failed: " + outcome.getError().describe());
        });
        log.error("Deposit capture failed: bookingId={}, amount={}, error={}",
                bookingId, deposit, outcome.getError().describe());
        eventProducer.publishPaymentUpdated(flagged, PaymentOutcome.CHARGE_FAILED);
        return BookingActionResult.failed(flagged, PaymentOutcome.CHARGE_FAILED, outcome.getError());
    }
}
