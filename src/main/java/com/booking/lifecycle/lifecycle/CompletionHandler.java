package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.CaptureRequest;
import com.booking.lifecycle.domain.CaptureResult;
import com.booking.lifecycle.domain.GatewayError;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.domain.TransferRequest;
import com.booking.lifecycle.domain.TransferResult;
import com.booking.lifecycle.error.ValidationException;
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
 * Provider marks an accepted booking done. After the COMPLETED transition commits:
 * <ol>
 *   <li>the rest of the hold ({@code total - captured deposit}) is captured</li>
 *   <li>the provider's share ({@code total - platform fee}) is transferred to their account</li>
 * </ol>
 * Either step failing flags the booking CAPTURE_FAILED for reconciliation; the booking stays COMPLETED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionHandler {

    private static final Set<BookingStatus> FROM_ACCEPTED = EnumSet.of(BookingStatus.ACCEPTED);

    private final BookingStore bookingStore;
    private final PaymentGatewayClient gatewayClient;
    private final BookingEventProducer eventProducer;
    private final Clock clock;

    public BookingActionResult complete(String bookingId, String providerId) {
        BookingEntity current = bookingStore.get(bookingId);
        BookingAccess.requireProvider(current, providerId);
        if (current.getProviderAccountId() == null || current.getProviderAccountId().isBlank()) {
            throw new ValidationException("Provider has no payout account for booking " + bookingId);
        }

        BookingEntity completed = bookingStore.transition(bookingId, FROM_ACCEPTED, BookingStatus.COMPLETED,
                b -> b.setCompletedAt(clock.instant()));
        log.info("Booking completed: bookingId={}, providerId={}", bookingId, providerId);
        eventProducer.publishStatusChanged(completed, BookingStatus.ACCEPTED);

        long remaining = completed.getOutstandingAmount();
        if (remaining > 0) {
            CaptureRequest request = CaptureRequest.builder()
                    .idempotencyKey(IdempotencyKeys.remainingCapture(bookingId))
                    .paymentIntentId(completed.getPaymentIntentId())
                    .amount(remaining)
                    .expectedCapturedTotal(completed.getTotalAmount())
                    .bookingId(bookingId)
                    .build();
            GatewayOutcome<CaptureResult> capture = gatewayClient.capture(request);
            if (!capture.isSuccess()) {
                return fail(bookingId, PaymentOutcome.CHARGE_FAILED, "Remaining capture failed", capture.getError());
            }
            completed = bookingStore.update(bookingId, b -> {
                b.setRemainingToCapture(0);
                b.setRemainingCapturedAt(clock.instant());
            });
            log.info("Remaining amount captured: bookingId={}, amount={}", bookingId, remaining);
        }

        long payout = completed.getTotalAmount() - completed.getPlatformFee();
        TransferRequest transferRequest = TransferRequest.builder()
                .idempotencyKey(IdempotencyKeys.transfer(bookingId))
                .amount(payout)
                .currencyCode(completed.getCurrencyCode())
                .destinationAccountId(completed.getProviderAccountId())
                .transferGroup(bookingId)
                .sourcePaymentIntentId(completed.getPaymentIntentId())
                .build();
        GatewayOutcome<TransferResult> transfer = gatewayClient.transfer(transferRequest);
        if (!transfer.isSuccess()) {
            return fail(bookingId, PaymentOutcome.TRANSFER_FAILED, "Provider transfer failed", transfer.getError());
        }

        String transferId = transfer.getValue().getTransferId();
        BookingEntity paid = bookingStore.update(bookingId, b -> {
            b.setPaymentStatus(PaymentStatus.COMPLETED);
            b.setProviderTransferId(transferId);
            b.setProviderPaidAt(clock.instant());
            b.setPaymentFailureDetail(null);
        });
        log.info("Provider paid: bookingId={}, amount={}, platformFee={}, transferId={}",
                bookingId, payout, paid.getPlatformFee(), transferId);
        eventProducer.publishPaymentUpdated(paid, PaymentOutcome.TRANSFER_COMPLETED);
        return BookingActionResult.of(paid, PaymentOutcome.TRANSFER_COMPLETED);
    }

    private BookingActionResult fail(String bookingId, PaymentOutcome outcome, String step, GatewayError error) {
        BookingEntity flagged = bookingStore.update(bookingId, b -> {
            b.setPaymentStatus(PaymentStatus.CAPTURE_FAILED);
            b.setPaymentFailureDetail(step + ": " + error.describe());
        });
        log.error("{}: bookingId={}, error={}", step, bookingId, error.describe());
        eventProducer.publishPaymentUpdated(flagged, outcome);
        return BookingActionResult.failed(flagged, outcome, error);
    }
}
