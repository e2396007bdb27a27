package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.config.BookingProperties;
import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.domain.ReleaseResult;
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
 * Customer or provider cancels an accepted booking. The captured deposit is kept; only the
 * uncaptured part of the hold is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CancellationHandler {

    private static final Set<BookingStatus> FROM_ACCEPTED = EnumSet.of(BookingStatus.ACCEPTED);

    private final BookingStore bookingStore;
    private final PaymentGatewayClient gatewayClient;
    private final BookingEventProducer eventProducer;
    private final BookingProperties properties;
    private final Clock clock;

    public BookingActionResult cancel(String bookingId, String callerId, String reason) {
        String cancellationReason = BookingAccess.normalizeReason(reason, properties.getReasonMaxLength());
        BookingAccess.requireParty(bookingStore.get(bookingId), callerId);

        BookingEntity cancelled = bookingStore.transition(bookingId, FROM_ACCEPTED, BookingStatus.CANCELLED, b -> {
            b.setCancelledAt(clock.instant());
            b.setCancellationReason(cancellationReason);
            b.setRemainingToCapture(0);
        });
        log.info("Booking cancelled: bookingId={}, by={}", bookingId, callerId);
        eventProducer.publishStatusChanged(cancelled, BookingStatus.ACCEPTED);

        GatewayOutcome<ReleaseResult> outcome = gatewayClient.release(bookingId, cancelled.getPaymentIntentId(),
                IdempotencyKeys.release(bookingId));
        if (outcome.isSuccess()) {
            log.info("Hold released: bookingId={}, amount={}", bookingId, outcome.getValue().getReleasedAmount());
            return BookingActionResult.of(cancelled, PaymentOutcome.HOLD_RELEASED);
        }

        BookingEntity flagged = bookingStore.update(bookingId,
                b -> b.setPaymentFailureDetail("Hold release failed: " + outcome.getError().describe()));
        log.error("Hold release failed: bookingId={}, error={}", bookingId, outcome.getError().describe());
        eventProducer.publishPaymentUpdated(flagged, PaymentOutcome.RELEASE_FAILED);
        return BookingActionResult.failed(flagged, PaymentOutcome.RELEASE_FAILED, outcome.getError());
    }
}
