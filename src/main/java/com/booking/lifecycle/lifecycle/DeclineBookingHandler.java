package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.config.BookingProperties;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.persistence.service.BookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Provider declines a pending booking. Any captured deposit is refunded after the decline
 * has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeclineBookingHandler {

    public static final String DEFAULT_REASON = "Provider declined booking";

    private static final Set<BookingStatus> FROM_PENDING = EnumSet.of(BookingStatus.PENDING);

    private final BookingStore bookingStore;
    private final DepositRefundService depositRefundService;
    private final BookingEventProducer eventProducer;
    private final BookingProperties properties;

    public BookingActionResult decline(String bookingId, String providerId, String reason) {
        String normalized = BookingAccess.normalizeReason(reason, properties.getReasonMaxLength());
        String declineReason = normalized != null ? normalized : DEFAULT_REASON;
        BookingAccess.requireProvider(bookingStore.get(bookingId), providerId);

        BookingEntity declined = bookingStore.transition(bookingId, FROM_PENDING, BookingStatus.DECLINED, b -> {
            b.setDeclineReason(declineReason);
            b.setProviderResponseDeadline(null);
            b.setRemainingToCapture(0);
        });
        log.info("Booking declined: bookingId={}, providerId={}", bookingId, providerId);
        eventProducer.publishStatusChanged(declined, BookingStatus.PENDING);

        return depositRefundService.refundCapturedDeposit(declined);
    }
}
