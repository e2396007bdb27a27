package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.persistence.service.BookingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BookingQueryService {

    private final BookingStore bookingStore;

    /** Booking as seen by one of its parties. */
    public BookingEntity get(String bookingId, String callerId) {
        BookingEntity booking = bookingStore.get(bookingId);
        BookingAccess.requireParty(booking, callerId);
        return booking;
    }

    /** Bookings whose capture or payout failed and need operator follow-up. */
    public List<BookingEntity> findNeedingReconciliation() {
        return bookingStore.findByPaymentStatus(PaymentStatus.CAPTURE_FAILED);
    }
}
