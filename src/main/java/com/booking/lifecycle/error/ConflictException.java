package com.booking.lifecycle.error;

import com.booking.lifecycle.domain.BookingStatus;
import lombok.Getter;

/**
 * The booking's current status did not allow the requested transition: the race was lost
 * or the booking is already resolved. Callers should refetch, not treat it as a fault.
 */
@Getter
public class ConflictException extends BookingException {

    private final String bookingId;
    /** Status observed when the transition was rejected; null if it lost on commit. */
    private final BookingStatus currentStatus;
    private final BookingStatus requestedStatus;

    public ConflictException(String bookingId, BookingStatus currentStatus, BookingStatus requestedStatus) {
        super(ErrorCode.CONFLICT, currentStatus != null
                ? "Booking " + bookingId + " cannot move from " + currentStatus + " to " + requestedStatus
                : "Booking " + bookingId + " was modified concurrently; transition to " + requestedStatus + " lost");
        this.bookingId = bookingId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
