package com.booking.lifecycle.error;

public class BookingNotFoundException extends BookingException {

    public BookingNotFoundException(String bookingId) {
        super(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: " + bookingId);
    }
}
