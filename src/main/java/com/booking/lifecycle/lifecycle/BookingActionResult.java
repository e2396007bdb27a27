package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.domain.GatewayError;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import lombok.Value;

/**
 * What a lifecycle operation did: the booking as stored afterwards, plus the payment side
 * effect. The status change always stands; {@code paymentError} is set when the side effect failed.
 */
@Value
public class BookingActionResult {

    BookingEntity booking;
    PaymentOutcome paymentOutcome;
    GatewayError paymentError;

    public static BookingActionResult of(BookingEntity booking, PaymentOutcome paymentOutcome) {
        return new BookingActionResult(booking, paymentOutcome, null);
    }

    public static BookingActionResult failed(BookingEntity booking, PaymentOutcome paymentOutcome, GatewayError error) {
        return new BookingActionResult(booking, paymentOutcome, error);
    }
}
