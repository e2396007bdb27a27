package com.booking.lifecycle.messaging;

import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Emitted to Kafka whenever a booking changes status or its payment side effect settles.
 * The notification service consumes these to tell customers and providers what happened.
 */
@Value
@Builder
@Jacksonized
public class BookingEvent {

    String eventId;
    String bookingId;
    /** BOOKING_CREATED, BOOKING_ACCEPTED, ..., or PAYMENT_UPDATED */
    String eventType;
    String customerId;
    String providerId;
    BookingStatus previousStatus;
    BookingStatus newStatus;
    PaymentStatus paymentStatus;
    /** Set on PAYMENT_UPDATED only. */
    PaymentOutcome paymentOutcome;
    Instant timestamp;
}
