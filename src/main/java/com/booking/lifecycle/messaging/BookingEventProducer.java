package com.booking.lifecycle.messaging;

import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes booking lifecycle events keyed by booking id, so every event of one booking lands
 * on the same partition in order. Fire and forget: a failed publish is logged and never
 * undoes the state change it describes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventProducer {

    public static final String BOOKING_CREATED = "BOOKING_CREATED";
    public static final String PAYMENT_UPDATED = "PAYMENT_UPDATED";

    private final KafkaTemplate<String, BookingEvent> kafkaTemplate;
    private final Clock clock;

    @Value("${booking.kafka.topic.booking-events:booking-events}")
    private String topic;

    public void publishCreated(BookingEntity booking) {
        send(baseEvent(booking, BOOKING_CREATED).newStatus(booking.getStatus()).build());
    }

    /** Status change of {@code booking}, which already holds the new status. */
    public void publishStatusChanged(BookingEntity booking, BookingStatus previousStatus) {
        send(baseEvent(booking, "BOOKING_" + booking.getStatus().name())
                .previousStatus(previousStatus)
                .newStatus(booking.getStatus())
                .build());
    }

    public void publishPaymentUpdated(BookingEntity booking, PaymentOutcome outcome) {
        send(baseEvent(booking, PAYMENT_UPDATED)
                .newStatus(booking.getStatus())
                .paymentOutcome(outcome)
                .build());
    }

    private BookingEvent.BookingEventBuilder baseEvent(BookingEntity booking, String eventType) {
        return BookingEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .bookingId(booking.getId())
                .eventType(eventType)
                .customerId(booking.getCustomerId())
                .providerId(booking.getProviderId())
                .paymentStatus(booking.getPaymentStatus())
                .timestamp(clock.instant());
    }

    private void send(BookingEvent event) {
        log.info("Publishing booking event: bookingId={}, eventId={}, eventType={}, status={}, paymentStatus={}",
                event.getBookingId(), event.getEventId(), event.getEventType(), event.getNewStatus(), event.getPaymentStatus());
        CompletableFuture<SendResult<String, BookingEvent>> future;
        try {
            future = kafkaTemplate.send(topic, event.getBookingId(), event);
        } catch (RuntimeException e) {
            log.error("Failed to publish booking event bookingId={} eventId={}", event.getBookingId(), event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish booking event bookingId={} eventId={}", event.getBookingId(), event.getEventId(), ex);
            } else {
                log.debug("Published booking event: bookingId={}, eventId={}, partition={}, offset={}",
                        event.getBookingId(), event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
