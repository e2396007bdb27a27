package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.config.BookingProperties;
import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.AuthorizationRequest;
import com.booking.lifecycle.domain.AuthorizationResult;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.error.GatewayUnavailableException;
import com.booking.lifecycle.error.PaymentDeclinedException;
import com.booking.lifecycle.error.ValidationException;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.persistence.service.BookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates a pending booking: validates pricing, places the authorization hold for the total,
 * then stores the booking with its provider response deadline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingCreationService {

    private final BookingStore bookingStore;
    private final PaymentGatewayClient gatewayClient;
    private final BookingEventProducer eventProducer;
    private final BookingProperties properties;
    private final Clock clock;

    public BookingEntity create(CreateBookingCommand command) {
        validate(command);
        String requestId = command.getRequestId() != null ? command.getRequestId() : UUID.randomUUID().toString();

        Optional<BookingEntity> existing = bookingStore.findByRequestId(requestId);
        if (existing.isPresent()) {
            log.info("Create request replayed: requestId={}, bookingId={}", requestId, existing.get().getId());
            return existing.get();
        }

        int percentage = command.getDepositPercentage() != null
                ? command.getDepositPercentage()
                : properties.getDeposit().getDefaultPercentage();
        long deposit = depositFor(command.getTotalAmount(), percentage);
        String currency = command.getCurrencyCode() != null ? command.getCurrencyCode() : properties.getDefaultCurrency();

        AuthorizationRequest authorization = AuthorizationRequest.builder()
                .idempotencyKey(IdempotencyKeys.authorize(requestId))
                .amount(command.getTotalAmount())
                .currencyCode(currency)
                .paymentMethodId(command.getPaymentMethodId())
                .customerId(command.getCustomerId())
                .build();
        GatewayOutcome<AuthorizationResult> outcome = gatewayClient.authorize(authorization);
        if (!outcome.isSuccess()) {
            log.warn("Authorization failed for requestId={}: {}", requestId, outcome.getError().describe());
            if (outcome.getError().isRetryable()) {
                throw new GatewayUnavailableException(outcome.getError());
            }
            throw new PaymentDeclinedException(outcome.getError());
        }

        Instant now = clock.instant();
        BookingEntity booking = BookingEntity.builder()
                .id(UUID.randomUUID().toString())
                .requestId(requestId)
                .customerId(command.getCustomerId())
                .providerId(command.getProviderId())
                .serviceId(command.getServiceId())
                .providerAccountId(command.getProviderAccountId())
                .status(BookingStatus.PENDING)
                .baseAmount(command.getBaseAmount())
                .totalAmount(command.getTotalAmount())
                .currencyCode(currency)
                .depositAmount(deposit)
                .capturedDeposit(0)
                .remainingToCapture(command.getTotalAmount())
                .paymentIntentId(outcome.getValue().getPaymentIntentId())
                .providerResponseDeadline(now.plus(properties.getResponseWindow()))
                .paymentStatus(PaymentStatus.AUTHORIZED)
                .createdAt(now)
                .updatedAt(now)
                .build();

        BookingEntity saved;
        try {
            saved = bookingStore.insert(booking);
        } catch (DataIntegrityViolationException e) {
            // concurrent create with the same request id; the authorization was shared through its key
            return bookingStore.findByRequestId(requestId).orElseThrow(() -> e);
        }
        log.info("Booking created: bookingId={}, requestId={}, total={}, deposit={}, deadline={}",
                saved.getId(), requestId, saved.getTotalAmount(), deposit, saved.getProviderResponseDeadline());
        eventProducer.publishCreated(saved);
        return saved;
    }

    /** Deposit in minor units, rounded half up. */
    static long depositFor(long totalAmount, int percentage) {
        return (totalAmount * percentage + 50) / 100;
    }

    private void validate(CreateBookingCommand command) {
        requireText(command.getCustomerId(), "customerId");
        requireText(command.getProviderId(), "providerId");
        requireText(command.getServiceId(), "serviceId");
        requireText(command.getPaymentMethodId(), "paymentMethodId");
        if (command.getBaseAmount() <= 0) {
            throw new ValidationException("baseAmount must be positive");
        }
        if (command.getTotalAmount() < command.getBaseAmount()) {
            throw new ValidationException("totalAmount must be at least baseAmount");
        }
        Integer percentage = command.getDepositPercentage();
        if (percentage != null && (percentage < 0 || percentage > 100)) {
            throw new ValidationException("depositPercentage must be between 0 and 100");
        }
        if (command.getCustomerId().equals(command.getProviderId())) {
            throw new ValidationException("customerId and providerId must differ");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
