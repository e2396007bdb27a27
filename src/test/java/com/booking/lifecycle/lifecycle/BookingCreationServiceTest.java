package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.config.BookingProperties;
import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.AuthorizationRequest;
import com.booking.lifecycle.domain.AuthorizationResult;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.GatewayError;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.error.GatewayUnavailableException;
import com.booking.lifecycle.error.PaymentDeclinedException;
import com.booking.lifecycle.error.ValidationException;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.support.InMemoryBookingStore;
import com.booking.lifecycle.support.TestBookings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingCreationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private BookingEventProducer eventProducer;

    private InMemoryBookingStore store;
    private BookingCreationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryBookingStore(clock);
        service = new BookingCreationService(store, gatewayClient, eventProducer, new BookingProperties(), clock);
    }

    private static CreateBookingCommand.CreateBookingCommandBuilder command() {
        return CreateBookingCommand.builder()
                .requestId("req-1")
                .customerId(TestBookings.CUSTOMER)
                .providerId(TestBookings.PROVIDER)
                .serviceId("svc-cleaning")
                .providerAccountId(TestBookings.PROVIDER_ACCOUNT)
                .baseAmount(9700)
                .totalAmount(10000)
                .paymentMethodId("pm_card_visa");
    }

    private void authorizationSucceeds() {
        when(gatewayClient.authorize(any())).thenReturn(GatewayOutcome.success(AuthorizationResult.builder()
                .paymentIntentId("pi_1").amount(10000).currencyCode("GBP").build()));
    }

    @Test
    void createAuthorizesTotalAndStoresPendingBooking() {
        authorizationSucceeds();

        BookingEntity booking = service.create(command().build());

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.getPaymentStatus()).isEqualTo(PaymentStatus.AUTHORIZED);
        assertThat(booking.getPaymentIntentId()).isEqualTo("pi_1");
        assertThat(booking.getDepositAmount()).isEqualTo(2000);
        assertThat(booking.getCapturedDeposit()).isZero();
        assertThat(booking.getRemainingToCapture()).isEqualTo(10000);
        assertThat(booking.getCurrencyCode()).isEqualTo("GBP");
        assertThat(booking.getProviderResponseDeadline()).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(store.get(booking.getId())).isNotNull();

        ArgumentCaptor<AuthorizationRequest> request = ArgumentCaptor.forClass(AuthorizationRequest.class);
        verify(gatewayClient).authorize(request.capture());
        assertThat(request.getValue().getAmount()).isEqualTo(10000);
        assertThat(request.getValue().getIdempotencyKey()).isEqualTo("authorize:req-1");
        verify(eventProducer).publishCreated(any());
    }

    @Test
    void repeatedRequestIdReturnsExistingBookingWithoutSecondHold() {
        authorizationSucceeds();

        BookingEntity first = service.create(command().build());
        BookingEntity second = service.create(command().build());

        assertThat(second.getId()).isEqualTo(first.getId());
        verify(gatewayClient, times(1)).authorize(any());
    }

    @Test
    void declinedAuthorizationCreatesNothing() {
        when(gatewayClient.authorize(any())).thenReturn(GatewayOutcome.failure(
                GatewayError.terminal("card_declined", "Insufficient funds")));

        assertThatThrownBy(() -> service.create(command().build()))
                .isInstanceOf(PaymentDeclinedException.class);
        assertThat(store.findByRequestId("req-1")).isEmpty();
        verify(eventProducer, never()).publishCreated(any());
    }

    @Test
    void unreachableGatewayIsReportedAsUnavailable() {
        when(gatewayClient.authorize(any())).thenReturn(GatewayOutcome.failure(GatewayError.timeout("no answer")));

        assertThatThrownBy(() -> service.create(command().build()))
                .isInstanceOf(GatewayUnavailableException.class);
        assertThat(store.findByRequestId("req-1")).isEmpty();
    }

    @Test
    void totalBelowBaseIsRejected() {
        assertThatThrownBy(() -> service.create(command().totalAmount(9000).build()))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void customerCannotBookThemselves() {
        assertThatThrownBy(() -> service.create(command().providerId(TestBookings.CUSTOMER).build()))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void depositPercentageOutOfRangeIsRejected() {
        assertThatThrownBy(() -> service.create(command().depositPercentage(101).build()))
                .isInstanceOf(ValidationException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "10000, 20, 2000",
            "999, 20, 200",
            "1002, 25, 251",
            "10000, 0, 0",
            "10000, 100, 10000"
    })
    void depositIsRoundedHalfUp(long total, int percentage, long expected) {
        assertThat(BookingCreationService.depositFor(total, percentage)).isEqualTo(expected);
    }
}
