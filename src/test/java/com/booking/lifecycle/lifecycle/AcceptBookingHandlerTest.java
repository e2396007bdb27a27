package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.CaptureRequest;
import com.booking.lifecycle.domain.CaptureResult;
import com.booking.lifecycle.domain.GatewayError;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.error.ConflictException;
import com.booking.lifecycle.error.ForbiddenException;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.support.InMemoryBookingStore;
import com.booking.lifecycle.support.TestBookings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AcceptBookingHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private BookingEventProducer eventProducer;

    private InMemoryBookingStore store;
    private AcceptBookingHandler handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryBookingStore(clock);
        handler = new AcceptBookingHandler(store, gatewayClient, eventProducer, clock);
    }

    @Test
    void acceptCapturesDepositWithDeterministicKey() {
        BookingEntity booking = store.put(TestBookings.pending(NOW).build());
        when(gatewayClient.capture(any())).thenReturn(GatewayOutcome.success(CaptureResult.builder()
                .captureId("ch_1").capturedAmount(2000).paymentIntentId(booking.getPaymentIntentId()).build()));

        BookingActionResult result = handler.accept(booking.getId(), TestBookings.PROVIDER);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.DEPOSIT_CAPTURED);
        BookingEntity stored = store.get(booking.getId());
        assertThat(stored.getStatus()).isEqualTo(BookingStatus.ACCEPTED);
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.DEPOSIT_CAPTURED);
        assertThat(stored.getCapturedDeposit()).isEqualTo(2000);
        assertThat(stored.getRemainingToCapture()).isEqualTo(8000);
        assertThat(stored.getProviderResponseDeadline()).isNull();
        assertThat(stored.getDepositCapturedAt()).isEqualTo(NOW);

        ArgumentCaptor<CaptureRequest> request = ArgumentCaptor.forClass(CaptureRequest.class);
        verify(gatewayClient).capture(request.capture());
        assertThat(request.getValue().getIdempotencyKey()).isEqualTo("capture:deposit:" + booking.getId());
        assertThat(request.getValue().getAmount()).isEqualTo(2000);
        assertThat(request.getValue().getPaymentIntentId()).isEqualTo(booking.getPaymentIntentId());
        verify(eventProducer).publishStatusChanged(any(), eq(BookingStatus.PENDING));
        verify(eventProducer).publishPaymentUpdated(any(), eq(PaymentOutcome.DEPOSIT_CAPTURED));
    }

    @Test
    void failedCaptureLeavesBookingAcceptedAndFlagged() {
        BookingEntity booking = store.put(TestBookings.pending(NOW).build());
        GatewayError declined = GatewayError.terminal("card_declined", "Insufficient funds");
        when(gatewayClient.capture(any())).thenReturn(GatewayOutcome.failure(declined));

        BookingActionResult result = handler.accept(booking.getId(), TestBookings.PROVIDER);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.CHARGE_FAILED);
        assertThat(result.getPaymentError()).isEqualTo(declined);
        BookingEntity stored = store.get(booking.getId());
        assertThat(stored.getStatus()).isEqualTo(BookingStatus.ACCEPTED);
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURE_FAILED);
        assertThat(stored.getCapturedDeposit()).isZero();
        assertThat(stored.getPaymentFailureDetail()).contains("card_declined");
    }

    @Test
    void zeroDepositAcceptsWithoutGatewayCall() {
        BookingEntity booking = store.put(TestBookings.pending(NOW).depositAmount(0).build());

        BookingActionResult result = handler.accept(booking.getId(), TestBookings.PROVIDER);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.NONE);
        assertThat(store.get(booking.getId()).getStatus()).isEqualTo(BookingStatus.ACCEPTED);
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void onlyAssignedProviderMayAccept() {
        BookingEntity booking = store.put(TestBookings.pending(NOW).build());

        assertThatThrownBy(() -> handler.accept(booking.getId(), TestBookings.CUSTOMER))
                .isInstanceOf(ForbiddenException.class);
        assertThat(store.get(booking.getId()).getStatus()).isEqualTo(BookingStatus.PENDING);
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void acceptingExpiredBookingConflictsWithoutCharging() {
        BookingEntity booking = store.put(TestBookings.pending(NOW).status(BookingStatus.EXPIRED).build());

        assertThatThrownBy(() -> handler.accept(booking.getId(), TestBookings.PROVIDER))
                .isInstanceOf(ConflictException.class);
        verify(gatewayClient, never()).capture(any());
        verifyNoInteractions(eventProducer);
    }
}
