package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.config.BookingProperties;
import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.GatewayError;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.domain.ReleaseResult;
import com.booking.lifecycle.error.ConflictException;
import com.booking.lifecycle.error.ForbiddenException;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.support.InMemoryBookingStore;
import com.booking.lifecycle.support.TestBookings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CancellationHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private BookingEventProducer eventProducer;

    private InMemoryBookingStore store;
    private CancellationHandler handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryBookingStore(clock);
        handler = new CancellationHandler(store, gatewayClient, eventProducer, new BookingProperties(), clock);
    }

    @Test
    void customerCancelReleasesRemainingHoldAndKeepsDeposit() {
        BookingEntity booking = store.put(TestBookings.accepted(NOW).build());
        when(gatewayClient.release(eq(booking.getId()), eq(booking.getPaymentIntentId()), eq("release:" + booking.getId())))
                .thenReturn(GatewayOutcome.success(ReleaseResult.builder().releasedAmount(8000).build()));

        BookingActionResult result = handler.cancel(booking.getId(), TestBookings.CUSTOMER, "Plans changed");

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.HOLD_RELEASED);
        BookingEntity stored = store.get(booking.getId());
        assertThat(stored.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(stored.getCancellationReason()).isEqualTo("Plans changed");
        assertThat(stored.getCancelledAt()).isEqualTo(NOW);
        assertThat(stored.getCapturedDeposit()).isEqualTo(2000);
        assertThat(stored.getRemainingToCapture()).isZero();
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.DEPOSIT_CAPTURED);
        verify(eventProducer).publishStatusChanged(result.getBooking(), BookingStatus.ACCEPTED);
    }

    @Test
    void releaseFailureIsRecordedButCancellationStands() {
        BookingEntity booking = store.put(TestBookings.accepted(NOW).build());
        when(gatewayClient.release(anyString(), anyString(), anyString()))
                .thenReturn(GatewayOutcome.failure(GatewayError.transientError("api_error", "503")));

        BookingActionResult result = handler.cancel(booking.getId(), TestBookings.PROVIDER, null);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.RELEASE_FAILED);
        BookingEntity stored = store.get(booking.getId());
        assertThat(stored.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(stored.getPaymentFailureDetail()).startsWith("Hold release failed");
    }

    @Test
    void outsiderCannotCancel() {
        BookingEntity booking = store.put(TestBookings.accepted(NOW).build());

        assertThatThrownBy(() -> handler.cancel(booking.getId(), "someone-else", null))
                .isInstanceOf(ForbiddenException.class);
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void pendingBookingCannotBeCancelled() {
        BookingEntity booking = store.put(TestBookings.pending(NOW).build());

        assertThatThrownBy(() -> handler.cancel(booking.getId(), TestBookings.CUSTOMER, null))
                .isInstanceOf(ConflictException.class);
        verifyNoInteractions(gatewayClient);
    }
}
