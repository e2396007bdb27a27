package com.booking.lifecycle.lifecycle;

import com.booking.lifecycle.adapters.MockPaymentGateway;
import com.booking.lifecycle.config.BookingProperties;
import com.booking.lifecycle.core.IdempotencyService;
import com.booking.lifecycle.core.PaymentGatewayClient;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.CaptureRequest;
import com.booking.lifecycle.domain.IntentSnapshot;
import com.booking.lifecycle.domain.IntentStatus;
import com.booking.lifecycle.domain.PaymentOutcome;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.error.ConflictException;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.support.FakeGatewayClients;
import com.booking.lifecycle.support.InMemoryBookingStore;
import com.booking.lifecycle.support.TestBookings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Whole booking journeys against the in-memory gateway, through the real gateway client with
 * its retries and reconciliation.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BookingLifecycleScenarioTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private BookingEventProducer eventProducer;

    private MockPaymentGateway gateway;
    private InMemoryBookingStore store;
    private BookingCreationService creation;
    private AcceptBookingHandler accept;
    private DeclineBookingHandler decline;
    private CompletionHandler completion;
    private CancellationHandler cancellation;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        BookingProperties properties = new BookingProperties();
        gateway = spy(new MockPaymentGateway(clock));
        PaymentGatewayClient client = FakeGatewayClients.client(gateway, idempotencyService, clock);
        store = new InMemoryBookingStore(clock);
        creation = new BookingCreationService(store, client, eventProducer, properties, clock);
        accept = new AcceptBookingHandler(store, client, eventProducer, clock);
        decline = new DeclineBookingHandler(store, new DepositRefundService(store, client, eventProducer),
                eventProducer, properties);
        completion = new CompletionHandler(store, client, eventProducer, clock);
        cancellation = new CancellationHandler(store, client, eventProducer, properties, clock);
    }

    private BookingEntity createBooking(String paymentMethod, String payoutAccount) {
        return creation.create(CreateBookingCommand.builder()
                .customerId(TestBookings.CUSTOMER)
                .providerId(TestBookings.PROVIDER)
                .serviceId("svc-cleaning")
                .providerAccountId(payoutAccount)
                .baseAmount(9700)
                .totalAmount(10000)
                .paymentMethodId(paymentMethod)
                .build());
    }

    @Test
    void happyPathCapturesInTwoStagesAndPaysProvider() {
        BookingEntity booking = createBooking("pm_card_visa", TestBookings.PROVIDER_ACCOUNT);

        accept.accept(booking.getId(), TestBookings.PROVIDER);
        BookingActionResult result = completion.complete(booking.getId(), TestBookings.PROVIDER);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.TRANSFER_COMPLETED);
        BookingEntity stored = store.get(booking.getId());
        assertThat(stored.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(stored.getCapturedDeposit()).isEqualTo(2000);
        assertThat(stored.getRemainingToCapture()).isZero();

        IntentSnapshot intent = gateway.retrieveIntent(booking.getPaymentIntentId());
        assertThat(intent.getCapturedAmount()).isEqualTo(10000);
        assertThat(intent.getStatus()).isEqualTo(IntentStatus.SUCCEEDED);
        assertThat(gateway.findTransfer(booking.getId()))
                .hasValueSatisfying(t -> assertThat(t.getAmount()).isEqualTo(9700));
    }

    @Test
    void declineAfterAcceptIsRejectedAndChargesNothingExtra() {
        BookingEntity booking = createBooking("pm_card_visa", TestBookings.PROVIDER_ACCOUNT);
        accept.accept(booking.getId(), TestBookings.PROVIDER);

        assertThatThrownBy(() -> decline.decline(booking.getId(), TestBookings.PROVIDER, "too late"))
                .isInstanceOf(ConflictException.class);

        assertThat(store.get(booking.getId()).getStatus()).isEqualTo(BookingStatus.ACCEPTED);
        verify(gateway, never()).refund(any());
        assertThat(gateway.retrieveIntent(booking.getPaymentIntentId()).getCapturedAmount()).isEqualTo(2000);
    }

    @Test
    void capturedTimeoutIsReconciledWithoutDoubleCharge() {
        BookingEntity booking = createBooking(MockPaymentGateway.CAPTURE_TIMEOUT_METHOD, TestBookings.PROVIDER_ACCOUNT);

        BookingActionResult result = accept.accept(booking.getId(), TestBookings.PROVIDER);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.DEPOSIT_CAPTURED);
        assertThat(store.get(booking.getId()).getPaymentStatus()).isEqualTo(PaymentStatus.DEPOSIT_CAPTURED);
        assertThat(gateway.retrieveIntent(booking.getPaymentIntentId()).getCapturedAmount()).isEqualTo(2000);
        verify(gateway, times(1)).capture(any());
    }

    @Test
    void refundAppliedDespiteTimeoutIsRecordedWithItsRefundId() {
        BookingEntity booking = createBooking(MockPaymentGateway.REFUND_TIMEOUT_METHOD, TestBookings.PROVIDER_ACCOUNT);
        gateway.capture(CaptureRequest.builder()
                .idempotencyKey("capture:deposit:" + booking.getId())
                .paymentIntentId(booking.getPaymentIntentId())
                .amount(2000)
                .expectedCapturedTotal(2000)
                .bookingId(booking.getId())
                .build());
        store.update(booking.getId(), b -> {
            b.setCapturedDeposit(2000);
            b.setRemainingToCapture(8000);
        });

        BookingActionResult result = decline.decline(booking.getId(), TestBookings.PROVIDER, null);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.REFUNDED);
        String gatewayRefundId = gateway.listRefunds(booking.getPaymentIntentId()).get(0).getRefundId();
        BookingEntity stored = store.get(booking.getId());
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(stored.getRefundId()).isEqualTo(gatewayRefundId);
        verify(gateway, times(1)).refund(any());
    }

    @Test
    void transferOutageLeavesCompletedBookingFlaggedForReconciliation() {
        BookingEntity booking = createBooking("pm_card_visa", MockPaymentGateway.UNAVAILABLE_ACCOUNT);
        accept.accept(booking.getId(), TestBookings.PROVIDER);

        BookingActionResult result = completion.complete(booking.getId(), TestBookings.PROVIDER);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.TRANSFER_FAILED);
        BookingEntity stored = store.get(booking.getId());
        assertThat(stored.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURE_FAILED);
        assertThat(stored.getRemainingToCapture()).isZero();
        verify(gateway, times(2)).transfer(any());
        assertThat(new BookingQueryService(store).findNeedingReconciliation())
                .extracting(BookingEntity::getId)
                .containsExactly(booking.getId());
    }

    @Test
    void cancellationKeepsDepositAndReleasesTheRest() {
        BookingEntity booking = createBooking("pm_card_visa", TestBookings.PROVIDER_ACCOUNT);
        accept.accept(booking.getId(), TestBookings.PROVIDER);

        BookingActionResult result = cancellation.cancel(booking.getId(), TestBookings.CUSTOMER, null);

        assertThat(result.getPaymentOutcome()).isEqualTo(PaymentOutcome.HOLD_RELEASED);
        IntentSnapshot intent = gateway.retrieveIntent(booking.getPaymentIntentId());
        assertThat(intent.getCapturedAmount()).isEqualTo(2000);
        assertThat(intent.getAuthorizedAmount()).isEqualTo(2000);
    }
}
