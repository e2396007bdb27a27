package com.booking.lifecycle.persistence.service;

import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.error.BookingNotFoundException;
import com.booking.lifecycle.error.ConflictException;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.persistence.repository.BookingRepository;
import com.booking.lifecycle.support.TestBookings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Conditional transitions against a real (H2) database. Runs without a test-managed transaction
 * so every store call commits on its own, as it does in production.
 */
@DataJpaTest
@Import(BookingStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class BookingStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private BookingStore bookingStore;

    @Autowired
    private BookingRepository bookingRepository;

    @AfterEach
    void cleanUp() {
        bookingRepository.deleteAll();
    }

    @Test
    void transitionCommitsAllowedEdgeAndAppliesMutation() {
        BookingEntity booking = bookingStore.insert(TestBookings.pending(NOW).build());

        BookingEntity accepted = bookingStore.transition(booking.getId(), EnumSet.of(BookingStatus.PENDING),
                BookingStatus.ACCEPTED, b -> b.setProviderResponseDeadline(null));

        assertThat(accepted.getStatus()).isEqualTo(BookingStatus.ACCEPTED);
        BookingEntity reloaded = bookingStore.get(booking.getId());
        assertThat(reloaded.getStatus()).isEqualTo(BookingStatus.ACCEPTED);
        assertThat(reloaded.getProviderResponseDeadline()).isNull();
        assertThat(reloaded.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void transitionFromWrongStatusThrowsConflictWithoutSideEffects() {
        BookingEntity booking = bookingStore.insert(TestBookings.accepted(NOW).build());

        assertThatThrownBy(() -> bookingStore.transition(booking.getId(), EnumSet.of(BookingStatus.PENDING),
                BookingStatus.DECLINED, b -> b.setDeclineReason("too late")))
                .isInstanceOf(ConflictException.class)
                .satisfies(e -> assertThat(((ConflictException) e).getCurrentStatus()).isEqualTo(BookingStatus.ACCEPTED));

        BookingEntity reloaded = bookingStore.get(booking.getId());
        assertThat(reloaded.getStatus()).isEqualTo(BookingStatus.ACCEPTED);
        assertThat(reloaded.getDeclineReason()).isNull();
    }

    @Test
    void terminalBookingCannotLeaveItsState() {
        BookingEntity booking = bookingStore.insert(TestBookings.pending(NOW).status(BookingStatus.EXPIRED).build());

        assertThatThrownBy(() -> bookingStore.transition(booking.getId(),
                EnumSet.allOf(BookingStatus.class), BookingStatus.ACCEPTED, null))
                .isInstanceOf(ConflictException.class);
        assertThat(bookingStore.get(booking.getId()).getStatus()).isEqualTo(BookingStatus.EXPIRED);
    }

    @Test
    void unknownBookingIsNotFound() {
        assertThatThrownBy(() -> bookingStore.get("missing")).isInstanceOf(BookingNotFoundException.class);
        assertThatThrownBy(() -> bookingStore.update("missing", b -> b.setRefundId("re_1")))
                .isInstanceOf(BookingNotFoundException.class);
    }

    @Test
    void updateRejectsInvariantViolationAndKeepsStoredRow() {
        BookingEntity booking = bookingStore.insert(TestBookings.accepted(NOW).build());

        assertThatThrownBy(() -> bookingStore.update(booking.getId(), b -> b.setRemainingToCapture(9000)))
                .isInstanceOf(IllegalStateException.class);

        assertThat(bookingStore.get(booking.getId()).getRemainingToCapture()).isEqualTo(8000);
    }

    @Test
    void updateCannotChangeStatus() {
        BookingEntity booking = bookingStore.insert(TestBookings.pending(NOW).build());

        assertThatThrownBy(() -> bookingStore.update(booking.getId(), b -> b.setStatus(BookingStatus.ACCEPTED)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(bookingStore.get(booking.getId()).getStatus()).isEqualTo(BookingStatus.PENDING);
    }

    @Test
    void acceptRacingExpiryHasExactlyOneWinner() throws Exception {
        BookingEntity booking = bookingStore.insert(TestBookings.pending(NOW).build());
        CountDownLatch acceptHasRead = new CountDownLatch(1);
        CountDownLatch expiryCommitted = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            // accept reads PENDING, then waits while expiry commits underneath it
            CompletableFuture<BookingEntity> accept = CompletableFuture.supplyAsync(() ->
                    bookingStore.transition(booking.getId(), EnumSet.of(BookingStatus.PENDING), BookingStatus.ACCEPTED, b -> {
                        acceptHasRead.countDown();
                        awaitQuietly(expiryCommitted);
                    }), executor);

            assertThat(acceptHasRead.await(5, TimeUnit.SECONDS)).isTrue();
            BookingEntity expired = bookingStore.transition(booking.getId(), EnumSet.of(BookingStatus.PENDING),
                    BookingStatus.EXPIRED, b -> b.setRemainingToCapture(0));
            expiryCommitted.countDown();

            assertThat(expired.getStatus()).isEqualTo(BookingStatus.EXPIRED);
            assertThatThrownBy(() -> accept.get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(ConflictException.class);
            assertThat(bookingStore.get(booking.getId()).getStatus()).isEqualTo(BookingStatus.EXPIRED);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void findExpiredPendingReturnsOnlyOverduePendingOldestFirst() {
        BookingEntity older = bookingStore.insert(TestBookings.pending(NOW).providerResponseDeadline(NOW.minusSeconds(600)).build());
        BookingEntity newer = bookingStore.insert(TestBookings.pending(NOW).providerResponseDeadline(NOW.minusSeconds(60)).build());
        bookingStore.insert(TestBookings.pending(NOW).providerResponseDeadline(NOW.plusSeconds(60)).build());
        bookingStore.insert(TestBookings.accepted(NOW).build());

        List<BookingEntity> overdue = bookingStore.findExpiredPending(NOW, 10);

        assertThat(overdue).extracting(BookingEntity::getId).containsExactly(older.getId(), newer.getId());
        assertThat(bookingStore.findExpiredPending(NOW, 1)).hasSize(1);
    }

    @Test
    void findByPaymentStatusListsFlaggedBookings() {
        BookingEntity flagged = bookingStore.insert(TestBookings.accepted(NOW).paymentStatus(PaymentStatus.CAPTURE_FAILED).build());
        bookingStore.insert(TestBookings.accepted(NOW).build());

        assertThat(bookingStore.findByPaymentStatus(PaymentStatus.CAPTURE_FAILED))
                .extracting(BookingEntity::getId).containsExactly(flagged.getId());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
