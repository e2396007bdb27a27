package com.booking.lifecycle.persistence.service;

import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.error.BookingNotFoundException;
import com.booking.lifecycle.error.ConflictException;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.persistence.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Durable booking state. {@link #transition} is the only way a booking's status changes and
 * the only coordination point between concurrent callers: it commits only if the row's status
 * is still one of the allowed source states, and the JPA version column makes the losing
 * writer of a race fail on commit. Each call runs in its own transaction so a transition is
 * already durable before any gateway call is made.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingStore {

    private static final int UPDATE_ATTEMPTS = 3;

    private final BookingRepository bookingRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public BookingEntity get(String id) {
        return bookingRepository.findById(id).orElseThrow(() -> new BookingNotFoundException(id));
    }

    public Optional<BookingEntity> findByRequestId(String requestId) {
        return bookingRepository.findByRequestId(requestId);
    }

    public BookingEntity insert(BookingEntity booking) {
        booking.checkInvariants();
        BookingEntity saved = transactionTemplate.execute(status -> bookingRepository.saveAndFlush(booking));
        log.info("Booking stored: bookingId={}, status={}, paymentStatus={}",
                saved.getId(), saved.getStatus(), saved.getPaymentStatus());
        return saved;
    }

    /**
     * Conditionally moves a booking to {@code to}. {@code mutate} runs on the current row before
     * the new status is set and is discarded if the transition is rejected.
     *
     * @throws ConflictException if the current status is not in {@code allowedFrom}, the edge is
     *                           not part of the lifecycle graph, or a concurrent writer won
     * @throws BookingNotFoundException if the id is unknown
     */
    public BookingEntity transition(String id, Set<BookingStatus> allowedFrom, BookingStatus to,
                                    Consumer<BookingEntity> mutate) {
        try {
            BookingEntity updated = transactionTemplate.execute(txStatus -> {
                BookingEntity booking = get(id);
                BookingStatus current = booking.getStatus();
                if (!allowedFrom.contains(current) || !current.canTransitionTo(to)) {
                    throw new ConflictException(id, current, to);
                }
                if (mutate != null) {
                    mutate.accept(booking);
                }
                booking.setStatus(to);
                booking.setUpdatedAt(clock.instant());
                booking.checkInvariants();
                return bookingRepository.saveAndFlush(booking);
            });
            log.info("Booking transitioned: bookingId={}, to={}", id, to);
            return updated;
        } catch (OptimisticLockingFailureException e) {
            log.info("Booking transition lost a concurrent update: bookingId={}, to={}", id, to);
            throw new ConflictException(id, null, to);
        }
    }

    /**
     * Applies payment bookkeeping to a booking without touching its status. Re-reads and
     * re-applies when another writer got in first.
     */
    public BookingEntity update(String id, Consumer<BookingEntity> mutate) {
        OptimisticLockingFailureException lastFailure = null;
        for (int attempt = 1; attempt <= UPDATE_ATTEMPTS; attempt++) {
            try {
                return transactionTemplate.execute(txStatus -> {
                    BookingEntity booking = get(id);
                    BookingStatus statusBefore = booking.getStatus();
                    mutate.accept(booking);
                    if (booking.getStatus() != statusBefore) {
                        throw new IllegalStateException("update() cannot change booking status; use transition()");
                    }
                    booking.setUpdatedAt(clock.instant());
                    booking.checkInvariants();
                    return bookingRepository.saveAndFlush(booking);
                });
            } catch (OptimisticLockingFailureException e) {
                lastFailure = e;
                log.warn("Concurrent modification updating bookingId={} (attempt {}/{})", id, attempt, UPDATE_ATTEMPTS);
            }
        }
        throw lastFailure;
    }

    public List<BookingEntity> findExpiredPending(Instant now, int limit) {
        return bookingRepository.findDeadlinePassed(BookingStatus.PENDING, now, PageRequest.of(0, limit));
    }

    public List<BookingEntity> findByPaymentStatus(PaymentStatus paymentStatus) {
        return bookingRepository.findByPaymentStatus(paymentStatus);
    }
}
