package com.booking.lifecycle.scheduler;

import com.booking.lifecycle.config.BookingProperties;
import com.booking.lifecycle.config.EngineConfig;
import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.error.ConflictException;
import com.booking.lifecycle.lifecycle.DepositRefundService;
import com.booking.lifecycle.messaging.BookingEventProducer;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import com.booking.lifecycle.persistence.service.BookingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Expires pending bookings whose provider response deadline has passed. Runs on a fixed delay
 * and races provider responses through the store's conditional transition only: whoever
 * commits first wins and the loser sees a conflict. Refunds for expired bookings run on a
 * separate executor so the sweep never waits on the gateway.
 */
@Slf4j
@Component
public class DeadlineMonitor {

    private static final Set<BookingStatus> FROM_PENDING = EnumSet.of(BookingStatus.PENDING);

    private final BookingStore bookingStore;
    private final DepositRefundService depositRefundService;
    private final BookingEventProducer eventProducer;
    private final BookingProperties properties;
    private final TaskExecutor refundExecutor;
    private final Clock clock;

    public DeadlineMonitor(BookingStore bookingStore,
                           DepositRefundService depositRefundService,
                           BookingEventProducer eventProducer,
                           BookingProperties properties,
                           @Qualifier(EngineConfig.REFUND_EXECUTOR) TaskExecutor refundExecutor,
                           Clock clock) {
        this.bookingStore = bookingStore;
        this.depositRefundService = depositRefundService;
        this.eventProducer = eventProducer;
        this.properties = properties;
        this.refundExecutor = refundExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${booking.deadline-monitor.interval:60000}",
            initialDelayString = "${booking.deadline-monitor.interval:60000}")
    public void sweep() {
        if (!properties.getDeadlineMonitor().isEnabled()) {
            return;
        }
        try {
            int expired = expireOverdue();
            if (expired > 0) {
                log.info("Deadline sweep expired {} booking(s)", expired);
            }
        } catch (RuntimeException e) {
            log.error("Deadline sweep failed", e);
        }
    }

    /**
     * Expires every overdue pending booking, one batch at a time.
     *
     * @return number of bookings this call moved to EXPIRED
     */
    public int expireOverdue() {
        Instant now = clock.instant();
        int batchSize = properties.getDeadlineMonitor().getBatchSize();
        int expired = 0;
        while (true) {
            List<BookingEntity> batch = bookingStore.findExpiredPending(now, batchSize);
            int expiredInBatch = 0;
            for (BookingEntity candidate : batch) {
                if (expire(candidate)) {
                    expiredInBatch++;
                }
            }
            expired += expiredInBatch;
            // a short batch was the last one; a batch with no progress would be fetched again unchanged
            if (batch.size() < batchSize || expiredInBatch == 0) {
                return expired;
            }
        }
    }

    private boolean expire(BookingEntity candidate) {
        String bookingId = candidate.getId();
        BookingEntity expired;
        try {
            expired = bookingStore.transition(bookingId, FROM_PENDING, BookingStatus.EXPIRED, b -> {
                b.setProviderResponseDeadline(null);
                b.setRemainingToCapture(0);
            });
        } catch (ConflictException e) {
            log.debug("Skipping expiry of bookingId={}: {}", bookingId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to expire bookingId={}", bookingId, e);
            return false;
        }

        log.info("Booking expired: bookingId={}, deadline={}", bookingId, candidate.getProviderResponseDeadline());
        eventProducer.publishStatusChanged(expired, BookingStatus.PENDING);
        if (expired.getCapturedDeposit() > 0) {
            submitRefund(expired);
        }
        return true;
    }

    private void submitRefund(BookingEntity expired) {
        Runnable refund = () -> {
            try {
                depositRefundService.refundCapturedDeposit(expired);
            } catch (RuntimeException e) {
                log.error("Refund after expiry failed for bookingId={}", expired.getId(), e);
            }
        };
        try {
            refundExecutor.execute(refund);
        } catch (TaskRejectedException e) {
            log.warn("Refund executor saturated, refunding bookingId={} on the sweep thread", expired.getId());
            refund.run();
        }
    }
}
