package com.booking.lifecycle.persistence.repository;

import com.booking.lifecycle.domain.BookingStatus;
import com.booking.lifecycle.domain.PaymentStatus;
import com.booking.lifecycle.persistence.entity.BookingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<BookingEntity, String> {

    Optional<BookingEntity> findByRequestId(String requestId);

    @Query("SELECT b FROM BookingEntity b WHERE b.status = :status AND b.providerResponseDeadline < :now "
            + "ORDER BY b.providerResponseDeadline ASC")
    List<BookingEntity> findDeadlinePassed(@Param("status") BookingStatus status,
                                           @Param("now") Instant now,
                                           Pageable pageable);

    List<BookingEntity> findByPaymentStatus(PaymentStatus paymentStatus);
}
