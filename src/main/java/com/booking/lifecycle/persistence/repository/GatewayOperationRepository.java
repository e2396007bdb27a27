package com.booking.lifecycle.persistence.repository;

import com.booking.lifecycle.persistence.entity.GatewayOperationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GatewayOperationRepository extends JpaRepository<GatewayOperationEntity, String> {

    Optional<GatewayOperationEntity> findByIdempotencyKey(String idempotencyKey);
}
