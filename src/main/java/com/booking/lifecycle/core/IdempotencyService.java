package com.booking.lifecycle.core;

import com.booking.lifecycle.domain.GatewayOperationRecord;
import com.booking.lifecycle.persistence.entity.GatewayOperationEntity;
import com.booking.lifecycle.persistence.repository.GatewayOperationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Ledger of successful gateway calls keyed by idempotency key. A capture, refund or transfer
 * found here has already happened and must be served from the ledger, not sent again.
 * Redis answers the common case; the gateway_operations table is the durable copy.
 * Both lookups fail open: the gateway's own idempotency keys still prevent double charges.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private static final String KEY_PREFIX = "booking:gateway:idempotency:";
    private static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final RedisTemplate<String, GatewayOperationRecord> redisTemplate;
    private final GatewayOperationRepository operationRepository;

    public Optional<GatewayOperationRecord> getRecordedOperation(String idempotencyKey) {
        String key = KEY_PREFIX + idempotencyKey;
        try {
            GatewayOperationRecord cached = redisTemplate.opsForValue().get(key);
            if (cached != null) {
                log.debug("Idempotency hit in Redis for key={}", idempotencyKey);
                return Optional.of(cached);
            }
        } catch (Exception e) {
            log.warn("Idempotency cache read failed for key={}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
        }

        try {
            Optional<GatewayOperationEntity> entity = operationRepository.findByIdempotencyKey(idempotencyKey);
            if (entity.isPresent()) {
                GatewayOperationRecord record = toRecord(entity.get());
                log.debug("Idempotency hit in database for key={}, operation={}", idempotencyKey, record.getOperation());
                cache(record);
                return Optional.of(record);
            }
        } catch (Exception e) {
            log.error("Database idempotency check failed for key={}: {}", idempotencyKey, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Remembers a successful gateway call. The database row is written first; the Redis entry is
     * best effort.
     */
    public void record(GatewayOperationRecord record) {
        try {
            operationRepository.save(toEntity(record));
        } catch (Exception e) {
            log.error("Failed to persist gateway operation key={} operation={}: {}",
                    record.getIdempotencyKey(), record.getOperation(), e.getMessage());
        }
        cache(record);
    }

    private void cache(GatewayOperationRecord record) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + record.getIdempotencyKey(), record, DEFAULT_TTL);
            log.debug("Cached gateway operation key={}", record.getIdempotencyKey());
        } catch (Exception e) {
            log.warn("Failed to cache gateway operation in Redis for key={}: {}", record.getIdempotencyKey(), e.getMessage());
        }
    }

    private GatewayOperationRecord toRecord(GatewayOperationEntity entity) {
        return GatewayOperationRecord.builder()
                .idempotencyKey(entity.getIdempotencyKey())
                .operation(entity.getOperation())
                .bookingId(entity.getBookingId())
                .paymentIntentId(entity.getPaymentIntentId())
                .gatewayReference(entity.getGatewayReference())
                .amount(entity.getAmount())
                .destinationAccountId(entity.getDestinationAccountId())
                .timestamp(entity.getCreatedAt())
                .build();
    }

    private GatewayOperationEntity toEntity(GatewayOperationRecord record) {
        return GatewayOperationEntity.builder()
                .idempotencyKey(record.getIdempotencyKey())
                .operation(record.getOperation())
                .bookingId(record.getBookingId())
                .paymentIntentId(record.getPaymentIntentId())
                .gatewayReference(record.getGatewayReference())
                .amount(record.getAmount())
                .destinationAccountId(record.getDestinationAccountId())
                .createdAt(record.getTimestamp())
                .build();
    }
}
