package com.booking.lifecycle.compliance;

import com.booking.lifecycle.domain.GatewayError;
import com.booking.lifecycle.domain.GatewayOperationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail of money movements. Every gateway call the engine makes, and what came back,
 * lands here as a single [AUDIT] line that log shipping can route to long-term retention.
 */
@Slf4j
@Component
public class PaymentAuditLogger {

    public void logRequest(GatewayOperationType operation, String idempotencyKey, String bookingId, long amount) {
        log.info("[AUDIT] GATEWAY_REQUEST operation={} idempotencyKey={} bookingId={} amount={}",
                operation, idempotencyKey, bookingId, amount);
    }

    public void logSuccess(GatewayOperationType operation, String idempotencyKey, String bookingId,
                           String gatewayReference, boolean replayed) {
        log.info("[AUDIT] GATEWAY_SUCCESS operation={} idempotencyKey={} bookingId={} reference={} replayed={}",
                operation, idempotencyKey, bookingId, gatewayReference, replayed);
    }

    public void logFailure(GatewayOperationType operation, String idempotencyKey, String bookingId, GatewayError error) {
        log.warn("[AUDIT] GATEWAY_FAILURE operation={} idempotencyKey={} bookingId={} kind={} code={} message={}",
                operation, idempotencyKey, bookingId, error.getKind(), error.getCode(), error.getMessage());
    }
}
