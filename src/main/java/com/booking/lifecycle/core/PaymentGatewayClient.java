package com.booking.lifecycle.core;

import com.booking.lifecycle.compliance.PaymentAuditLogger;
import com.booking.lifecycle.config.BookingProperties;
import com.booking.lifecycle.config.EngineConfig;
import com.booking.lifecycle.domain.AuthorizationRequest;
import com.booking.lifecycle.domain.AuthorizationResult;
import com.booking.lifecycle.domain.CaptureRequest;
import com.booking.lifecycle.domain.CaptureResult;
import com.booking.lifecycle.domain.GatewayError;
import com.booking.lifecycle.domain.GatewayErrorKind;
import com.booking.lifecycle.domain.GatewayOperationRecord;
import com.booking.lifecycle.domain.GatewayOperationType;
import com.booking.lifecycle.domain.GatewayOutcome;
import com.booking.lifecycle.domain.IntentSnapshot;
import com.booking.lifecycle.domain.IntentStatus;
import com.booking.lifecycle.domain.RefundRequest;
import com.booking.lifecycle.domain.RefundResult;
import com.booking.lifecycle.domain.ReleaseResult;
import com.booking.lifecycle.domain.TransferRequest;
import com.booking.lifecycle.domain.TransferResult;
import com.booking.lifecycle.error.GatewayException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The engine's only way to move money. Wraps a {@link PaymentGateway} with:
 * <ul>
 *   <li>an idempotency ledger: a key that already succeeded is answered from the ledger</li>
 *   <li>per-operation Resilience4j retry (retryable errors only) inside a shared circuit breaker</li>
 *   <li>reconciliation: after a timeout or an "already processed" answer the gateway is asked
 *       what actually happened before the call is repeated or reported as failed</li>
 * </ul>
 * Failures come back as {@link GatewayOutcome} values; nothing here throws for a payment failure.
 */
@Slf4j
@Service
public class PaymentGatewayClient {

    public static final String CIRCUIT_BREAKER = "payment-gateway";
    public static final String AUTHORIZE_RETRY = "gateway-authorize";
    public static final String CAPTURE_RETRY = "gateway-capture";
    public static final String REFUND_RETRY = "gateway-refund";
    public static final String TRANSFER_RETRY = "gateway-transfer";

    private final PaymentGateway gateway;
    private final IdempotencyService idempotencyService;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final PaymentAuditLogger auditLogger;
    private final AsyncTaskExecutor gatewayCallExecutor;
    private final Duration callTimeout;
    private final Clock clock;

    public PaymentGatewayClient(PaymentGateway gateway,
                                IdempotencyService idempotencyService,
                                CircuitBreakerRegistry circuitBreakerRegistry,
                                RetryRegistry retryRegistry,
                                PaymentAuditLogger auditLogger,
                                @Qualifier(EngineConfig.GATEWAY_EXECUTOR) AsyncTaskExecutor gatewayCallExecutor,
                                BookingProperties properties,
                                Clock clock) {
        this.gateway = gateway;
        this.idempotencyService = idempotencyService;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
        this.auditLogger = auditLogger;
        this.gatewayCallExecutor = gatewayCallExecutor;
        this.callTimeout = properties.getGateway().getTimeout();
        this.clock = clock;
    }

    public GatewayOutcome<AuthorizationResult> authorize(AuthorizationRequest request) {
        return execute(GatewayOperationType.AUTHORIZE, request.getIdempotencyKey(), null, request.getAmount(),
                AUTHORIZE_RETRY,
                () -> bounded(() -> gateway.authorize(request)),
                record -> AuthorizationResult.builder()
                        .idempotencyKey(record.getIdempotencyKey())
                        .paymentIntentId(record.getPaymentIntentId())
                        .amount(record.getAmount())
                        .currencyCode(request.getCurrencyCode())
                        .timestamp(record.getTimestamp())
                        .build(),
                result -> GatewayOperationRecord.builder()
                        .paymentIntentId(result.getPaymentIntentId())
                        .gatewayReference(result.getPaymentIntentId())
                        .amount(result.getAmount()));
    }

    /**
     * Captures {@code request.amount}. A timed-out or "already captured" attempt counts as done
     * when the intent shows at least {@code request.expectedCapturedTotal} captured.
     */
    public GatewayOutcome<CaptureResult> capture(CaptureRequest request) {
        return execute(GatewayOperationType.CAPTURE, request.getIdempotencyKey(), request.getBookingId(),
                request.getAmount(), CAPTURE_RETRY,
                () -> {
                    try {
                        return bounded(() -> gateway.capture(request));
                    } catch (GatewayException e) {
                        if (!needsReconciliation(e.getError())) {
                            throw e;
                        }
                        return confirmCapture(request).orElseThrow(() -> e);
                    }
                },
                record -> CaptureResult.builder()
                        .idempotencyKey(record.getIdempotencyKey())
                        .paymentIntentId(record.getPaymentIntentId())
                        .captureId(record.getGatewayReference())
                        .capturedAmount(record.getAmount())
                        .replayed(true)
                        .timestamp(record.getTimestamp())
                        .build(),
                result -> GatewayOperationRecord.builder()
                        .paymentIntentId(result.getPaymentIntentId())
                        .gatewayReference(result.getCaptureId())
                        .amount(result.getCapturedAmount()));
    }

    public GatewayOutcome<RefundResult> refund(RefundRequest request) {
        return execute(GatewayOperationType.REFUND, request.getIdempotencyKey(), request.getBookingId(),
                request.getAmount(), REFUND_RETRY,
                () -> {
                    try {
                        return bounded(() -> gateway.refund(request));
                    } catch (GatewayException e) {
                        if (!needsReconciliation(e.getError())) {
                            throw e;
                        }
                        return confirmRefund(request).orElseThrow(() -> e);
                    }
                },
                record -> RefundResult.builder()
                        .idempotencyKey(record.getIdempotencyKey())
                        .paymentIntentId(record.getPaymentIntentId())
                        .refundId(record.getGatewayReference())
                        .amount(record.getAmount())
                        .replayed(true)
                        .timestamp(record.getTimestamp())
                        .build(),
                result -> GatewayOperationRecord.builder()
                        .paymentIntentId(result.getPaymentIntentId())
                        .gatewayReference(result.getRefundId())
                        .amount(result.getAmount()));
    }

    /**
     * Pays the provider. After a timeout the transfer group is searched before another attempt,
     * so a transfer that went through is never made twice.
     */
    public GatewayOutcome<TransferResult> transfer(TransferRequest request) {
        return execute(GatewayOperationType.TRANSFER, request.getIdempotencyKey(), request.getTransferGroup(),
                request.getAmount(), TRANSFER_RETRY,
                () -> {
                    try {
                        return bounded(() -> gateway.transfer(request));
                    } catch (GatewayException e) {
                        if (!needsReconciliation(e.getError())) {
                            throw e;
                        }
                        return confirmTransfer(request).orElseThrow(() -> e);
                    }
                },
                record -> TransferResult.builder()
                        .idempotencyKey(record.getIdempotencyKey())
                        .transferId(record.getGatewayReference())
                        .amount(record.getAmount())
                        .destinationAccountId(record.getDestinationAccountId())
                        .transferGroup(record.getBookingId())
                        .replayed(true)
                        .timestamp(record.getTimestamp())
                        .build(),
                result -> GatewayOperationRecord.builder()
                        .paymentIntentId(request.getSourcePaymentIntentId())
                        .gatewayReference(result.getTransferId())
                        .amount(result.getAmount())
                        .destinationAccountId(result.getDestinationAccountId()));
    }

    /** Releases the uncaptured remainder of the hold. Shares the refund retry policy. */
    public GatewayOutcome<ReleaseResult> release(String bookingId, String paymentIntentId, String idempotencyKey) {
        return execute(GatewayOperationType.RELEASE, idempotencyKey, bookingId, 0L, REFUND_RETRY,
                () -> {
                    try {
                        return bounded(() -> gateway.release(paymentIntentId, idempotencyKey));
                    } catch (GatewayException e) {
                        if (!needsReconciliation(e.getError())) {
                            throw e;
                        }
                        return confirmRelease(paymentIntentId, idempotencyKey).orElseThrow(() -> e);
                    }
                },
                record -> ReleaseResult.builder()
                        .idempotencyKey(record.getIdempotencyKey())
                        .paymentIntentId(record.getPaymentIntentId())
                        .releasedAmount(record.getAmount())
                        .replayed(true)
                        .timestamp(record.getTimestamp())
                        .build(),
                result -> GatewayOperationRecord.builder()
                        .paymentIntentId(result.getPaymentIntentId())
                        .gatewayReference(result.getPaymentIntentId())
                        .amount(result.getReleasedAmount()));
    }

    private <T> GatewayOutcome<T> execute(GatewayOperationType operation, String idempotencyKey, String bookingId,
                                          long amount, String retryName, Supplier<T> attempt,
                                          Function<GatewayOperationRecord, T> replay,
                                          Function<T, GatewayOperationRecord.GatewayOperationRecordBuilder> toRecord) {
        Optional<GatewayOperationRecord> recorded = idempotencyService.getRecordedOperation(idempotencyKey);
        if (recorded.isPresent()) {
            GatewayOperationRecord record = recorded.get();
            if (record.getOperation() != operation) {
                log.error("Idempotency key reused across operations: key={}, recorded={}, requested={}",
                        idempotencyKey, record.getOperation(), operation);
                GatewayError error = GatewayError.terminal("idempotency_key_reused",
                        "Key " + idempotencyKey + " already used for " + record.getOperation());
                auditLogger.logFailure(operation, idempotencyKey, bookingId, error);
                return GatewayOutcome.failure(error);
            }
            log.info("Serving {} from idempotency ledger: key={}, reference={}",
                    operation, idempotencyKey, record.getGatewayReference());
            auditLogger.logSuccess(operation, idempotencyKey, bookingId, record.getGatewayReference(), true);
            return GatewayOutcome.success(replay.apply(record));
        }

        auditLogger.logRequest(operation, idempotencyKey, bookingId, amount);
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        Retry retry = retryRegistry.retry(retryName);
        Supplier<T> withRetry = Retry.decorateSupplier(retry, attempt);
        Supplier<T> withCircuitBreaker = CircuitBreaker.decorateSupplier(circuitBreaker, withRetry);

        GatewayError error;
        try {
            T result = withCircuitBreaker.get();
            GatewayOperationRecord record = toRecord.apply(result)
                    .idempotencyKey(idempotencyKey)
                    .operation(operation)
                    .bookingId(bookingId)
                    .timestamp(clock.instant())
                    .build();
            idempotencyService.record(record);
            auditLogger.logSuccess(operation, idempotencyKey, bookingId, record.getGatewayReference(), false);
            return GatewayOutcome.success(result);
        } catch (GatewayException e) {
            error = e.getError();
        } catch (CallNotPermittedException e) {
            error = GatewayError.transientError("circuit_open", "Payment gateway circuit breaker is open");
        } catch (RuntimeException e) {
            log.error("Unexpected failure calling {} for key={}", gateway.getGatewayName(), idempotencyKey, e);
            error = GatewayError.transientError("gateway_error", String.valueOf(e.getMessage()));
        }
        log.warn("Gateway {} failed: key={}, bookingId={}, error={}", operation, idempotencyKey, bookingId, error.describe());
        auditLogger.logFailure(operation, idempotencyKey, bookingId, error);
        return GatewayOutcome.failure(error);
    }

    /**
     * Runs one gateway call with the configured timeout. A call that does not answer in time is
     * reported as a TIMEOUT: it may still have been applied. Its worker thread is interrupted.
     * A full call pool is a retryable failure; nothing reached the gateway.
     */
    private <T> T bounded(Supplier<T> call) {
        Callable<T> task = call::get;
        Future<T> future;
        try {
            future = gatewayCallExecutor.submit(task);
        } catch (RejectedExecutionException e) {
            log.warn("Gateway call pool saturated, rejecting call: {}", e.getMessage());
            throw new GatewayException(GatewayError.transientError("gateway_busy",
                    "No free gateway call thread: " + e.getMessage()), e);
        }
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GatewayException(GatewayError.timeout("No gateway response within " + callTimeout), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GatewayException(GatewayError.timeout("Interrupted waiting for gateway"), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new GatewayException(GatewayError.transientError("gateway_error", String.valueOf(e.getCause())), e);
        }
    }

    private boolean needsReconciliation(GatewayError error) {
        return error.isOutcomeUnknown() || error.getKind() == GatewayErrorKind.ALREADY_PROCESSED;
    }

    private Optional<CaptureResult> confirmCapture(CaptureRequest request) {
        return lookupIntent(request.getPaymentIntentId())
                .filter(intent -> intent.getCapturedAmount() >= request.getExpectedCapturedTotal())
                .map(intent -> {
                    log.info("Capture confirmed by intent lookup: key={}, intentId={}, captured={}",
                            request.getIdempotencyKey(), intent.getPaymentIntentId(), intent.getCapturedAmount());
                    return CaptureResult.builder()
                            .idempotencyKey(request.getIdempotencyKey())
                            .paymentIntentId(request.getPaymentIntentId())
                            .captureId(intent.getLatestCaptureId())
                            .capturedAmount(request.getAmount())
                            .replayed(true)
                            .timestamp(clock.instant())
                            .build();
                });
    }

    /**
     * Looks for the refund among those made on the intent: the one carrying our key, else one of
     * the requested amount.
     */
    private Optional<RefundResult> confirmRefund(RefundRequest request) {
        List<RefundResult> refunds;
        try {
            refunds = bounded(() -> gateway.listRefunds(request.getPaymentIntentId()));
        } catch (GatewayException e) {
            log.warn("Refund lookup failed for intentId={}: {}", request.getPaymentIntentId(), e.getError().describe());
            return Optional.empty();
        }
        Optional<RefundResult> match = refunds.stream()
                .filter(refund -> request.getIdempotencyKey().equals(refund.getIdempotencyKey()))
                .findFirst();
        if (match.isEmpty()) {
            match = refunds.stream()
                    .filter(refund -> refund.getIdempotencyKey() == null && refund.getAmount() == request.getAmount())
                    .findFirst();
        }
        return match.map(refund -> {
            log.info("Refund confirmed by refund lookup: key={}, intentId={}, refundId={}",
                    request.getIdempotencyKey(), request.getPaymentIntentId(), refund.getRefundId());
            return refund.toBuilder()
                    .idempotencyKey(request.getIdempotencyKey())
                    .paymentIntentId(request.getPaymentIntentId())
                    .replayed(true)
                    .build();
        });
    }

    private Optional<ReleaseResult> confirmRelease(String paymentIntentId, String idempotencyKey) {
        return lookupIntent(paymentIntentId)
                .filter(intent -> intent.getStatus() == IntentStatus.CANCELED)
                .map(intent -> ReleaseResult.builder()
                        .idempotencyKey(idempotencyKey)
                        .paymentIntentId(paymentIntentId)
                        .releasedAmount(intent.getAuthorizedAmount() - intent.getCapturedAmount())
                        .replayed(true)
                        .timestamp(clock.instant())
                        .build());
    }

    private Optional<TransferResult> confirmTransfer(TransferRequest request) {
        Optional<TransferResult> existing;
        try {
            existing = bounded(() -> gateway.findTransfer(request.getTransferGroup()));
        } catch (GatewayException e) {
            log.warn("Transfer lookup failed for group={}: {}", request.getTransferGroup(), e.getError().describe());
            return Optional.empty();
        }
        return existing
                .filter(transfer -> transfer.getAmount() == request.getAmount()
                        && request.getDestinationAccountId().equals(transfer.getDestinationAccountId()))
                .map(transfer -> {
                    log.info("Transfer confirmed by group lookup: key={}, group={}, transferId={}",
                            request.getIdempotencyKey(), request.getTransferGroup(), transfer.getTransferId());
                    return transfer.toBuilder()
                            .idempotencyKey(request.getIdempotencyKey())
                            .replayed(true)
                            .build();
                });
    }

    private Optional<IntentSnapshot> lookupIntent(String paymentIntentId) {
        try {
            return Optional.ofNullable(bounded(() -> gateway.retrieveIntent(paymentIntentId)));
        } catch (GatewayException e) {
            log.warn("Intent lookup failed for intentId={}: {}", paymentIntentId, e.getError().describe());
            return Optional.empty();
        }
    }
}
