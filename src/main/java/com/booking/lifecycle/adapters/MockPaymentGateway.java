package com.booking.lifecycle.adapters;

import com.booking.lifecycle.core.PaymentGateway;
import com.booking.lifecycle.domain.AuthorizationRequest;
import com.booking.lifecycle.domain.AuthorizationResult;
import com.booking.lifecycle.domain.CaptureRequest;
import com.booking.lifecycle.domain.CaptureResult;
import com.booking.lifecycle.domain.GatewayError;
import com.booking.lifecycle.domain.IntentSnapshot;
import com.booking.lifecycle.domain.IntentStatus;
import com.booking.lifecycle.domain.RefundRequest;
import com.booking.lifecycle.domain.RefundResult;
import com.booking.lifecycle.domain.ReleaseResult;
import com.booking.lifecycle.domain.TransferRequest;
import com.booking.lifecycle.domain.TransferResult;
import com.booking.lifecycle.error.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory gateway with manual-capture intents, refunds and connected-account transfers.
 * Honours idempotency keys the way a real gateway does: a repeated key returns the first result.
 * <p>
 * Simulated failures:
 * <ul>
 *   <li>payment method {@value #DECLINED_METHOD}: authorization declined</li>
 *   <li>payment method {@value #CAPTURE_TIMEOUT_METHOD}: the first capture is applied but reported as a timeout</li>
 *   <li>payment method {@value #REFUND_TIMEOUT_METHOD}: the first refund is applied but reported as a timeout</li>
 *   <li>destination {@value #CLOSED_ACCOUNT}: transfer rejected, not retryable</li>
 *   <li>destination {@value #UNAVAILABLE_ACCOUNT}: transfer fails with a retryable error</li>
 * </ul>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "booking.gateway.mock-enabled", havingValue = "true", matchIfMissing = true)
public class MockPaymentGateway implements PaymentGateway {

    public static final String DECLINED_METHOD = "pm_card_declined";
    public static final String CAPTURE_TIMEOUT_METHOD = "pm_capture_timeout";
    public static final String REFUND_TIMEOUT_METHOD = "pm_refund_timeout";
    public static final String CLOSED_ACCOUNT = "acct_closed";
    public static final String UNAVAILABLE_ACCOUNT = "acct_unavailable";

    private final Clock clock;
    private final Map<String, MockIntent> intents = new ConcurrentHashMap<>();
    private final Map<String, Object> resultsByKey = new ConcurrentHashMap<>();
    private final Map<String, TransferResult> transfersByGroup = new ConcurrentHashMap<>();

    public MockPaymentGateway(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized AuthorizationResult authorize(AuthorizationRequest request) {
        AuthorizationResult previous = previousResult(request.getIdempotencyKey(), AuthorizationResult.class);
        if (previous != null) {
            return previous;
        }
        log.debug("MockPaymentGateway authorizing key={} amount={}", request.getIdempotencyKey(), request.getAmount());
        if (DECLINED_METHOD.equals(request.getPaymentMethodId())) {
            throw new GatewayException(GatewayError.terminal("card_declined", "Simulated card decline"));
        }
        MockIntent intent = new MockIntent("pi_mock_" + UUID.randomUUID(), request.getAmount());
        intent.timeoutNextCapture = CAPTURE_TIMEOUT_METHOD.equals(request.getPaymentMethodId());
        intent.timeoutNextRefund = REFUND_TIMEOUT_METHOD.equals(request.getPaymentMethodId());
        intents.put(intent.id, intent);
        AuthorizationResult result = AuthorizationResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .paymentIntentId(intent.id)
                .amount(request.getAmount())
                .currencyCode(request.getCurrencyCode())
                .timestamp(clock.instant())
                .build();
        resultsByKey.put(request.getIdempotencyKey(), result);
        return result;
    }

    @Override
    public synchronized CaptureResult capture(CaptureRequest request) {
        CaptureResult previous = previousResult(request.getIdempotencyKey(), CaptureResult.class);
        if (previous != null) {
            return previous;
        }
        MockIntent intent = requireIntent(request.getPaymentIntentId());
        log.debug("MockPaymentGateway capturing key={} intentId={} amount={}",
                request.getIdempotencyKey(), intent.id, request.getAmount());
        if (intent.status == IntentStatus.CANCELED) {
            throw new GatewayException(GatewayError.terminal("payment_intent_unexpected_state", "Intent " + intent.id + " is canceled"));
        }
        if (request.getAmount() > intent.authorized - intent.captured) {
            throw new GatewayException(GatewayError.terminal("amount_too_large",
                    "Capture of " + request.getAmount() + " exceeds capturable " + (intent.authorized - intent.captured)));
        }
        intent.captured += request.getAmount();
        intent.status = intent.captured == intent.authorized ? IntentStatus.SUCCEEDED : IntentStatus.PARTIALLY_CAPTURED;
        CaptureResult result = CaptureResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .paymentIntentId(intent.id)
                .captureId("ch_mock_" + UUID.randomUUID())
                .capturedAmount(request.getAmount())
                .timestamp(clock.instant())
                .build();
        intent.latestCaptureId = result.getCaptureId();
        resultsByKey.put(request.getIdempotencyKey(), result);
        if (intent.timeoutNextCapture) {
            intent.timeoutNextCapture = false;
            throw new GatewayException(GatewayError.timeout("Simulated timeout after capture was applied"));
        }
        return result;
    }

    @Override
    public synchronized RefundResult refund(RefundRequest request) {
        RefundResult previous = previousResult(request.getIdempotencyKey(), RefundResult.class);
        if (previous != null) {
            return previous;
        }
        MockIntent intent = requireIntent(request.getPaymentIntentId());
        if (request.getAmount() > intent.captured - intent.refunded) {
            throw new GatewayException(GatewayError.terminal("charge_already_refunded",
                    "Refund of " + request.getAmount() + " exceeds refundable " + (intent.captured - intent.refunded)));
        }
        intent.refunded += request.getAmount();
        RefundResult result = RefundResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .paymentIntentId(intent.id)
                .refundId("re_mock_" + UUID.randomUUID())
                .amount(request.getAmount())
                .timestamp(clock.instant())
                .build();
        intent.refunds.add(result);
        resultsByKey.put(request.getIdempotencyKey(), result);
        if (intent.timeoutNextRefund) {
            intent.timeoutNextRefund = false;
            throw new GatewayException(GatewayError.timeout("Simulated timeout after refund was applied"));
        }
        return result;
    }

    @Override
    public synchronized TransferResult transfer(TransferRequest request) {
        TransferResult previous = previousResult(request.getIdempotencyKey(), TransferResult.class);
        if (previous != null) {
            return previous;
        }
        if (CLOSED_ACCOUNT.equals(request.getDestinationAccountId())) {
            throw new GatewayException(GatewayError.terminal("account_closed", "Destination account is closed"));
        }
        if (UNAVAILABLE_ACCOUNT.equals(request.getDestinationAccountId())) {
            throw new GatewayException(GatewayError.transientError("api_connection_error", "Simulated gateway outage"));
        }
        TransferResult result = TransferResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .transferId("tr_mock_" + UUID.randomUUID())
                .amount(request.getAmount())
                .destinationAccountId(request.getDestinationAccountId())
                .transferGroup(request.getTransferGroup())
                .timestamp(clock.instant())
                .build();
        resultsByKey.put(request.getIdempotencyKey(), result);
        transfersByGroup.put(request.getTransferGroup(), result);
        return result;
    }

    @Override
    public synchronized ReleaseResult release(String paymentIntentId, String idempotencyKey) {
        ReleaseResult previous = previousResult(idempotencyKey, ReleaseResult.class);
        if (previous != null) {
            return previous;
        }
        MockIntent intent = requireIntent(paymentIntentId);
        long released = intent.authorized - intent.captured;
        intent.status = intent.captured > 0 ? IntentStatus.SUCCEEDED : IntentStatus.CANCELED;
        intent.authorized = intent.captured;
        ReleaseResult result = ReleaseResult.builder()
                .idempotencyKey(idempotencyKey)
                .paymentIntentId(paymentIntentId)
                .releasedAmount(released)
                .timestamp(clock.instant())
                .build();
        resultsByKey.put(idempotencyKey, result);
        return result;
    }

    @Override
    public synchronized IntentSnapshot retrieveIntent(String paymentIntentId) {
        MockIntent intent = requireIntent(paymentIntentId);
        return IntentSnapshot.builder()
                .paymentIntentId(intent.id)
                .status(intent.status)
                .authorizedAmount(intent.authorized)
                .capturedAmount(intent.captured)
                .refundedAmount(intent.refunded)
                .latestCaptureId(intent.latestCaptureId)
                .build();
    }

    @Override
    public synchronized List<RefundResult> listRefunds(String paymentIntentId) {
        return List.copyOf(requireIntent(paymentIntentId).refunds);
    }

    @Override
    public Optional<TransferResult> findTransfer(String transferGroup) {
        return Optional.ofNullable(transfersByGroup.get(transferGroup));
    }

    private <T> T previousResult(String idempotencyKey, Class<T> type) {
        Object previous = resultsByKey.get(idempotencyKey);
        if (previous == null) {
            return null;
        }
        if (!type.isInstance(previous)) {
            throw new GatewayException(GatewayError.terminal("idempotency_error",
                    "Key " + idempotencyKey + " was used for a different request"));
        }
        log.debug("MockPaymentGateway replaying key={}", idempotencyKey);
        return type.cast(previous);
    }

    private MockIntent requireIntent(String paymentIntentId) {
        MockIntent intent = intents.get(paymentIntentId);
        if (intent == null) {
            throw new GatewayException(GatewayError.terminal("resource_missing", "No such payment intent: " + paymentIntentId));
        }
        return intent;
    }

    private static final class MockIntent {
        private final String id;
        private long authorized;
        private long captured;
        private long refunded;
        private IntentStatus status = IntentStatus.REQUIRES_CAPTURE;
        private String latestCaptureId;
        private final List<RefundResult> refunds = new ArrayList<>();
        private boolean timeoutNextCapture;
        private boolean timeoutNextRefund;

        private MockIntent(String id, long authorized) {
            this.id = id;
            this.authorized = authorized;
        }
    }
}
