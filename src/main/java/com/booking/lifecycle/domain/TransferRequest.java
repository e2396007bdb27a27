package com.booking.lifecycle.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Pays the provider's share out to their connected account.
 */
@Value
@Builder
public class TransferRequest {

    String idempotencyKey;
    long amount;
    String currencyCode;
    String destinationAccountId;
    /** Groups the transfer with its booking; also used to look the transfer up after a timeout. */
    String transferGroup;
    /** Intent the transferred funds were captured on. */
    String sourcePaymentIntentId;
}
