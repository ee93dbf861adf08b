package com.commerce.shared.payment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a gateway-owned transaction.
 */
public record PaymentTransaction(String txId,
                                 String authId,
                                 PaymentMethod method,
                                 BigDecimal amount,
                                 TransactionStatus status,
                                 Instant createdAt,
                                 Instant capturedAt,
                                 List<PaymentRefund> refunds) {

    public PaymentTransaction {
        refunds = refunds == null ? List.of() : List.copyOf(refunds);
    }
}
