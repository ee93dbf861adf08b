package com.commerce.payment.domain;

import com.commerce.shared.payment.PaymentMethod;
import com.commerce.shared.payment.PaymentRefund;
import com.commerce.shared.payment.PaymentTransaction;
import com.commerce.shared.payment.TransactionStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Gateway-owned transaction. Mutated only by {@code InMemoryPaymentGateway}
 * while holding the instance's monitor.
 */
@Getter @Setter @Builder
public class Transaction {

    private final String txId;
    private final String authId;
    private final PaymentMethod method;
    private final BigDecimal amount;
    private final Instant createdAt;
    private String instrumentRef;   // last4, upi id or terminal
    private TransactionStatus status;
    private Instant capturedAt;
    @Builder.Default
    private final List<PaymentRefund> refunds = new ArrayList<>();

    public synchronized PaymentTransaction toView() {
        return new PaymentTransaction(txId, authId, method, amount, status, createdAt, capturedAt, refunds);
    }
}
