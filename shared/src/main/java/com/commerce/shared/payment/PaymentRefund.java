package com.commerce.shared.payment;

import java.math.BigDecimal;
import java.time.Instant;

public record PaymentRefund(String refundId, String txId, BigDecimal amount, Instant refundedAt) {
}
