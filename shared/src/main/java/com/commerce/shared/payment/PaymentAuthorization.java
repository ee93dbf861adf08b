package com.commerce.shared.payment;

import java.math.BigDecimal;

/**
 * Result of an authorize call. {@code authId} is the reference the saga keeps
 * for capture; a PENDING status means an out-of-band confirmation is awaited.
 */
public record PaymentAuthorization(String txId,
                                   String authId,
                                   PaymentMethod method,
                                   BigDecimal amount,
                                   TransactionStatus status) {
}
