package com.commerce.shared.payment;

/**
 * Result of a capture call. {@code alreadyCaptured} is set when the
 * authorization had been captured by an earlier call.
 */
public record PaymentCapture(String captureId, PaymentTransaction transaction, boolean alreadyCaptured) {
}
