package com.commerce.shared.postpurchase;

import java.time.Instant;

public record FeedbackReceipt(String feedbackId, String orderId, int rating, Instant receivedAt) {
}
