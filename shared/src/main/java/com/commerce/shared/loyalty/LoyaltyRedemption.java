package com.commerce.shared.loyalty;

public record LoyaltyRedemption(String orderId, int redeemedValue, int remainingPoints) {
}
