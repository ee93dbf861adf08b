package com.commerce.shared.loyalty;

public record LoyaltyBalance(String customerId, int points) {
}
