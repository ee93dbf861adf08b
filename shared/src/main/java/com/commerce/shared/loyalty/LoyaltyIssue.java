package com.commerce.shared.loyalty;

public record LoyaltyIssue(String orderId, int issuedPoints, int newBalance) {
}
