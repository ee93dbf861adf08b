package com.commerce.shared.loyalty;

import java.math.BigDecimal;

/**
 * What the customer could redeem against an order, without redeeming anything.
 */
public record LoyaltyQuote(BigDecimal orderAmount, int customerPoints, int maxRedeemableValue, int suggestedRedeem) {
}
