package com.commerce.shared.recommendation;

import java.math.BigDecimal;

/**
 * @param availableQty stock observed when the recommendation was built, null when not looked up
 */
public record Recommendation(String sku, String name, BigDecimal price, double score,
                             boolean available, Integer availableQty) {
}
