package com.commerce.recommendation.catalog;

import java.math.BigDecimal;
import java.util.List;

public record Product(String sku, String name, String category, BigDecimal price, List<String> related) {

    public Product {
        related = related == null ? List.of() : List.copyOf(related);
    }
}
