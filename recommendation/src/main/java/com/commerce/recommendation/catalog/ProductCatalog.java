package com.commerce.recommendation.catalog;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable product lookup. Iteration follows registration order.
 */
public class ProductCatalog {

    private final Map<String, Product> products;

    public ProductCatalog(List<Product> products) {
        Map<String, Product> bySku = new LinkedHashMap<>();
        products.forEach(p -> bySku.put(p.sku(), p));
        this.products = Collections.unmodifiableMap(bySku);
    }

    public static ProductCatalog demo() {
        return new ProductCatalog(List.of(
                new Product("TSHIRT-RED-XL", "Red T-Shirt XL", "apparel", new BigDecimal("799"),
                        List.of("HAT-BLK", "TSHIRT-BLUE-M")),
                new Product("TSHIRT-BLUE-M", "Blue T-Shirt M", "apparel", new BigDecimal("749"),
                        List.of("HAT-BLK")),
                new Product("JEANS-BLK-32", "Black Jeans 32", "apparel", new BigDecimal("1999"),
                        List.of("BELT-BRN", "HAT-BLK")),
                new Product("HAT-BLK", "Black Cap", "accessory", new BigDecimal("399"),
                        List.of("TSHIRT-RED-XL")),
                new Product("BELT-BRN", "Brown Belt", "accessory", new BigDecimal("499"),
                        List.of())));
    }

    public Optional<Product> find(String sku) {
        return Optional.ofNullable(products.get(sku));
    }

    public Collection<Product> all() {
        return products.values();
    }
}
