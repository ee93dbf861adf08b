package com.commerce.inventory.domain;

import com.commerce.inventory.exception.InsufficientStockException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Stock of one SKU: the total and its per-location buckets.
 *
 * Immutable. {@code quantity} always equals the sum of {@code locations} and no
 * quantity is ever negative; mutations return a new entry, so a reader holding
 * an entry can never observe a torn (quantity, locations) pair.
 */
public record StockEntry(String sku, int quantity, SortedMap<String, Integer> locations) {

    public StockEntry {
        Objects.requireNonNull(sku, "sku");
        TreeMap<String, Integer> copy = new TreeMap<>(locations == null ? Map.of() : locations);
        int sum = 0;
        for (Map.Entry<String, Integer> bucket : copy.entrySet()) {
            Integer qty = bucket.getValue();
            if (qty == null || qty < 0) {
                throw new IllegalArgumentException(
                        "Negative or missing quantity for " + sku + "@" + bucket.getKey() + ": " + qty);
            }
            sum += qty;
        }
        if (quantity != sum) {
            throw new IllegalArgumentException(String.format(
                    "Quantity of %s must equal the sum of its locations: quantity=%d, sum=%d", sku, quantity, sum));
        }
        locations = Collections.unmodifiableSortedMap(copy);
    }

    public static StockEntry of(String sku, Map<String, Integer> locations) {
        int total = locations.values().stream().mapToInt(Integer::intValue).sum();
        return new StockEntry(sku, total, new TreeMap<>(locations));
    }

    public boolean stocks(String location) {
        return location != null && locations.containsKey(location);
    }

    public int quantityAt(String location) {
        return locations.getOrDefault(location, 0);
    }

    /**
     * Takes {@code qty} units, draining locations in lexicographic id order.
     */
    public Withdrawal withdraw(int qty) {
        if (qty > quantity) {
            throw new InsufficientStockException(sku, qty, quantity);
        }
        TreeMap<String, Integer> remaining = new TreeMap<>(locations);
        Map<String, Integer> taken = new LinkedHashMap<>();
        int outstanding = qty;
        for (Map.Entry<String, Integer> bucket : locations.entrySet()) {
            if (outstanding == 0) {
                break;
            }
            int take = Math.min(bucket.getValue(), outstanding);
            if (take > 0) {
                remaining.put(bucket.getKey(), bucket.getValue() - take);
                taken.put(bucket.getKey(), take);
                outstanding -= take;
            }
        }
        return new Withdrawal(new StockEntry(sku, quantity - qty, remaining), Collections.unmodifiableMap(taken));
    }

    /** Credits each location of {@code breakdown} back onto this entry. */
    public StockEntry deposit(Map<String, Integer> breakdown) {
        TreeMap<String, Integer> merged = new TreeMap<>(locations);
        int added = 0;
        for (Map.Entry<String, Integer> bucket : breakdown.entrySet()) {
            merged.merge(bucket.getKey(), bucket.getValue(), Integer::sum);
            added += bucket.getValue();
        }
        return new StockEntry(sku, quantity + added, merged);
    }

    /**
     * @param remaining the entry after the withdrawal
     * @param taken     units taken per location, in depletion order
     */
    public record Withdrawal(StockEntry remaining, Map<String, Integer> taken) {}
}
