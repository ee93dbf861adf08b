package com.commerce.inventory.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One SKU held by a reservation, with the locations it was drawn from.
 * An empty {@code takenFrom} means the breakdown was not preserved.
 */
public record ReservedLine(String sku, int qty, Map<String, Integer> takenFrom) {

    public ReservedLine {
        takenFrom = takenFrom == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(takenFrom));
    }
}
