package com.commerce.shared.recommendation;

import java.util.List;

public record Recommendations(List<Recommendation> items) {

    public Recommendations {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
