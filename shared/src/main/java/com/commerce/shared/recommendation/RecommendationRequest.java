package com.commerce.shared.recommendation;

import com.commerce.shared.model.StockLine;
import com.commerce.shared.task.TaskRequest;
import com.commerce.shared.task.TaskTypes;

import java.util.List;

/**
 * Operations understood by a {@link RecommendationService}.
 */
public sealed interface RecommendationRequest extends TaskRequest {

    /** @param preferenceCategory category to boost, may be null */
    record ForCart(List<StockLine> cart, String preferenceCategory) implements RecommendationRequest {
        @Override public String type() { return TaskTypes.RECOMMEND_FOR_CART; }
    }

    record Alternatives(String sku) implements RecommendationRequest {
        @Override public String type() { return TaskTypes.RECOMMEND_ALTERNATIVES; }
    }
}
