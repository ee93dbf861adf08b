package com.commerce.recommendation.service;

import com.commerce.recommendation.catalog.Product;
import com.commerce.recommendation.catalog.ProductCatalog;
import com.commerce.shared.model.StockLine;
import com.commerce.shared.recommendation.AvailabilityLookup;
import com.commerce.shared.recommendation.Recommendation;
import com.commerce.shared.recommendation.RecommendationRequest;
import com.commerce.shared.recommendation.RecommendationService;
import com.commerce.shared.recommendation.Recommendations;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores catalog neighbours of the cart: each cart line adds 1.0 to every
 * related SKU, and SKUs in the customer's preferred category are boosted.
 */
@Slf4j
@RequiredArgsConstructor
public class CatalogRecommendationService implements RecommendationService {

    static final double PREFERENCE_BOOST = 1.2;
    static final double FALLBACK_SCORE = 0.1;
    static final int FALLBACK_SIZE = 2;

    private final ProductCatalog catalog;
    private final AvailabilityLookup availability;

    @Override
    public TaskResult<Recommendations> forCart(Task<RecommendationRequest.ForCart> task) {
        List<StockLine> cart = task.request().cart() == null ? List.of() : task.request().cart();
        String preference = task.request().preferenceCategory();

        Map<String, Double> scores = new LinkedHashMap<>();
        for (StockLine line : cart) {
            catalog.find(line.sku()).ifPresent(product ->
                    product.related().forEach(rel -> scores.merge(rel, 1.0, Double::sum)));
        }
        if (preference != null) {
            scores.replaceAll((sku, score) -> catalog.find(sku)
                    .filter(p -> preference.equals(p.category()))
                    .map(p -> score * PREFERENCE_BOOST)
                    .orElse(score));
        }

        List<Recommendation> results = new ArrayList<>();
        scores.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> catalog.find(e.getKey()).ifPresent(p -> results.add(annotate(p, e.getValue()))));

        if (results.isEmpty()) {
            catalog.all().stream().limit(FALLBACK_SIZE).forEach(p -> results.add(annotate(p, FALLBACK_SCORE)));
        }
        log.debug("Recommendations built: taskId={}, count={}", task.taskId(), results.size());
        return TaskResult.success(task, new Recommendations(results));
    }

    @Override
    public TaskResult<Recommendations> alternatives(Task<RecommendationRequest.Alternatives> task) {
        String sku = task.request().sku();
        if (sku == null) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "sku is required"));
        }
        Product source = catalog.find(sku).orElse(null);
        if (source == null) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.SKU_NOT_IN_CATALOG, sku + " not found", "sku", sku));
        }
        Set<String> candidates = new LinkedHashSet<>(source.related());
        catalog.all().stream()
                .filter(p -> p.category().equals(source.category()) && !p.sku().equals(sku))
                .forEach(p -> candidates.add(p.sku()));

        List<Recommendation> alternatives = new ArrayList<>();
        for (String candidate : candidates) {
            catalog.find(candidate).ifPresent(p -> alternatives.add(annotate(p, 1.0)));
        }
        return TaskResult.success(task, new Recommendations(alternatives));
    }

    private Recommendation annotate(Product product, double score) {
        int qty = availability.availableQuantity(product.sku());
        return new Recommendation(product.sku(), product.name(), product.price(), score, qty > 0, qty);
    }
}
