package com.commerce.shared.recommendation;

import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;

/**
 * Suggests related or substitute products.
 */
public interface RecommendationService {

    TaskResult<Recommendations> forCart(Task<RecommendationRequest.ForCart> task);

    TaskResult<Recommendations> alternatives(Task<RecommendationRequest.Alternatives> task);
}
