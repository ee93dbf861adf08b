package com.commerce.shared.loyalty;

import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;

/**
 * Computes, redeems and issues loyalty points. Never critical to checkout safety.
 */
public interface LoyaltyService {

    TaskResult<LoyaltyQuote> calculate(Task<LoyaltyRequest.Calculate> task);

    TaskResult<LoyaltyRedemption> redeem(Task<LoyaltyRequest.Redeem> task);

    TaskResult<LoyaltyIssue> issue(Task<LoyaltyRequest.Issue> task);

    TaskResult<LoyaltyBalance> balance(Task<LoyaltyRequest.Balance> task);
}
