package com.commerce.loyalty.service;

import com.commerce.shared.loyalty.LoyaltyBalance;
import com.commerce.shared.loyalty.LoyaltyIssue;
import com.commerce.shared.loyalty.LoyaltyQuote;
import com.commerce.shared.loyalty.LoyaltyRedemption;
import com.commerce.shared.loyalty.LoyaltyRequest;
import com.commerce.shared.loyalty.LoyaltyService;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reference loyalty ledger. {@value #POINTS_PER_UNIT} points are worth one
 * currency unit; orders earn {@code earnRate} points per unit spent.
 */
@Slf4j
public class InMemoryLoyaltyService implements LoyaltyService {

    public static final int POINTS_PER_UNIT = 100;
    static final BigDecimal SUGGESTED_REDEEM_SHARE = new BigDecimal("0.20");

    private final ConcurrentMap<String, Integer> points = new ConcurrentHashMap<>();
    private final int earnRate;

    public InMemoryLoyaltyService(Map<String, Integer> seedBalances, int earnRate) {
        this.points.putAll(seedBalances);
        this.earnRate = earnRate;
    }

    @Override
    public TaskResult<LoyaltyQuote> calculate(Task<LoyaltyRequest.Calculate> task) {
        BigDecimal amount = task.request().orderAmount();
        if (amount == null || amount.signum() <= 0) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.INVALID_AMOUNT, "order_amount must be > 0"));
        }
        int balance = balanceOf(task.customerId());
        int wholeAmount = amount.setScale(0, RoundingMode.DOWN).intValue();
        int maxRedeemable = Math.min(balance / POINTS_PER_UNIT, wholeAmount);
        int suggested = balance < POINTS_PER_UNIT
                ? 0
                : Math.min(maxRedeemable, amount.multiply(SUGGESTED_REDEEM_SHARE).setScale(0, RoundingMode.DOWN).intValue());
        return TaskResult.success(task, new LoyaltyQuote(amount, balance, maxRedeemable, suggested));
    }

    @Override
    public TaskResult<LoyaltyRedemption> redeem(Task<LoyaltyRequest.Redeem> task) {
        int value = task.request().amountToRedeem();
        if (value <= 0) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.INVALID_REDEEM, "amount_to_redeem must be > 0"));
        }
        String customerId = task.customerId();
        if (customerId == null) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "customer_id required"));
        }
        int needed = value * POINTS_PER_UNIT;
        int[] remaining = {-1};
        points.compute(customerId, (id, current) -> {
            int have = current == null ? 0 : current;
            if (have < needed) {
                return current;
            }
            remaining[0] = have - needed;
            return remaining[0];
        });
        if (remaining[0] < 0) {
            int available = balanceOf(customerId);
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INSUFFICIENT_POINTS, "Not enough points", "available_points", available),
                    NextAction.askCustomer("You don't have enough points. Would you like to use a different payment method?"));
        }
        log.info("Points redeemed: customerId={}, value={}, remaining={}", customerId, value, remaining[0]);
        return TaskResult.success(task, new LoyaltyRedemption(task.request().orderId(), value, remaining[0]));
    }

    @Override
    public TaskResult<LoyaltyIssue> issue(Task<LoyaltyRequest.Issue> task) {
        BigDecimal amount = task.request().orderAmount();
        if (amount == null || amount.signum() <= 0) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.INVALID_AMOUNT, "order_amount must be > 0"));
        }
        String customerId = task.customerId();
        if (customerId == null) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "customer_id required"));
        }
        int earned = amount.setScale(0, RoundingMode.DOWN).intValue() * earnRate;
        int balance = points.merge(customerId, earned, Integer::sum);
        log.info("Points issued: customerId={}, orderId={}, points={}", customerId, task.request().orderId(), earned);
        return TaskResult.success(task, new LoyaltyIssue(task.request().orderId(), earned, balance));
    }

    @Override
    public TaskResult<LoyaltyBalance> balance(Task<LoyaltyRequest.Balance> task) {
        return TaskResult.success(task, new LoyaltyBalance(task.customerId(), balanceOf(task.customerId())));
    }

    private int balanceOf(String customerId) {
        return customerId == null ? 0 : points.getOrDefault(customerId, 0);
    }
}
