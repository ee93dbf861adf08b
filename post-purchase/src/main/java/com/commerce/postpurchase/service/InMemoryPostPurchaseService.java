package com.commerce.postpurchase.service;

import com.commerce.shared.model.StockLine;
import com.commerce.shared.postpurchase.FeedbackReceipt;
import com.commerce.shared.postpurchase.PostPurchaseRequest;
import com.commerce.shared.postpurchase.PostPurchaseService;
import com.commerce.shared.postpurchase.PurchaseRecord;
import com.commerce.shared.postpurchase.ReturnRecord;
import com.commerce.shared.postpurchase.ReturnState;
import com.commerce.shared.postpurchase.WarrantyStatus;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reference post-purchase collaborator.
 *
 * A return is accepted while the order is inside its return window and only
 * for quantities the customer bought and has not already sent back. Every
 * SKU carries the same warranty period from its purchase date.
 */
@Slf4j
public class InMemoryPostPurchaseService implements PostPurchaseService {

    public static final int DEFAULT_RETURN_WINDOW_DAYS = 30;
    public static final int DEFAULT_WARRANTY_DAYS = 365;
    static final int RETURN_PROCESSING_DAYS = 3;
    static final String DEFAULT_RETURN_REASON = "customer_request";

    private final Clock clock;
    private final Duration returnWindow;
    private final int warrantyDays;

    private final ConcurrentMap<String, PurchaseRecord> purchases = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReturnRecord> returns = new ConcurrentHashMap<>();
    private final List<FeedbackReceipt> feedback = new ArrayList<>();   // guarded by itself

    public InMemoryPostPurchaseService(Clock clock, int returnWindowDays, int warrantyDays) {
        this.clock = clock;
        this.returnWindow = Duration.ofDays(returnWindowDays);
        this.warrantyDays = warrantyDays;
    }

    // ─── Purchases ────────────────────────────────────────────────────────────

    @Override
    public TaskResult<PurchaseRecord> recordPurchase(Task<PostPurchaseRequest.RecordPurchase> task) {
        PostPurchaseRequest.RecordPurchase request = task.request();
        if (request.orderId() == null || request.items() == null || request.items().isEmpty()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "order_id and items required"));
        }
        Instant now = clock.instant();
        PurchaseRecord record = new PurchaseRecord(request.orderId(), task.customerId(), request.items(),
                request.amount(), now, now.plus(returnWindow));
        PurchaseRecord existing = purchases.putIfAbsent(record.orderId(), record);
        if (existing != null) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.DUPLICATE_ORDER, "Order already recorded", "order_id", record.orderId()));
        }
        log.info("Purchase recorded: orderId={}, customerId={}, returnableUntil={}",
                record.orderId(), record.customerId(), record.returnableUntil());
        return TaskResult.success(task, record);
    }

    // ─── Returns ──────────────────────────────────────────────────────────────

    @Override
    public synchronized TaskResult<ReturnRecord> initiateReturn(Task<PostPurchaseRequest.InitiateReturn> task) {
        PostPurchaseRequest.InitiateReturn request = task.request();
        if (request.orderId() == null || request.items() == null || request.items().isEmpty()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "order_id and items required"));
        }
        PurchaseRecord purchase = purchases.get(request.orderId());
        if (purchase == null || !Objects.equals(purchase.customerId(), task.customerId())) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.ORDER_NOT_FOUND, "Order not found for this customer", "order_id", request.orderId()));
        }
        Instant now = clock.instant();
        if (now.isAfter(purchase.returnableUntil())) {
            long daysSince = Duration.between(purchase.placedAt(), now).toDays();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("days_since_order", daysSince);
            details.put("return_window_days", returnWindow.toDays());
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.RETURN_WINDOW_CLOSED, "Return window has closed", details),
                    NextAction.askCustomer("This order was placed " + daysSince + " days ago. Returns are accepted for "
                            + returnWindow.toDays() + " days. Would you like to check the warranty instead?"));
        }
        List<String> overReturned = overReturnedSkus(purchase, request.items());
        if (!overReturned.isEmpty()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.INVALID_RETURN_ITEMS,
                    "Return exceeds purchased quantity", "skus", overReturned));
        }

        String reason = request.reason() == null || request.reason().isBlank() ? DEFAULT_RETURN_REASON : request.reason();
        ReturnRecord record = new ReturnRecord("ret_" + shortId(), purchase.orderId(), task.customerId(),
                request.items(), reason, ReturnState.APPROVED, now, now.plus(Duration.ofDays(RETURN_PROCESSING_DAYS)));
        returns.put(record.returnId(), record);
        log.info("Return approved: returnId={}, orderId={}, reason={}", record.returnId(), record.orderId(), reason);
        return TaskResult.success(task, record, List.of(NextAction.notifyCustomer("Return initiated (id: "
                + record.returnId() + "). We'll process it within " + RETURN_PROCESSING_DAYS + " days.")));
    }

    @Override
    public TaskResult<ReturnRecord> returnStatus(Task<PostPurchaseRequest.ReturnStatus> task) {
        String returnId = task.request().returnId();
        ReturnRecord record = returnId == null ? null : returns.get(returnId);
        if (record == null) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INVALID_RETURN_ID, "return_id invalid", "return_id", returnId));
        }
        return TaskResult.success(task, record);
    }

    // Quantities already returned for the order count against what was bought
    private List<String> overReturnedSkus(PurchaseRecord purchase, List<StockLine> requested) {
        Map<String, Integer> remaining = new LinkedHashMap<>();
        purchase.items().forEach(line -> remaining.merge(line.sku(), line.qty(), Integer::sum));
        returns.values().stream()
                .filter(previous -> previous.orderId().equals(purchase.orderId()))
                .flatMap(previous -> previous.items().stream())
                .forEach(line -> remaining.merge(line.sku(), -line.qty(), Integer::sum));

        Map<String, Long> asked = new LinkedHashMap<>();
        requested.forEach(line -> asked.merge(line.sku(), (long) line.qty(), Long::sum));
        List<String> over = new ArrayList<>();
        asked.forEach((sku, qty) -> {
            if (qty > remaining.getOrDefault(sku, 0)) {
                over.add(sku);
            }
        });
        return over;
    }

    // ─── Feedback / warranty ──────────────────────────────────────────────────

    @Override
    public TaskResult<FeedbackReceipt> submitFeedback(Task<PostPurchaseRequest.SubmitFeedback> task) {
        PostPurchaseRequest.SubmitFeedback request = task.request();
        if (request.rating() < 1 || request.rating() > 5) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INVALID_RATING, "Rating must be between 1 and 5", "rating", request.rating()));
        }
        PurchaseRecord purchase = request.orderId() == null ? null : purchases.get(request.orderId());
        if (purchase == null || !Objects.equals(purchase.customerId(), task.customerId())) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.ORDER_NOT_FOUND, "Order not found for this customer", "order_id", request.orderId()));
        }
        FeedbackReceipt receipt = new FeedbackReceipt("fdb_" + shortId(), request.orderId(), request.rating(), clock.instant());
        synchronized (feedback) {
            feedback.add(receipt);
        }
        log.info("Feedback saved: feedbackId={}, orderId={}, rating={}", receipt.feedbackId(), receipt.orderId(), receipt.rating());
        return TaskResult.success(task, receipt,
                List.of(NextAction.notifyCustomer("Thanks for your feedback! It really helps us improve.")));
    }

    @Override
    public TaskResult<WarrantyStatus> checkWarranty(Task<PostPurchaseRequest.CheckWarranty> task) {
        PostPurchaseRequest.CheckWarranty request = task.request();
        if (request.sku() == null || request.purchaseDate() == null) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "sku and purchase_date required"));
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        if (request.purchaseDate().isAfter(today)) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.INVALID_DATE,
                    "purchase_date is in the future", "purchase_date", request.purchaseDate()));
        }
        LocalDate expires = request.purchaseDate().plusDays(warrantyDays);
        return TaskResult.success(task, new WarrantyStatus(request.sku(), expires.isAfter(today), expires));
    }

    public int feedbackCount() {
        synchronized (feedback) {
            return feedback.size();
        }
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
