package com.commerce.checkout.saga;

import com.commerce.checkout.model.CheckoutRequest;
import com.commerce.checkout.model.CheckoutResult;
import com.commerce.inventory.domain.AvailabilityReport;
import com.commerce.inventory.domain.Reservation;
import com.commerce.inventory.service.InventoryRequest;
import com.commerce.inventory.service.InventoryService;
import com.commerce.shared.fulfillment.FulfillmentRecord;
import com.commerce.shared.fulfillment.FulfillmentRequest;
import com.commerce.shared.fulfillment.FulfillmentService;
import com.commerce.shared.loyalty.LoyaltyRequest;
import com.commerce.shared.loyalty.LoyaltyService;
import com.commerce.shared.notification.CustomerNotification;
import com.commerce.shared.notification.CustomerNotifier;
import com.commerce.shared.payment.PaymentAuthorization;
import com.commerce.shared.payment.PaymentCapture;
import com.commerce.shared.payment.PaymentGateway;
import com.commerce.shared.payment.PaymentRequest;
import com.commerce.shared.postpurchase.PostPurchaseRequest;
import com.commerce.shared.postpurchase.PostPurchaseService;
import com.commerce.shared.recommendation.RecommendationRequest;
import com.commerce.shared.recommendation.RecommendationService;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskRequest;
import com.commerce.shared.task.TaskResult;
import com.commerce.shared.task.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Checkout Saga Orchestrator
 *
 * Drives one checkout end to end and returns exactly one terminal result:
 *
 *   CHECK_INVENTORY → [RECOMMEND] → [LOYALTY_CALCULATE] → RESERVE → AUTHORIZE_PAYMENT
 *     → CAPTURE_PAYMENT → CREATE_FULFILLMENT → [ISSUE_LOYALTY] → [RECORD_PURCHASE]
 *
 * Bracketed steps are best-effort. Steps run strictly in sequence and none is
 * retried. Completed steps with an undo push it onto the saga's compensation
 * stack (RESERVE pushes a release, AUTHORIZE_PAYMENT pushes a refund); the
 * {@link CompensationMode} decides which failures unwind that stack.
 *
 * A pending authorization ends the saga as PENDING with the reservation held.
 * Once the customer approves, {@link #completePending} renews that hold and
 * runs the remaining steps from CAPTURE_PAYMENT on.
 *
 * Holds no state across calls, so any number of checkouts may run concurrently.
 */
@Slf4j
public class CheckoutSaga {

    private final InventoryService inventory;
    private final RecommendationService recommendations;
    private final LoyaltyService loyalty;
    private final PaymentGateway payments;
    private final FulfillmentService fulfillment;
    private final PostPurchaseService postPurchase;
    private final CustomerNotifier notifier;
    private final StepExecutor steps;
    private final CompensationMode compensationMode;
    private final Clock clock;

    // Metrics
    private final MeterRegistry meterRegistry;
    private final Counter sagasStarted;
    private final Counter sagasCompleted;
    private final Counter sagasPending;
    private final Counter sagasResumed;
    private final Counter sagasCompensated;
    private final Timer sagaDuration;

    public CheckoutSaga(InventoryService inventory,
                        RecommendationService recommendations,
                        LoyaltyService loyalty,
                        PaymentGateway payments,
                        FulfillmentService fulfillment,
                        PostPurchaseService postPurchase,
                        CustomerNotifier notifier,
                        StepExecutor steps,
                        CompensationMode compensationMode,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.inventory = inventory;
        this.recommendations = recommendations;
        this.loyalty = loyalty;
        this.payments = payments;
        this.fulfillment = fulfillment;
        this.postPurchase = postPurchase;
        this.notifier = notifier;
        this.steps = steps;
        this.compensationMode = compensationMode;
        this.clock = clock;

        this.meterRegistry    = meterRegistry;
        this.sagasStarted     = Counter.builder("checkout.saga.started").register(meterRegistry);
        this.sagasCompleted   = Counter.builder("checkout.saga.completed").register(meterRegistry);
        this.sagasPending     = Counter.builder("checkout.saga.pending").register(meterRegistry);
        this.sagasResumed     = Counter.builder("checkout.saga.resumed").register(meterRegistry);
        this.sagasCompensated = Counter.builder("checkout.saga.compensated").register(meterRegistry);
        this.sagaDuration     = Timer.builder("checkout.saga.duration").register(meterRegistry);
    }

    // ─── Entry Point ──────────────────────────────────────────────────────────

    public CheckoutResult checkout(CheckoutRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String sessionId = request.sessionId() != null ? request.sessionId() : UUID.randomUUID().toString();
        SagaState state = new SagaState(sessionId, "order_" + shortId(), clock.instant());
        sagasStarted.increment();
        log.info("Starting checkout saga: sessionId={}, orderId={}, customerId={}, lines={}",
                sessionId, state.getOrderId(), request.customerId(), request.cart().size());

        CheckoutResult result = run(state, request);

        sample.stop(sagaDuration);
        log.info("Checkout saga finished: orderId={}, status={}, reason={}, compensated={}",
                state.getOrderId(), result.status(), result.reason(), result.compensated());
        notifyCustomer(request, result);
        return result;
    }

    /**
     * Finishes a checkout that ended PENDING, once its payment has been approved.
     *
     * @param request the request the pending checkout was started with
     * @param pending the pending result; its reservation and authorization payloads are reused
     * @throws IllegalArgumentException if {@code pending} is not a pending checkout result
     */
    public CheckoutResult completePending(CheckoutRequest request, CheckoutResult pending) {
        if (pending == null || !pending.isPending()) {
            throw new IllegalArgumentException("Only a pending checkout can be completed: status="
                    + (pending == null ? null : pending.status()));
        }
        Reservation reservation = pending.payload(SagaStep.RESERVE, Reservation.class)
                .orElseThrow(() -> new IllegalArgumentException("Pending checkout carries no reservation"));
        PaymentAuthorization authorization = pending.payload(SagaStep.AUTHORIZE_PAYMENT, PaymentAuthorization.class)
                .orElseThrow(() -> new IllegalArgumentException("Pending checkout carries no authorization"));

        Timer.Sample sample = Timer.start(meterRegistry);
        SagaState state = new SagaState(pending.sessionId(), pending.orderId(), clock.instant());
        sagasResumed.increment();
        log.info("Resuming pending checkout: orderId={}, authId={}, reservationId={}",
                state.getOrderId(), authorization.authId(), reservation.reservationId());

        CheckoutResult result = resume(state, request, reservation, authorization);

        sample.stop(sagaDuration);
        log.info("Pending checkout finished: orderId={}, status={}, reason={}, compensated={}",
                state.getOrderId(), result.status(), result.reason(), result.compensated());
        notifyCustomer(request, result);
        return result;
    }

    // ─── Steps ────────────────────────────────────────────────────────────────

    private CheckoutResult run(SagaState state, CheckoutRequest request) {
        BigDecimal amount = request.amount();
        if (request.cart().isEmpty()) {
            return failed(state, FailureReason.RESERVE_FAILED,
                    List.of(ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "order_id and items are required")),
                    List.of(NextAction.askCustomer("Your cart is empty. Add items before checking out.")));
        }

        // 1) Availability
        TaskResult<AvailabilityReport> check = local(state, SagaStep.CHECK_INVENTORY,
                task(state, request, new InventoryRequest.Check(request.stockLines(), request.preferredLocation())),
                inventory::check);
        if (!check.isSuccess()) {
            return failed(state, FailureReason.INVENTORY_UNAVAILABLE, check.errors(), check.nextActions());
        }

        // 2) Suggestions and loyalty quote; neither feeds a later required step
        remote(state, SagaStep.RECOMMEND,
                task(state, request, new RecommendationRequest.ForCart(request.stockLines(), request.preferenceCategory())),
                recommendations::forCart);
        remote(state, SagaStep.LOYALTY_CALCULATE,
                task(state, request, new LoyaltyRequest.Calculate(amount)),
                loyalty::calculate);

        // 3) Hold stock; availability is re-validated inside the ledger
        TaskResult<Reservation> reserve = local(state, SagaStep.RESERVE,
                task(state, request, new InventoryRequest.Reserve(state.getOrderId(), request.stockLines(), null)),
                inventory::reserve);
        if (!reserve.isSuccess()) {
            return failed(state, FailureReason.RESERVE_FAILED, reserve.errors(), reserve.nextActions());
        }
        pushRelease(state, request, reserve.payload());

        // 4) Authorize
        TaskResult<PaymentAuthorization> authorize = remote(state, SagaStep.AUTHORIZE_PAYMENT,
                task(state, request, new PaymentRequest.Authorize(amount, request.payment())),
                payments::authorize);
        if (authorize.isPending()) {
            return pending(state, authorize.nextActions());
        }
        if (!authorize.isSuccess()) {
            return failed(state, FailureReason.PAYMENT_FAILED, authorize.errors(), authorize.nextActions());
        }
        pushRefund(state, request, authorize.payload());

        // 5) Capture
        TaskResult<PaymentCapture> capture = capture(state, request, authorize.payload());
        if (!capture.isSuccess()) {
            return failed(state, FailureReason.CAPTURE_FAILED, capture.errors(), capture.nextActions());
        }
        return fulfil(state, request, reserve.payload());
    }

    private CheckoutResult resume(SagaState state, CheckoutRequest request,
                                  Reservation reservation, PaymentAuthorization authorization) {
        // The hold may have lapsed while the customer approved; nothing is captured in that case
        TaskResult<Reservation> renewed = local(state, SagaStep.RESERVE,
                task(state, request, new InventoryRequest.Renew(reservation.reservationId(), null)),
                inventory::renew);
        if (!renewed.isSuccess()) {
            List<NextAction> actions = new ArrayList<>(renewed.nextActions());
            actions.add(NextAction.askCustomer("Your stock hold expired before payment was confirmed. Please check out again."));
            return failed(state, FailureReason.RESERVE_FAILED, renewed.errors(), actions);
        }
        pushRelease(state, request, renewed.payload());
        state.putPayload(SagaStep.AUTHORIZE_PAYMENT, authorization);

        TaskResult<PaymentCapture> capture = capture(state, request, authorization);
        if (!capture.isSuccess()) {
            return failed(state, FailureReason.CAPTURE_FAILED, capture.errors(), capture.nextActions());
        }
        // A collect request only becomes refundable once it is captured
        pushRefund(state, request, authorization);
        return fulfil(state, request, renewed.payload());
    }

    private TaskResult<PaymentCapture> capture(SagaState state, CheckoutRequest request,
                                               PaymentAuthorization authorization) {
        return remote(state, SagaStep.CAPTURE_PAYMENT,
                task(state, request, new PaymentRequest.Capture(authorization.authId())),
                payments::capture);
    }

    /** Steps after a successful capture, ending COMPLETED or FULFILLMENT_FAILED. */
    private CheckoutResult fulfil(SagaState state, CheckoutRequest request, Reservation reservation) {
        // 6) Fulfillment
        TaskResult<FulfillmentRecord> created = remote(state, SagaStep.CREATE_FULFILLMENT,
                task(state, request, new FulfillmentRequest.Create(state.getOrderId(), request.stockLines(),
                        request.address(), request.fulfillmentMode(), request.storeId(), true)),
                fulfillment::create);
        if (!created.isSuccess()) {
            return failed(state, FailureReason.FULFILLMENT_FAILED, created.errors(), created.nextActions());
        }

        // 7) Points and the returnable purchase record, only for known customers
        if (request.customerId() != null) {
            remote(state, SagaStep.ISSUE_LOYALTY,
                    task(state, request, new LoyaltyRequest.Issue(state.getOrderId(), request.amount())),
                    loyalty::issue);
            remote(state, SagaStep.RECORD_PURCHASE,
                    task(state, request, new PostPurchaseRequest.RecordPurchase(state.getOrderId(),
                            request.stockLines(), request.amount())),
                    postPurchase::recordPurchase);
        }

        List<NextAction> actions = new ArrayList<>(created.nextActions());
        settleReservation(state, request, reservation).ifPresent(actions::add);

        state.finish(SagaState.Status.COMPLETED, clock.instant());
        sagasCompleted.increment();
        return result(state, TaskStatus.SUCCESS, null, List.of(), actions);
    }

    /**
     * Marks the held stock as sold so the expiry sweep leaves it withdrawn.
     * A hold that lapsed mid-checkout has already been credited back; that
     * is reported, not undone.
     */
    private Optional<NextAction> settleReservation(SagaState state, CheckoutRequest request, Reservation reservation) {
        Task<InventoryRequest.Consume> consume =
                task(state, request, new InventoryRequest.Consume(reservation.reservationId()));
        TaskResult<Reservation> settled = steps.inline(SagaStep.RESERVE, consume, () -> inventory.consume(consume));
        if (settled.isSuccess()) {
            return Optional.empty();
        }
        log.error("Reservation could not be settled for a paid order: orderId={}, reservationId={}, errors={}",
                state.getOrderId(), reservation.reservationId(), errorCodes(settled));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", state.getOrderId());
        data.put("reservation_id", reservation.reservationId());
        return Optional.of(new NextAction(NextAction.Type.MANUAL_INTERVENTION,
                "Order is paid but its stock hold had lapsed; re-check stock", data));
    }

    private <R extends TaskRequest, T> TaskResult<T> remote(SagaState state, SagaStep step, Task<R> task,
                                                             Function<Task<R>, TaskResult<T>> operation) {
        return record(state, step, () -> steps.call(step, task, () -> operation.apply(task)));
    }

    private <R extends TaskRequest, T> TaskResult<T> local(SagaState state, SagaStep step, Task<R> task,
                                                            Function<Task<R>, TaskResult<T>> operation) {
        return record(state, step, () -> steps.inline(step, task, () -> operation.apply(task)));
    }

    private <T> TaskResult<T> record(SagaState state, SagaStep step, Supplier<TaskResult<T>> execution) {
        long started = System.nanoTime();
        TaskResult<T> result = execution.get();
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        state.record(new StepRecord(step, result.status(), errorCodes(result), elapsedMs, false));
        result.payloadIfPresent().ifPresent(payload -> state.putPayload(step, payload));

        if (result.isFailed() && step.isBestEffort()) {
            log.warn("Best-effort step failed, continuing: orderId={}, step={}, errors={}",
                    state.getOrderId(), step, errorCodes(result));
        } else {
            log.debug("Step done: orderId={}, step={}, status={}, elapsedMs={}",
                    state.getOrderId(), step, result.status(), elapsedMs);
        }
        return result;
    }

    // ─── Compensation ─────────────────────────────────────────────────────────

    private void pushRelease(SagaState state, CheckoutRequest request, Reservation reservation) {
        Task<InventoryRequest.Release> release =
                task(state, request, new InventoryRequest.Release(reservation.reservationId()));
        state.pushCompensation(new Compensation(SagaStep.RESERVE,
                "release " + reservation.reservationId(),
                () -> steps.inline(SagaStep.RESERVE, release, () -> inventory.release(release))));
    }

    private void pushRefund(SagaState state, CheckoutRequest request, PaymentAuthorization authorization) {
        Task<PaymentRequest.Refund> refund =
                task(state, request, new PaymentRequest.Refund(authorization.txId(), null));
        state.pushCompensation(new Compensation(SagaStep.AUTHORIZE_PAYMENT,
                "refund " + authorization.txId(),
                () -> steps.call(SagaStep.AUTHORIZE_PAYMENT, refund, () -> payments.refund(refund))));
    }

    /** Runs every pushed undo, newest first. Returns the errors of undos that failed. */
    private List<ErrorDetail> unwind(SagaState state) {
        state.setStatus(SagaState.Status.COMPENSATING);
        List<ErrorDetail> failures = new ArrayList<>();
        Optional<Compensation> next;
        while ((next = state.popCompensation()).isPresent()) {
            Compensation compensation = next.get();
            long started = System.nanoTime();
            TaskResult<?> outcome = compensation.action().get();
            state.record(new StepRecord(compensation.step(), outcome.status(), errorCodes(outcome),
                    (System.nanoTime() - started) / 1_000_000, true));
            if (outcome.isSuccess()) {
                log.info("Compensation applied: orderId={}, action={}", state.getOrderId(), compensation.description());
            } else {
                log.error("Compensation failed: orderId={}, action={}, errors={}",
                        state.getOrderId(), compensation.description(), errorCodes(outcome));
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("step", compensation.step().name());
                details.put("action", compensation.description());
                details.put("cause", outcome.firstErrorCode().orElse(null));
                failures.add(ErrorDetail.of(ErrorCodes.COMPENSATION_FAILED,
                        "Compensation failed: " + compensation.description(), details));
            }
        }
        state.markCompensated();
        sagasCompensated.increment();
        return failures;
    }

    // ─── Terminal Results ─────────────────────────────────────────────────────

    private CheckoutResult failed(SagaState state, FailureReason reason,
                                  List<ErrorDetail> errors, List<NextAction> nextActions) {
        List<ErrorDetail> detail = new ArrayList<>(errors);
        List<NextAction> actions = new ArrayList<>(nextActions);

        if (state.hasPendingCompensations()) {
            if (compensationMode.compensates(reason)) {
                log.warn("Compensating checkout: orderId={}, reason={}, actions={}",
                        state.getOrderId(), reason.wire(), state.pendingCompensations());
                detail.addAll(unwind(state));
            } else {
                log.error("Checkout failed after side effects, manual intervention required: orderId={}, reason={}, held={}",
                        state.getOrderId(), reason.wire(), state.pendingCompensations());
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("order_id", state.getOrderId());
                data.put("outstanding", state.pendingCompensations());
                actions.add(new NextAction(NextAction.Type.MANUAL_INTERVENTION,
                        "Order failed at " + reason.step() + " with stock and payment still held", data));
            }
        }

        state.finish(SagaState.Status.FAILED, clock.instant());
        Counter.builder("checkout.saga.failed")
                .tag("reason", reason.wire())
                .register(meterRegistry)
                .increment();
        return result(state, TaskStatus.FAILED, reason, detail, actions);
    }

    private CheckoutResult pending(SagaState state, List<NextAction> nextActions) {
        log.info("Checkout pending payment confirmation: orderId={}, held={}",
                state.getOrderId(), state.pendingCompensations());
        state.finish(SagaState.Status.PENDING, clock.instant());
        sagasPending.increment();
        return result(state, TaskStatus.PENDING, null, List.of(), nextActions);
    }

    private CheckoutResult result(SagaState state, TaskStatus status, FailureReason reason,
                                  List<ErrorDetail> detail, List<NextAction> nextActions) {
        return new CheckoutResult(status, state.getOrderId(), state.getSessionId(), reason, detail, nextActions,
                state.payloadsByKey(), state.getLog(), state.isCompensated());
    }

    // ─── Notification ─────────────────────────────────────────────────────────

    private void notifyCustomer(CheckoutRequest request, CheckoutResult result) {
        if (request.customerId() == null) {
            return;
        }
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("orderId", result.orderId());
        String template;
        switch (result.status()) {
            case SUCCESS:
                template = CustomerNotifier.TEMPLATE_ORDER_CONFIRMED;
                vars.put("amount", request.amount().toPlainString());
                result.payload(SagaStep.CREATE_FULFILLMENT, FulfillmentRecord.class)
                        .ifPresent(record -> vars.put("eta", record.eta()));
                break;
            case PENDING:
                template = CustomerNotifier.TEMPLATE_PAYMENT_PENDING;
                result.payload(SagaStep.AUTHORIZE_PAYMENT, PaymentAuthorization.class)
                        .ifPresent(auth -> vars.put("txId", auth.txId()));
                break;
            default:
                template = CustomerNotifier.TEMPLATE_ORDER_FAILED;
                vars.put("reason", result.reason().wire());
                vars.put("compensated", result.compensated());
                vars.put("payment", paymentOutcome(result));
                break;
        }
        try {
            notifier.notify(new CustomerNotification(request.customerId(), CustomerNotifier.CHANNEL_EMAIL, template, vars));
        } catch (RuntimeException ex) {
            log.warn("Customer notification failed, ignored: orderId={}, template={}, error={}",
                    result.orderId(), template, ex.getMessage());
        }
    }

    /**
     * Whether a failed checkout left money with the merchant. Nothing is captured
     * before CAPTURE_PAYMENT; after it, only a fully unwound saga has given it back.
     */
    static String paymentOutcome(CheckoutResult result) {
        if (result.reason().step().compareTo(SagaStep.CAPTURE_PAYMENT) < 0) {
            return CustomerNotifier.PAYMENT_NOT_CHARGED;
        }
        boolean undoFailed = result.detail().stream()
                .anyMatch(error -> ErrorCodes.COMPENSATION_FAILED.equals(error.code()));
        return result.compensated() && !undoFailed
                ? CustomerNotifier.PAYMENT_REFUNDED
                : CustomerNotifier.PAYMENT_UNDER_REVIEW;
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static <R extends TaskRequest> Task<R> task(SagaState state, CheckoutRequest request, R body) {
        return Task.of(state.getSessionId(), request.customerId(), body);
    }

    private static List<String> errorCodes(TaskResult<?> result) {
        return result.errors().stream().map(ErrorDetail::code).toList();
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
