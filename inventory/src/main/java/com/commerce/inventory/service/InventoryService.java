package com.commerce.inventory.service;

import com.commerce.inventory.domain.AvailabilityReport;
import com.commerce.inventory.domain.Reservation;
import com.commerce.inventory.exception.DuplicateReservationException;
import com.commerce.inventory.exception.InsufficientStockException;
import com.commerce.inventory.exception.ReservationNotFoundException;
import com.commerce.inventory.ledger.InventoryLedger;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task boundary of the inventory ledger.
 *
 * Ledger exceptions stop here: every outcome leaves as a {@link TaskResult}
 * whose errors carry the ledger's codes.
 */
@Slf4j
public class InventoryService {

    public static final String RECOMMENDATION_COMPONENT = "recommendation";
    public static final String INVENTORY_MANAGER_COMPONENT = "inventory-manager";

    private final InventoryLedger ledger;
    private final Duration defaultHold;

    private final Counter reservationsCreated;
    private final Counter reservationsRejected;
    private final Counter reservationsReleased;

    public InventoryService(InventoryLedger ledger, MeterRegistry meterRegistry, Duration defaultHold) {
        this.ledger = ledger;
        this.defaultHold = defaultHold;
        this.reservationsCreated = Counter.builder("inventory.reservations.created")
                .description("Reservations taken")
                .register(meterRegistry);
        this.reservationsRejected = Counter.builder("inventory.reservations.rejected")
                .description("Reserve calls rejected for stock or duplication")
                .register(meterRegistry);
        this.reservationsReleased = Counter.builder("inventory.reservations.released")
                .description("Reservations released by compensation or expiry")
                .register(meterRegistry);
    }

    public TaskResult<AvailabilityReport> check(Task<InventoryRequest.Check> task) {
        InventoryRequest.Check request = task.request();
        if (request.items() == null || request.items().isEmpty()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "items are required"));
        }
        AvailabilityReport report = ledger.check(request.items(), request.preferredLocation());
        if (report.allAvailable()) {
            return TaskResult.success(task, report);
        }
        log.debug("Availability check negative: taskId={}, unavailable={}", task.taskId(), report.unavailableSkus());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("skus", report.unavailableSkus());
        return TaskResult.failedWithPayload(task, report, List.of(),
                List.of(NextAction.callComponent(RECOMMENDATION_COMPONENT, "Suggest alternatives", data)));
    }

    public TaskResult<Reservation> reserve(Task<InventoryRequest.Reserve> task) {
        InventoryRequest.Reserve request = task.request();
        if (request.orderId() == null || request.orderId().isBlank()
                || request.items() == null || request.items().isEmpty()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "order_id and items are required"));
        }
        Duration hold = request.holdMinutes() == null ? defaultHold : Duration.ofMinutes(request.holdMinutes());
        try {
            Reservation reservation = ledger.reserve(request.orderId(), request.items(), hold);
            reservationsCreated.increment();
            return TaskResult.success(task, reservation);
        } catch (InsufficientStockException ex) {
            reservationsRejected.increment();
            List<ErrorDetail> errors = new ArrayList<>();
            List<NextAction> actions = new ArrayList<>();
            for (InsufficientStockException.Shortfall shortfall : ex.getShortfalls()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("sku", shortfall.sku());
                details.put("requested", shortfall.requested());
                details.put("available", shortfall.available());
                errors.add(ErrorDetail.of(ex.code(), "Insufficient stock for " + shortfall.sku(), details));
                actions.add(NextAction.callComponent(INVENTORY_MANAGER_COMPONENT,
                        "Ask inventory manager to restock", Map.of("sku", shortfall.sku())));
            }
            return TaskResult.failedWithPayload(task, null, errors, actions);
        } catch (DuplicateReservationException ex) {
            reservationsRejected.increment();
            log.warn("Duplicate reservation rejected: orderId={}, existing={}",
                    ex.getOrderId(), ex.getExistingReservationId());
            return TaskResult.failed(task, ErrorDetail.of(ex.code(), ex.getMessage(),
                    Map.of("order_id", ex.getOrderId(), "reservation_id", ex.getExistingReservationId())));
        }
    }

    public TaskResult<Reservation> release(Task<InventoryRequest.Release> task) {
        String reservationId = task.request().reservationId();
        if (reservationId == null || reservationId.isBlank()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.INVALID_RESERVATION, "reservation_id is required"));
        }
        try {
            Reservation released = ledger.release(reservationId);
            reservationsReleased.increment();
            return TaskResult.success(task, released);
        } catch (ReservationNotFoundException ex) {
            log.warn("Release rejected: reservationId={}", reservationId);
            return TaskResult.failed(task,
                    ErrorDetail.of(ex.code(), ex.getMessage(), "reservation_id", reservationId));
        }
    }

    public TaskResult<Reservation> consume(Task<InventoryRequest.Consume> task) {
        String reservationId = task.request().reservationId();
        if (reservationId == null || reservationId.isBlank()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.INVALID_RESERVATION, "reservation_id is required"));
        }
        try {
            return TaskResult.success(task, ledger.consume(reservationId));
        } catch (ReservationNotFoundException ex) {
            log.warn("Consume rejected: reservationId={}", reservationId);
            return TaskResult.failed(task,
                    ErrorDetail.of(ex.code(), ex.getMessage(), "reservation_id", reservationId));
        }
    }

    public TaskResult<Reservation> renew(Task<InventoryRequest.Renew> task) {
        InventoryRequest.Renew request = task.request();
        String reservationId = request.reservationId();
        if (reservationId == null || reservationId.isBlank()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.INVALID_RESERVATION, "reservation_id is required"));
        }
        Duration hold = request.holdMinutes() == null ? defaultHold : Duration.ofMinutes(request.holdMinutes());
        try {
            return TaskResult.success(task, ledger.renew(reservationId, hold));
        } catch (ReservationNotFoundException ex) {
            log.warn("Renew rejected: reservationId={}", reservationId);
            return TaskResult.failed(task,
                    ErrorDetail.of(ex.code(), ex.getMessage(), "reservation_id", reservationId));
        }
    }

    public TaskResult<StockSnapshot> get(Task<InventoryRequest.Get> task) {
        String sku = task.request().sku();
        if (sku == null) {
            return TaskResult.success(task, new StockSnapshot(List.copyOf(ledger.snapshot().values())));
        }
        return ledger.get(sku)
                .map(entry -> TaskResult.success(task, new StockSnapshot(List.of(entry))))
                .orElseGet(() -> TaskResult.failed(task,
                        ErrorDetail.of(ErrorCodes.SKU_NOT_FOUND, "Unknown sku " + sku, "sku", sku)));
    }

    /** Scheduled sweep entry point; returns how many holds were released. */
    public int releaseExpired() {
        List<Reservation> released = ledger.releaseExpired();
        reservationsReleased.increment(released.size());
        return released.size();
    }
}
