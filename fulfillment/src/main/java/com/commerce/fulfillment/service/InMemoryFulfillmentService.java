package com.commerce.fulfillment.service;

import com.commerce.shared.fulfillment.FulfillmentMode;
import com.commerce.shared.fulfillment.FulfillmentRecord;
import com.commerce.shared.fulfillment.FulfillmentRequest;
import com.commerce.shared.fulfillment.FulfillmentService;
import com.commerce.shared.fulfillment.FulfillmentStatus;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Reference fulfillment collaborator.
 *
 * Ship-to-home orders get a two-day ETA in metro cities and four days elsewhere.
 * Click-and-collect orders take one unit of pickup capacity from a store, which
 * a cancel gives back.
 */
@Slf4j
public class InMemoryFulfillmentService implements FulfillmentService {

    public static final Set<String> DEFAULT_METRO_CITIES =
            Set.of("bengaluru", "bangalore", "mumbai", "delhi", "kolkata");

    static final String HOME_DELIVERY_SLOT = "10:00-14:00";
    static final String PICKUP_SLOT = "16:00-21:00";
    static final int METRO_ETA_DAYS = 2;
    static final int STANDARD_ETA_DAYS = 4;

    private final Clock clock;
    private final Set<String> metroCities;
    private final Map<String, Integer> storeCapacity;   // guarded by itself, insertion order is preference order
    private final ConcurrentMap<String, FulfillmentRecord> fulfillments = new ConcurrentHashMap<>();

    public InMemoryFulfillmentService(Clock clock, Set<String> metroCities, Map<String, Integer> storeCapacity) {
        this.clock = clock;
        this.metroCities = metroCities.stream().map(c -> c.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
        this.storeCapacity = new LinkedHashMap<>(storeCapacity);
    }

    @Override
    public TaskResult<FulfillmentRecord> create(Task<FulfillmentRequest.Create> task) {
        FulfillmentRequest.Create request = task.request();
        if (request.orderId() == null || request.items() == null || request.items().isEmpty()) {
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.MISSING_FIELDS, "order_id and items required"));
        }
        if (!request.inventoryConfirmed()) {
            return TaskResult.failed(task,
                    ErrorDetail.of(ErrorCodes.INVENTORY_NOT_CONFIRMED, "Inventory must be confirmed before fulfillment"),
                    NextAction.callComponent("inventory", "Ask inventory to confirm or reserve stock.", Map.of()));
        }
        FulfillmentMode mode = request.mode() == null ? FulfillmentMode.SHIP_TO_HOME : request.mode();
        return mode == FulfillmentMode.CLICK_AND_COLLECT ? clickAndCollect(task) : shipToHome(task);
    }

    private TaskResult<FulfillmentRecord> shipToHome(Task<FulfillmentRequest.Create> task) {
        FulfillmentRequest.Create request = task.request();
        String city = request.address() == null || request.address().city() == null
                ? "" : request.address().city().toLowerCase(Locale.ROOT);
        int etaDays = metroCities.contains(city) ? METRO_ETA_DAYS : STANDARD_ETA_DAYS;
        FulfillmentRecord record = save(request, FulfillmentMode.SHIP_TO_HOME, FulfillmentStatus.SCHEDULED,
                etaDays, HOME_DELIVERY_SLOT, null);
        return TaskResult.success(task, record, List.of(NextAction.notifyCustomer(
                "Your order will be delivered by " + record.eta() + " between " + record.slot() + ".")));
    }

    private TaskResult<FulfillmentRecord> clickAndCollect(Task<FulfillmentRequest.Create> task) {
        FulfillmentRequest.Create request = task.request();
        String storeId;
        synchronized (storeCapacity) {
            storeId = request.storeId() != null ? request.storeId() : firstStoreWithCapacity();
            if (storeId == null || storeCapacity.getOrDefault(storeId, 0) <= 0) {
                log.warn("No pickup capacity: orderId={}, requestedStore={}", request.orderId(), request.storeId());
                return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.NO_STORE_AVAILABLE,
                        "No store available for pickup", "store_id", request.storeId()));
            }
            storeCapacity.merge(storeId, -1, Integer::sum);
        }
        FulfillmentRecord record = save(request, FulfillmentMode.CLICK_AND_COLLECT, FulfillmentStatus.READY_SOON,
                1, PICKUP_SLOT, storeId);
        return TaskResult.success(task, record, List.of(NextAction.notifyCustomer(
                "Your order will be ready for pickup at " + storeId + " by " + record.eta()
                        + ", between " + record.slot() + ".")));
    }

    @Override
    public TaskResult<FulfillmentRecord> updateStatus(Task<FulfillmentRequest.UpdateStatus> task) {
        String id = task.request().fulfillmentId();
        FulfillmentRecord updated = id == null ? null : fulfillments.computeIfPresent(id,
                (key, record) -> record.withStatus(task.request().status(), clock.instant()));
        if (updated == null) {
            return notFound(task, id);
        }
        log.info("Fulfillment status updated: fulfillmentId={}, status={}", id, updated.status());
        return TaskResult.success(task, updated);
    }

    @Override
    public TaskResult<FulfillmentRecord> cancel(Task<FulfillmentRequest.Cancel> task) {
        String id = task.request().fulfillmentId();
        String reason = task.request().reason() == null ? "customer_request" : task.request().reason();
        FulfillmentRecord existing = id == null ? null : fulfillments.get(id);
        if (existing == null) {
            return notFound(task, id);
        }
        if (existing.status() == FulfillmentStatus.CANCELLED) {
            return TaskResult.success(task, existing);
        }
        FulfillmentRecord cancelled = existing.cancelled(reason, clock.instant());
        fulfillments.put(id, cancelled);
        if (existing.mode() == FulfillmentMode.CLICK_AND_COLLECT && existing.storeId() != null) {
            synchronized (storeCapacity) {
                storeCapacity.computeIfPresent(existing.storeId(), (store, capacity) -> capacity + 1);
            }
        }
        log.info("Fulfillment cancelled: fulfillmentId={}, reason={}", id, reason);
        return TaskResult.success(task, cancelled, List.of(NextAction.notifyCustomer("Your delivery has been cancelled.")));
    }

    @Override
    public TaskResult<FulfillmentRecord> get(Task<FulfillmentRequest.Get> task) {
        String id = task.request().fulfillmentId();
        FulfillmentRecord record = id == null ? null : fulfillments.get(id);
        return record == null ? notFound(task, id) : TaskResult.success(task, record);
    }

    public int remainingCapacity(String storeId) {
        synchronized (storeCapacity) {
            return storeCapacity.getOrDefault(storeId, 0);
        }
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private String firstStoreWithCapacity() {
        return storeCapacity.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }

    private FulfillmentRecord save(FulfillmentRequest.Create request, FulfillmentMode mode, FulfillmentStatus status,
                                   int etaDays, String slot, String storeId) {
        Instant now = clock.instant();
        LocalDate eta = LocalDate.now(clock).plusDays(etaDays);
        String id = "ful_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        FulfillmentRecord record = new FulfillmentRecord(id, request.orderId(), mode, status, eta, slot, storeId,
                request.items(), now, now, null);
        fulfillments.put(id, record);
        log.info("Fulfillment created: fulfillmentId={}, orderId={}, mode={}, eta={}",
                id, request.orderId(), mode, eta);
        return record;
    }

    private static <T> TaskResult<T> notFound(Task<?> task, String fulfillmentId) {
        return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.FULFILLMENT_NOT_FOUND,
                "No fulfillment found", "fulfillment_id", fulfillmentId));
    }
}
