package com.commerce.inventory.ledger;

import com.commerce.inventory.domain.AvailabilityReport;
import com.commerce.inventory.domain.ItemAvailability;
import com.commerce.inventory.domain.Reservation;
import com.commerce.inventory.domain.ReservedLine;
import com.commerce.inventory.domain.StockEntry;
import com.commerce.inventory.exception.DuplicateReservationException;
import com.commerce.inventory.exception.InsufficientStockException;
import com.commerce.inventory.exception.InsufficientStockException.Shortfall;
import com.commerce.inventory.exception.ReservationNotFoundException;
import com.commerce.inventory.repository.StockStore;
import com.commerce.shared.model.StockLine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authoritative stock bookkeeping.
 *
 * <p>{@link #reserve} and {@link #release} run inside one exclusive critical
 * section covering the whole stock map. {@link #check} takes no lock: it reads
 * one immutable {@link StockEntry} per SKU, so a SKU's quantity and location
 * buckets are always seen together.
 *
 * <p>Release is one-shot. The reservation record is removed when it is released,
 * so a second release of the same id is rejected instead of crediting stock twice.
 */
@Slf4j
public class InventoryLedger {

    public static final String DEFAULT_FALLBACK_LOCATION = "WAREHOUSE";

    private final StockStore store;
    private final Clock clock;
    private final String fallbackLocation;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private long lastStampMillis = Long.MIN_VALUE;
    private int stampSequence;

    public InventoryLedger(StockStore store, Clock clock) {
        this(store, clock, DEFAULT_FALLBACK_LOCATION);
    }

    public InventoryLedger(StockStore store, Clock clock, String fallbackLocation) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fallbackLocation = Objects.requireNonNull(fallbackLocation, "fallbackLocation");
    }

    // ─── Reads ────────────────────────────────────────────────────────────────

    public AvailabilityReport check(List<StockLine> items, String preferredLocation) {
        List<ItemAvailability> report = new ArrayList<>(items.size());
        for (StockLine line : items) {
            Optional<StockEntry> entry = store.find(line.sku());
            if (entry.isEmpty()) {
                report.add(new ItemAvailability(line.sku(), line.qty(), false, 0, null));
                continue;
            }
            StockEntry stock = entry.get();
            Integer locationQty = stock.stocks(preferredLocation) ? stock.quantityAt(preferredLocation) : null;
            boolean available = stock.quantity() >= line.qty()
                    || (locationQty != null && locationQty >= line.qty());
            report.add(new ItemAvailability(line.sku(), line.qty(), available, stock.quantity(), locationQty));
        }
        return new AvailabilityReport(report, preferredLocation);
    }

    public Optional<StockEntry> get(String sku) {
        return store.find(sku);
    }

    public SortedMap<String, StockEntry> snapshot() {
        return store.entries();
    }

    public List<Reservation> activeReservations() {
        return store.reservations();
    }

    // ─── Mutations ────────────────────────────────────────────────────────────

    /**
     * Reserves every line or nothing.
     *
     * @throws InsufficientStockException    if any (aggregated) line exceeds the SKU's total
     * @throws DuplicateReservationException if the order already holds an unreleased reservation
     */
    public Reservation reserve(String orderId, List<StockLine> items, Duration hold) {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId is required");
        }
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("items are required");
        }
        if (hold == null || hold.isNegative()) {
            throw new IllegalArgumentException("hold must be a non-negative duration: " + hold);
        }
        Map<String, Long> requested = aggregate(items);

        lock.lock();
        try {
            Optional<Reservation> existing = store.findActiveReservationForOrder(orderId);
            if (existing.isPresent()) {
                throw new DuplicateReservationException(orderId, existing.get().reservationId());
            }

            List<Shortfall> shortfalls = new ArrayList<>();
            requested.forEach((sku, qty) -> {
                int available = store.find(sku).map(StockEntry::quantity).orElse(0);
                if (available < qty) {
                    shortfalls.add(new Shortfall(sku, qty, available));
                }
            });
            if (!shortfalls.isEmpty()) {
                log.warn("Reservation rejected: orderId={}, shortfalls={}", orderId, shortfalls);
                throw new InsufficientStockException(shortfalls);
            }

            // Every line fits within an int total here. All withdrawals are computed
            // before the first write so a failure cannot leave the store half-updated.
            List<StockEntry.Withdrawal> withdrawals = new ArrayList<>(requested.size());
            requested.forEach((sku, qty) ->
                    withdrawals.add(store.find(sku).orElseThrow().withdraw(qty.intValue())));
            List<ReservedLine> lines = new ArrayList<>(withdrawals.size());
            for (StockEntry.Withdrawal withdrawal : withdrawals) {
                StockEntry remaining = withdrawal.remaining();
                store.put(remaining);
                lines.add(new ReservedLine(remaining.sku(), requested.get(remaining.sku()).intValue(),
                        withdrawal.taken()));
            }

            Instant now = clock.instant();
            Reservation reservation = new Reservation(nextReservationId(orderId, now), orderId, lines, hold, now);
            store.saveReservation(reservation);
            log.info("Inventory reserved: reservationId={}, orderId={}, lines={}",
                    reservation.reservationId(), orderId, lines.size());
            return reservation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restores the quantities held by a reservation and forgets it.
     *
     * @throws ReservationNotFoundException if the id is unknown or was already released
     */
    public Reservation release(String reservationId) {
        lock.lock();
        try {
            Reservation reservation = store.removeReservation(reservationId)
                    .orElseThrow(() -> new ReservationNotFoundException(reservationId));
            for (ReservedLine line : reservation.lines()) {
                Map<String, Integer> breakdown = line.takenFrom().isEmpty()
                        ? Map.of(fallbackLocation, line.qty())
                        : line.takenFrom();
                StockEntry current = store.find(line.sku())
                        .orElseGet(() -> StockEntry.of(line.sku(), Map.of()));
                store.put(current.deposit(breakdown));
            }
            log.info("Inventory released: reservationId={}, orderId={}",
                    reservationId, reservation.orderId());
            return reservation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles a reservation for a completed order: the record is forgotten and
     * the held quantities stay withdrawn. A consumed id can be neither released
     * nor expired.
     *
     * @throws ReservationNotFoundException if the id is unknown, released or already consumed
     */
    public Reservation consume(String reservationId) {
        lock.lock();
        try {
            Reservation reservation = store.removeReservation(reservationId)
                    .orElseThrow(() -> new ReservationNotFoundException(reservationId));
            log.info("Inventory consumed: reservationId={}, orderId={}", reservationId, reservation.orderId());
            return reservation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Extends a live hold so it runs for {@code extension} from now. A hold whose
     * time has already elapsed is released on the spot instead.
     *
     * @throws ReservationNotFoundException if the id is unknown, settled or its hold had lapsed
     */
    public Reservation renew(String reservationId, Duration extension) {
        if (extension == null || extension.isNegative()) {
            throw new IllegalArgumentException("extension must be a non-negative duration: " + extension);
        }
        lock.lock();
        try {
            Reservation current = store.findReservation(reservationId)
                    .orElseThrow(() -> new ReservationNotFoundException(reservationId));
            Instant now = clock.instant();
            if (current.isExpiredAt(now)) {
                release(reservationId);
                log.warn("Renewal refused, hold had lapsed: reservationId={}, expiredAt={}",
                        reservationId, current.expiresAt());
                throw new ReservationNotFoundException(reservationId);
            }
            Duration hold = Duration.between(current.createdAt(), now).plus(extension);
            Reservation renewed = new Reservation(reservationId, current.orderId(), current.lines(),
                    hold, current.createdAt());
            store.saveReservation(renewed);
            log.info("Inventory hold renewed: reservationId={}, expiresAt={}", reservationId, renewed.expiresAt());
            return renewed;
        } finally {
            lock.unlock();
        }
    }

    public List<Reservation> releaseExpired() {
        return releaseExpired(clock.instant());
    }

    /** Releases every reservation whose hold has elapsed at {@code now}. */
    public List<Reservation> releaseExpired(Instant now) {
        List<Reservation> released = new ArrayList<>();
        lock.lock();
        try {
            for (Reservation reservation : store.reservations()) {
                if (reservation.isExpiredAt(now)) {
                    released.add(release(reservation.reservationId()));
                }
            }
        } finally {
            lock.unlock();
        }
        if (!released.isEmpty()) {
            log.info("Expired reservations released: count={}", released.size());
        }
        return released;
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    // Stamps never move backwards, so no (orderId, stamp) pair is ever handed out twice.
    private String nextReservationId(String orderId, Instant now) {
        long millis = Math.max(now.toEpochMilli(), lastStampMillis);
        if (millis == lastStampMillis) {
            stampSequence++;
        } else {
            lastStampMillis = millis;
            stampSequence = 0;
        }
        String id = "res_" + orderId + "_" + millis;
        return stampSequence == 0 ? id : id + "_" + stampSequence;
    }

    /** Sums quantities per SKU, keeping first-seen order. Totals are longs so repeated lines cannot wrap. */
    static Map<String, Long> aggregate(List<StockLine> items) {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (StockLine line : items) {
            totals.merge(line.sku(), (long) line.qty(), Long::sum);
        }
        return totals;
    }
}
