package com.commerce.inventory.repository;

import com.commerce.inventory.domain.Reservation;
import com.commerce.inventory.domain.StockEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory storage for stock entries and active reservations.
 *
 * Individual reads and writes are thread-safe; compound read-modify-write
 * sequences must be serialized by the owner (see {@code InventoryLedger}).
 */
public class StockStore {

    private final ConcurrentMap<String, StockEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Reservation> reservations = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> reservationIdByOrder = new ConcurrentHashMap<>();

    public static StockStore seededWith(Collection<StockEntry> seed) {
        StockStore store = new StockStore();
        seed.forEach(store::put);
        return store;
    }

    // ─── Stock ────────────────────────────────────────────────────────────────

    public Optional<StockEntry> find(String sku) {
        return Optional.ofNullable(entries.get(sku));
    }

    public void put(StockEntry entry) {
        entries.put(entry.sku(), entry);
    }

    /** Point-in-time copy keyed by SKU. Each entry is internally consistent. */
    public SortedMap<String, StockEntry> entries() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    // ─── Reservations ─────────────────────────────────────────────────────────

    public Optional<Reservation> findReservation(String reservationId) {
        return Optional.ofNullable(reservations.get(reservationId));
    }

    public Optional<Reservation> findActiveReservationForOrder(String orderId) {
        String reservationId = reservationIdByOrder.get(orderId);
        return reservationId == null ? Optional.empty() : findReservation(reservationId);
    }

    public void saveReservation(Reservation reservation) {
        reservations.put(reservation.reservationId(), reservation);
        reservationIdByOrder.put(reservation.orderId(), reservation.reservationId());
    }

    public Optional<Reservation> removeReservation(String reservationId) {
        Reservation removed = reservations.remove(reservationId);
        if (removed != null) {
            reservationIdByOrder.remove(removed.orderId(), reservationId);
        }
        return Optional.ofNullable(removed);
    }

    public List<Reservation> reservations() {
        List<Reservation> all = new ArrayList<>(reservations.values());
        all.sort(Comparator.comparing(Reservation::createdAt).thenComparing(Reservation::reservationId));
        return Collections.unmodifiableList(all);
    }

    public Map<String, Integer> totals() {
        Map<String, Integer> totals = new TreeMap<>();
        entries.forEach((sku, entry) -> totals.put(sku, entry.quantity()));
        return totals;
    }
}
