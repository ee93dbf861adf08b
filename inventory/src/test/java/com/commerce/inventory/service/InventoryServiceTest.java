package com.commerce.inventory.service;

import com.commerce.inventory.domain.AvailabilityReport;
import com.commerce.inventory.domain.Reservation;
import com.commerce.inventory.domain.StockEntry;
import com.commerce.inventory.ledger.InventoryLedger;
import com.commerce.inventory.repository.StockStore;
import com.commerce.shared.model.StockLine;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InventoryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    SimpleMeterRegistry meterRegistry;
    InventoryLedger ledger;
    InventoryService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ledger = new InventoryLedger(StockStore.seededWith(List.of(
                StockEntry.of("TSHIRT-RED-XL", Map.of("STORE_1", 5, "WAREHOUSE", 5)),
                StockEntry.of("TSHIRT-BLUE-M", Map.of("WAREHOUSE", 0)))),
                Clock.fixed(NOW, ZoneOffset.UTC));
        service = new InventoryService(ledger, meterRegistry, Duration.ofMinutes(15));
    }

    private static <R extends InventoryRequest> Task<R> task(R request) {
        return Task.of("sess_1", "cust_001", request);
    }

    @Test
    @DisplayName("check — all available is success with the report")
    void check_success() {
        TaskResult<AvailabilityReport> result = service.check(task(
                new InventoryRequest.Check(List.of(StockLine.of("TSHIRT-RED-XL", 2)), null)));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.payload().allAvailable()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("check — unavailable item fails with report and a recommendation hint, no errors")
    void check_unavailable() {
        TaskResult<AvailabilityReport> result = service.check(task(
                new InventoryRequest.Check(List.of(StockLine.of("TSHIRT-BLUE-M", 1)), null)));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.payload().unavailableSkus()).containsExactly("TSHIRT-BLUE-M");
        assertThat(result.errors()).isEmpty();
        assertThat(result.nextActions()).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(NextAction.Type.CALL_COMPONENT);
            assertThat(action.data()).containsEntry("component", "recommendation");
        });
    }

    @Test
    @DisplayName("check — empty items is MISSING_FIELDS")
    void check_missingItems() {
        TaskResult<AvailabilityReport> result = service.check(task(new InventoryRequest.Check(List.of(), null)));

        assertThat(result.firstErrorCode()).contains(ErrorCodes.MISSING_FIELDS);
    }

    @Test
    @DisplayName("reserve — success uses the default hold and counts the reservation")
    void reserve_success() {
        TaskResult<Reservation> result = service.reserve(task(
                new InventoryRequest.Reserve("order_1", List.of(StockLine.of("TSHIRT-RED-XL", 3)), null)));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.payload().hold()).isEqualTo(Duration.ofMinutes(15));
        assertThat(meterRegistry.counter("inventory.reservations.created").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("reserve — explicit hold minutes win over the default")
    void reserve_explicitHold() {
        TaskResult<Reservation> result = service.reserve(task(
                new InventoryRequest.Reserve("order_1", List.of(StockLine.of("TSHIRT-RED-XL", 1)), 45)));

        assertThat(result.payload().expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(45)));
    }

    @Test
    @DisplayName("reserve — insufficient stock yields one error per SKU and a restock hint")
    void reserve_insufficient() {
        TaskResult<Reservation> result = service.reserve(task(new InventoryRequest.Reserve("order_1",
                List.of(StockLine.of("TSHIRT-RED-XL", 11), StockLine.of("TSHIRT-BLUE-M", 1)), null)));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.errors()).extracting(ErrorDetail::code)
                .containsExactly(ErrorCodes.INSUFFICIENT_STOCK, ErrorCodes.INSUFFICIENT_STOCK);
        assertThat(result.errors().get(0).details()).containsEntry("sku", "TSHIRT-RED-XL")
                .containsEntry("available", 10);
        assertThat(result.nextActions()).allSatisfy(action ->
                assertThat(action.data()).containsEntry("component", "inventory-manager"));
        assertThat(meterRegistry.counter("inventory.reservations.rejected").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("reserve — overflowing repeated lines are a structured INSUFFICIENT_STOCK failure")
    void reserve_overflowingLines() {
        TaskResult<Reservation> result = service.reserve(task(new InventoryRequest.Reserve("order_1", List.of(
                StockLine.of("TSHIRT-RED-XL", 1),
                StockLine.of("TSHIRT-BLUE-M", Integer.MAX_VALUE),
                StockLine.of("TSHIRT-BLUE-M", Integer.MAX_VALUE)), null)));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.firstErrorCode()).contains(ErrorCodes.INSUFFICIENT_STOCK);
        assertThat(result.errors().get(0).details()).containsEntry("requested", 2L * Integer.MAX_VALUE);
        assertThat(ledger.get("TSHIRT-RED-XL").orElseThrow().quantity()).isEqualTo(10);
        assertThat(ledger.activeReservations()).isEmpty();
    }

    @Test
    @DisplayName("reserve — second reserve for an order is DUPLICATE_RESERVATION")
    void reserve_duplicate() {
        service.reserve(task(new InventoryRequest.Reserve("order_1", List.of(StockLine.of("TSHIRT-RED-XL", 1)), null)));

        TaskResult<Reservation> again = service.reserve(task(
                new InventoryRequest.Reserve("order_1", List.of(StockLine.of("TSHIRT-RED-XL", 1)), null)));

        assertThat(again.firstErrorCode()).contains(ErrorCodes.DUPLICATE_RESERVATION);
        assertThat(ledger.get("TSHIRT-RED-XL").orElseThrow().quantity()).isEqualTo(9);
    }

    @Test
    @DisplayName("reserve — missing order id is MISSING_FIELDS")
    void reserve_missingOrderId() {
        TaskResult<Reservation> result = service.reserve(task(
                new InventoryRequest.Reserve(null, List.of(StockLine.of("TSHIRT-RED-XL", 1)), null)));

        assertThat(result.firstErrorCode()).contains(ErrorCodes.MISSING_FIELDS);
    }

    @Test
    @DisplayName("release — succeeds once, then INVALID_RESERVATION")
    void release_oneShot() {
        Reservation reservation = service.reserve(task(new InventoryRequest.Reserve("order_1",
                List.of(StockLine.of("TSHIRT-RED-XL", 4)), null))).payload();

        TaskResult<Reservation> first = service.release(task(new InventoryRequest.Release(reservation.reservationId())));
        TaskResult<Reservation> second = service.release(task(new InventoryRequest.Release(reservation.reservationId())));

        assertThat(first.isSuccess()).isTrue();
        assertThat(second.firstErrorCode()).contains(ErrorCodes.INVALID_RESERVATION);
        assertThat(ledger.get("TSHIRT-RED-XL").orElseThrow().quantity()).isEqualTo(10);
    }

    @Test
    @DisplayName("release — null id is INVALID_RESERVATION")
    void release_nullId() {
        assertThat(service.release(task(new InventoryRequest.Release(null))).firstErrorCode())
                .contains(ErrorCodes.INVALID_RESERVATION);
    }

    @Test
    @DisplayName("consume — settles once, then INVALID_RESERVATION")
    void consume_settlesOnce() {
        Reservation reservation = service.reserve(task(
                new InventoryRequest.Reserve("order_1", List.of(StockLine.of("TSHIRT-RED-XL", 3)), null))).payload();

        assertThat(service.consume(task(new InventoryRequest.Consume(reservation.reservationId()))).isSuccess()).isTrue();
        assertThat(service.consume(task(new InventoryRequest.Consume(reservation.reservationId()))).firstErrorCode())
                .contains(ErrorCodes.INVALID_RESERVATION);
        assertThat(ledger.get("TSHIRT-RED-XL").orElseThrow().quantity()).isEqualTo(7);
    }

    @Test
    @DisplayName("renew — live hold gets the default extension, unknown id is INVALID_RESERVATION")
    void renew_defaultsAndRejects() {
        Reservation reservation = service.reserve(task(
                new InventoryRequest.Reserve("order_1", List.of(StockLine.of("TSHIRT-RED-XL", 1)), 5))).payload();

        TaskResult<Reservation> renewed = service.renew(task(new InventoryRequest.Renew(reservation.reservationId(), null)));

        assertThat(renewed.isSuccess()).isTrue();
        assertThat(renewed.payload().expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(service.renew(task(new InventoryRequest.Renew("res_missing", null))).firstErrorCode())
                .contains(ErrorCodes.INVALID_RESERVATION);
        assertThat(service.renew(task(new InventoryRequest.Renew(" ", null))).firstErrorCode())
                .contains(ErrorCodes.INVALID_RESERVATION);
    }

    @Test
    @DisplayName("get — single SKU, all SKUs, and unknown SKU")
    void get_entries() {
        assertThat(service.get(task(new InventoryRequest.Get("TSHIRT-RED-XL"))).payload().entries())
                .singleElement().extracting(StockEntry::quantity).isEqualTo(10);
        assertThat(service.get(task(new InventoryRequest.Get(null))).payload().entries()).hasSize(2);
        assertThat(service.get(task(new InventoryRequest.Get("NOPE"))).firstErrorCode())
                .contains(ErrorCodes.SKU_NOT_FOUND);
    }

    @Test
    @DisplayName("releaseExpired — zero-minute holds are released by the sweep")
    void releaseExpired_sweeps() {
        service.reserve(task(new InventoryRequest.Reserve("order_1", List.of(StockLine.of("TSHIRT-RED-XL", 2)), 0)));

        assertThat(service.releaseExpired()).isEqualTo(1);
        assertThat(ledger.get("TSHIRT-RED-XL").orElseThrow().quantity()).isEqualTo(10);
        assertThat(meterRegistry.counter("inventory.reservations.released").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("LedgerAvailabilityLookup — reads totals, zero for unknown SKUs")
    void availabilityLookup() {
        LedgerAvailabilityLookup lookup = new LedgerAvailabilityLookup(ledger);

        assertThat(lookup.availableQuantity("TSHIRT-RED-XL")).isEqualTo(10);
        assertThat(lookup.availableQuantity("NOPE")).isZero();
    }
}
