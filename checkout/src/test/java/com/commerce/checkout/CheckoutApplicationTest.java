package com.commerce.checkout;

import com.commerce.checkout.model.CartLine;
import com.commerce.checkout.model.CheckoutRequest;
import com.commerce.checkout.model.CheckoutResult;
import com.commerce.checkout.saga.CheckoutSaga;
import com.commerce.inventory.ledger.InventoryLedger;
import com.commerce.shared.model.Address;
import com.commerce.shared.payment.PaymentDetails;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * Integration Test: full application context
 *
 * Reservations are held for zero minutes and the expiry sweep runs every
 * 100ms, so a PENDING checkout's hold is returned almost immediately.
 */
@SpringBootTest(properties = {
        "checkout.inventory.default-hold=0s",
        "checkout.inventory.expiry-sweep-interval-ms=100"
})
class CheckoutApplicationTest {

    @Autowired CheckoutSaga checkoutSaga;
    @Autowired InventoryLedger ledger;
    @Autowired MeterRegistry meterRegistry;

    @Test
    @DisplayName("context — seeds stock from configuration")
    void seedsStock() {
        assertThat(ledger.get("TSHIRT-RED-XL").orElseThrow().locations())
                .containsEntry("STORE_1", 5)
                .containsEntry("WAREHOUSE", 5);
        assertThat(ledger.get("HAT-BLK").orElseThrow().quantity()).isEqualTo(15);
    }

    @Test
    @DisplayName("pending checkout — expiry sweep returns the held stock")
    void pendingCheckout_holdExpires() {
        int before = ledger.get("JEANS-BLK-32").orElseThrow().quantity();

        CheckoutResult result = checkoutSaga.checkout(CheckoutRequest.builder()
                .customerId("cust_002")
                .cart(List.of(CartLine.of("JEANS-BLK-32", 1, "1999")))
                .payment(PaymentDetails.upi("bob@okbank"))
                .address(new Address("2 Park Street", "Kolkata", "700016"))
                .build());

        assertThat(result.isPending()).isTrue();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(ledger.activeReservations()).isEmpty();
            assertThat(ledger.get("JEANS-BLK-32").orElseThrow().quantity()).isEqualTo(before);
        });
        assertThat(meterRegistry.counter("checkout.saga.pending").count()).isGreaterThanOrEqualTo(1.0);
    }
}
