package com.commerce.checkout.model;

import com.commerce.shared.fulfillment.FulfillmentMode;
import com.commerce.shared.model.StockLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CheckoutRequestTest {

    @Test
    @DisplayName("amount — sum of price times quantity")
    void amount_sumsLines() {
        CheckoutRequest request = CheckoutRequest.builder()
                .cart(List.of(CartLine.of("TSHIRT-RED-XL", 2, "799.50"), CartLine.of("HAT-BLK", 1, "399")))
                .build();

        assertThat(request.amount()).isEqualByComparingTo("1998.00");
        assertThat(request.stockLines()).containsExactly(StockLine.of("TSHIRT-RED-XL", 2), StockLine.of("HAT-BLK", 1));
        assertThat(request.fulfillmentMode()).isEqualTo(FulfillmentMode.SHIP_TO_HOME);
        assertThat(request.address()).isNotNull();
    }

    @Test
    @DisplayName("constructor — missing cart is empty, amount zero")
    void missingCartIsEmpty() {
        CheckoutRequest request = CheckoutRequest.builder().build();

        assertThat(request.cart()).isEmpty();
        assertThat(request.amount()).isEqualByComparingTo("0");
        assertThat(request.stockLines()).isEmpty();
    }

    @Test
    @DisplayName("CartLine — rejects invalid quantity and price")
    void rejectsInvalidLines() {
        assertThatThrownBy(() -> CartLine.of("HAT-BLK", 0, "399"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CartLine.of("HAT-BLK", 1, "-1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
