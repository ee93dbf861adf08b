package com.commerce.checkout.model;

import com.commerce.shared.fulfillment.FulfillmentMode;
import com.commerce.shared.model.Address;
import com.commerce.shared.model.StockLine;
import com.commerce.shared.payment.PaymentDetails;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input to one checkout call. A null cart is treated as empty.
 *
 * @param sessionId          caller session, generated when null
 * @param customerId         may be null for guest checkout; loyalty issue and notifications are then skipped
 * @param preferredLocation  stock location to report availability for, may be null
 * @param storeId            pickup store for click-and-collect, may be null
 * @param preferenceCategory category boosted by recommendations, may be null
 */
@Builder
public record CheckoutRequest(String sessionId,
                              String customerId,
                              List<CartLine> cart,
                              PaymentDetails payment,
                              Address address,
                              String preferredLocation,
                              FulfillmentMode fulfillmentMode,
                              String storeId,
                              String preferenceCategory) {

    public CheckoutRequest {
        // An empty cart is a checkout failure, not a construction error
        cart = cart == null ? List.of() : List.copyOf(cart);
        address = address == null ? Address.empty() : address;
        fulfillmentMode = fulfillmentMode == null ? FulfillmentMode.SHIP_TO_HOME : fulfillmentMode;
    }

    public BigDecimal amount() {
        return cart.stream().map(CartLine::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<StockLine> stockLines() {
        return cart.stream().map(CartLine::toStockLine).toList();
    }
}
