package com.commerce.shared.payment;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentMethod {
    CARD,
    UPI,
    GIFT_CARD,
    POS;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
