package com.commerce.shared.fulfillment;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FulfillmentMode {
    SHIP_TO_HOME,
    CLICK_AND_COLLECT;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
