package com.commerce.shared.postpurchase;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Return lifecycle as far as the store tracks it. Returns inside the window are
 * approved on creation; receipt and refund happen in the warehouse flow.
 */
public enum ReturnState {
    APPROVED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
