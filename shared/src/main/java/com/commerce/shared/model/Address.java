package com.commerce.shared.model;

/**
 * Delivery address. Only {@code city} drives any behaviour (delivery ETA).
 */
public record Address(String line1, String city, String pincode) {

    public static Address empty() {
        return new Address(null, null, null);
    }
}
