package com.commerce.shared.payment;

public enum TransactionStatus {
    AUTHORIZED,
    PENDING,
    CAPTURED
}
