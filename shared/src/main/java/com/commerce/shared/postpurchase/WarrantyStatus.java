package com.commerce.shared.postpurchase;

import java.time.LocalDate;

public record WarrantyStatus(String sku, boolean warrantyValid, LocalDate warrantyExpiresOn) {
}
