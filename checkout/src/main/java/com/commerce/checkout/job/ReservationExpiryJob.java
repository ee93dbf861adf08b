package com.commerce.checkout.job;

import com.commerce.inventory.service.InventoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Returns stock held by reservations whose hold has lapsed, such as those
 * left behind by checkouts that ended PENDING and were never confirmed.
 */
@Component
@RequiredArgsConstructor
public class ReservationExpiryJob {

    private final InventoryService inventoryService;

    @Scheduled(fixedDelayString = "${checkout.inventory.expiry-sweep-interval-ms:30000}")
    public void sweep() {
        inventoryService.releaseExpired();
    }
}
