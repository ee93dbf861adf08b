package com.commerce.checkout.config;

import com.commerce.fulfillment.service.InMemoryFulfillmentService;
import com.commerce.notification.channels.impl.EmailChannel;
import com.commerce.notification.channels.impl.SmsChannel;
import com.commerce.postpurchase.service.InMemoryPostPurchaseService;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Seed data for the in-process collaborators.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "checkout.collaborators")
public class CollaboratorProperties {

    private Set<String> metroCities = new LinkedHashSet<>(InMemoryFulfillmentService.DEFAULT_METRO_CITIES);

    /** Pickup capacity per store, in preference order. */
    private Map<String, Integer> storeCapacity = new LinkedHashMap<>();

    private Map<String, Integer> loyaltyBalances = new LinkedHashMap<>();

    /** Points earned per whole currency unit spent. */
    private int loyaltyEarnRate = 1;

    private int returnWindowDays = InMemoryPostPurchaseService.DEFAULT_RETURN_WINDOW_DAYS;

    private int warrantyDays = InMemoryPostPurchaseService.DEFAULT_WARRANTY_DAYS;

    /** Customer id to email address; others get a mailbox on {@code emailDomain}. */
    private Map<String, String> customerEmails = new LinkedHashMap<>();

    private String emailDomain = EmailChannel.DEFAULT_DOMAIN;

    /** Customer id to phone number, with or without the country code. */
    private Map<String, String> customerPhones = new LinkedHashMap<>();

    private String smsCountryCode = SmsChannel.DEFAULT_COUNTRY_CODE;
}
