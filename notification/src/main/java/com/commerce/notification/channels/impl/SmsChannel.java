package com.commerce.notification.channels.impl;

import com.commerce.notification.channels.NotificationChannel;
import com.commerce.notification.template.NotificationContent;
import com.commerce.shared.notification.CustomerNotifier;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sends the short form, split into provider-sized parts. Numbers are
 * normalized to international form; customers missing from the phone book
 * get a number derived from their id.
 */
@Slf4j
public class SmsChannel implements NotificationChannel {

    public static final String DEFAULT_COUNTRY_CODE = "+91";
    static final int SEGMENT_LENGTH = 160;

    private final Map<String, String> phoneBook;
    private final String countryCode;

    public SmsChannel(Map<String, String> phoneBook, String countryCode) {
        this.phoneBook = Map.copyOf(phoneBook);
        this.countryCode = countryCode;
    }

    @Override public String channel() { return CustomerNotifier.CHANNEL_SMS; }

    @Override
    public String contactFor(String customerId) {
        String listed = phoneBook.get(customerId);
        if (listed == null) {
            return countryCode + Math.floorMod(customerId.hashCode(), 10_000_000);
        }
        String digits = listed.replaceAll("[\\s()-]", "");
        return digits.startsWith("+") ? digits : countryCode + digits.replaceFirst("^0+", "");
    }

    @Override
    public int send(String to, NotificationContent content) {
        String text = content.sms();
        int segments = Math.max(1, (text.length() + SEGMENT_LENGTH - 1) / SEGMENT_LENGTH);
        for (int i = 0; i < segments; i++) {
            String part = text.substring(i * SEGMENT_LENGTH, Math.min(text.length(), (i + 1) * SEGMENT_LENGTH));
            log.info("[SMS] To: {}, Part: {}/{}, Body: {}", to, i + 1, segments, part);
        }
        return segments;
    }
}
