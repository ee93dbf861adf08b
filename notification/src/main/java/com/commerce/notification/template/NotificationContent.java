package com.commerce.notification.template;

/**
 * Rendered message. {@code sms} is the short form used by the sms channel.
 */
public record NotificationContent(String subject, String body, String sms) {
}
