package com.commerce.notification.channels;

import com.commerce.notification.template.NotificationContent;

/**
 * One delivery route to a customer.
 */
public interface NotificationChannel {

    String channel();

    /** Address this channel reaches the customer at. */
    String contactFor(String customerId);

    /**
     * Hands the rendered message to the provider.
     *
     * @return how many provider messages were sent
     */
    int send(String to, NotificationContent content);
}
