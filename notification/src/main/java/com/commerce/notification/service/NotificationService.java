package com.commerce.notification.service;

import java.util.Map;

import com.commerce.notification.channels.NotificationChannel;
import com.commerce.notification.template.NotificationContent;
import com.commerce.notification.template.engine.TemplateEngine;
import com.commerce.shared.notification.CustomerNotification;
import com.commerce.shared.notification.CustomerNotifier;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders a template and hands it to the channel named by the notification,
 * which resolves the customer's address. Unknown channels fall back to email.
 */
@Slf4j
@RequiredArgsConstructor
public class NotificationService implements CustomerNotifier {

    private final Map<String, NotificationChannel> channels;

    @Override
    public void notify(CustomerNotification notification) {
        NotificationContent content = TemplateEngine.render(notification.templateId(), notification.variables());

        NotificationChannel channel = channels.getOrDefault(notification.channel(), channels.get(CHANNEL_EMAIL));

        String to = channel.contactFor(notification.customerId());

        int sent = channel.send(to, content);

        log.info("Notification sent: customerId={}, channel={}, template={}, messages={}",
                notification.customerId(), channel.channel(), notification.templateId(), sent);
    }
}
