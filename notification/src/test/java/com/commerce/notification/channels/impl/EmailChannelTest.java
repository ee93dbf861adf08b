package com.commerce.notification.channels.impl;

import com.commerce.notification.template.NotificationContent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EmailChannelTest {

    private final EmailChannel channel = new EmailChannel(Map.of("cust_001", "alice@example.com"), "shop.test");

    @Test
    @DisplayName("contactFor — address book first, then a mailbox on the fallback domain")
    void contactFor_addressBookThenDomain() {
        assertThat(channel.contactFor("cust_001")).isEqualTo("alice@example.com");
        assertThat(channel.contactFor("cust_404")).isEqualTo("cust_404@shop.test");
    }

    @Test
    @DisplayName("send — one message per notification, malformed address rejected")
    void send_validatesAddress() {
        NotificationContent content = new NotificationContent("Subject", "Body", "Short");

        assertThat(channel.send("alice@example.com", content)).isEqualTo(1);
        assertThatThrownBy(() -> channel.send("alice", content)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> channel.send("alice@", content)).isInstanceOf(IllegalArgumentException.class);
    }
}
