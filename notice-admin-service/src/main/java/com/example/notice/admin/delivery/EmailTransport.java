package com.example.notice.admin.delivery;

import java.util.Map;

/**
 * Outbound mail. Returns normally on success and throws on any failure.
 */
public interface EmailTransport {

    void send(String to, String subject, String template, Map<String, String> data);
}
