package com.example.notice.admin.delivery;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A notification addressed to every device subscribed to one topic.
 */
@Value
@Builder
public class PushMessage {
    String title;
    String body;
    Map<String, String> data;
}
