package com.example.notice.admin.delivery;

import com.example.notice.shared.util.Constants;

import java.util.regex.Pattern;

/**
 * Names the push topic a broadcast audience is subscribed to.
 */
public final class PushTopics {

    public static final String ALL_USERS = "all_users";
    public static final String COMPANY_PREFIX = "company_";

    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-zA-Z0-9\\-_~%.]");
    private static final Pattern VALID_TOPIC = Pattern.compile("[a-zA-Z0-9\\-_~%.]{1,900}");

    private PushTopics() {}

    public static String forTarget(Constants.TargetMode targetMode, String organizationId) {
        if (targetMode == Constants.TargetMode.ALL_USERS) {
            return ALL_USERS;
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId is required for a COMPANY push topic");
        }
        String topic = COMPANY_PREFIX + sanitize(organizationId);
        if (!VALID_TOPIC.matcher(topic).matches()) {
            throw new IllegalArgumentException("Invalid push topic: " + topic);
        }
        return topic;
    }

    static String sanitize(String value) {
        return INVALID_CHARS.matcher(value).replaceAll("_");
    }
}
