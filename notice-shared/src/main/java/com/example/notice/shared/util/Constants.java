package com.example.notice.shared.util;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String AUDIT_ENTITY_BROADCAST = "NotificationBroadcast";
    public static final String SUPER_ADMIN_ROLE = "SUPER_ADMIN";
    public static final String INBOX_LINK = "/notifications";
    public static final String EMAIL_TEMPLATE_BROADCAST = "broadcast";

    public enum BroadcastStatus {
        SCHEDULED,
        SENDING,
        SENT,
        FAILED
    }

    public enum TargetMode {
        ALL_USERS,
        COMPANY
    }

    public enum Channel {
        IN_APP,
        EMAIL,
        PUSH
    }

    public enum BroadcastType {
        INFO,
        WARNING,
        MAINTENANCE,
        CRITICAL
    }

    public enum InboxType {
        BROADCAST
    }

    public enum AuditAction {
        CREATE,
        STATUS_CHANGE,
        RETRY
    }

    public static final class PrincipalStatus {
        private PrincipalStatus() {}
        // The user and company-admin directories disagree on casing.
        public static final String USER_ACTIVE = "ACTIVE";
        public static final String COMPANY_ADMIN_ACTIVE = "active";
    }
}
