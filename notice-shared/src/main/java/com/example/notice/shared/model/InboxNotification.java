package com.example.notice.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A denormalized in-app inbox row, one per recipient of a broadcast.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboxNotification {
    private String userId;
    private String companyId;
    private String type;
    private String title;
    private String description;
    private String link;
    @Builder.Default
    private boolean read = false;
    @Builder.Default
    private boolean broadcast = true;
    private String targetMode;
    private String createdBy;
    /** JSON object referencing the source broadcast. */
    private String metadata;
    private OffsetDateTime createdAt;
}
