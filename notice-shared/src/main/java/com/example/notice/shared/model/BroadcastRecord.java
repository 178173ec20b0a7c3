package com.example.notice.shared.model;

import com.example.notice.shared.util.Constants;
import com.example.notice.shared.util.JsonUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * A broadcast job created by a super administrator.
 * Holds the content, the requested channels, the lease used for distributed claiming and the
 * per-channel outcome of the last delivery run. Rows are never deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
@Table("notification_broadcasts")
public class BroadcastRecord {
    @Id
    private Long id;
    private String title;
    private String message;
    private String type;
    private String targetMode;
    private String organizationId;
    /** JSON array of {@link Constants.Channel} names. */
    private String channels;
    private OffsetDateTime scheduledAt;
    private String status;
    private String createdBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime sentAt;
    /** JSON form of {@link DeliveryReport}. */
    private String delivery;
    private String lastError;
    private OffsetDateTime lockedAt;
    private String lockOwner;

    public Set<Constants.Channel> requestedChannels() {
        Set<Constants.Channel> requested = EnumSet.noneOf(Constants.Channel.class);
        JsonUtils.parseJsonArray(channels).forEach(name -> requested.add(Constants.Channel.valueOf(name)));
        return requested;
    }

    public boolean alreadySent() {
        return Constants.BroadcastStatus.SENT.name().equals(status);
    }

    public boolean isLeasedBy(String owner) {
        return Constants.BroadcastStatus.SENDING.name().equals(status) && owner != null && owner.equals(lockOwner);
    }
}
