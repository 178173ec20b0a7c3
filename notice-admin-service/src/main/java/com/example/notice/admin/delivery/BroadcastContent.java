package com.example.notice.admin.delivery;

import com.example.notice.shared.model.BroadcastRecord;
import com.example.notice.shared.util.Constants;
import lombok.Builder;
import lombok.Value;

/**
 * The part of a broadcast every channel renders: what to say and who it was addressed to.
 */
@Value
@Builder
public class BroadcastContent {
    Long broadcastId;
    String title;
    String message;
    String type;
    Constants.TargetMode targetMode;
    String organizationId;
    String createdBy;

    public static BroadcastContent from(BroadcastRecord broadcast) {
        return BroadcastContent.builder()
                .broadcastId(broadcast.getId())
                .title(broadcast.getTitle())
                .message(broadcast.getMessage())
                .type(broadcast.getType())
                .targetMode(Constants.TargetMode.valueOf(broadcast.getTargetMode()))
                .organizationId(broadcast.getOrganizationId())
                .createdBy(broadcast.getCreatedBy())
                .build();
    }
}
