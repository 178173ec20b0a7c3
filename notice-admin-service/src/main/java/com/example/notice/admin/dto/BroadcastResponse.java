package com.example.notice.admin.dto;

import com.example.notice.shared.model.DeliveryReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastResponse {
    private Long id;
    private String title;
    private String message;
    private String type;
    private String targetMode;
    private String organizationId;
    private List<String> channels;
    private OffsetDateTime scheduledAt;
    private String status;
    private String createdBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime sentAt;
    private DeliveryReport delivery;
    private String lastError;
}
