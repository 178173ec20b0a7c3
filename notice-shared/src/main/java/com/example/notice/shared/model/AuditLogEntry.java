package com.example.notice.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("audit_logs")
public class AuditLogEntry {
    @Id
    private Long id;
    private String actorId;
    private String entityType;
    private String entityId;
    private String action;
    private String diff;
    private OffsetDateTime createdAt;
}
