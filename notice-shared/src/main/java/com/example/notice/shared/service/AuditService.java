package com.example.notice.shared.service;

import com.example.notice.shared.model.AuditLogEntry;
import com.example.notice.shared.repository.AuditLogRepository;
import com.example.notice.shared.util.Constants;
import com.example.notice.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    /**
     * Appends one audit entry. The diff is optional and stored as JSON.
     */
    public AuditLogEntry log(String actorId, String entityType, String entityId,
                             Constants.AuditAction action, Map<String, ?> diff) {
        AuditLogEntry entry = AuditLogEntry.builder()
                .actorId(actorId)
                .entityType(entityType)
                .entityId(entityId)
                .action(action.name())
                .diff(diff == null ? null : JsonUtils.toJson(diff))
                .createdAt(OffsetDateTime.now(clock))
                .build();
        AuditLogEntry saved = auditLogRepository.save(entry);
        log.debug("Audit {} {} {} by {}", action, entityType, entityId, actorId);
        return saved;
    }
}
