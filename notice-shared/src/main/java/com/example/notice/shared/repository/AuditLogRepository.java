package com.example.notice.shared.repository;

import com.example.notice.shared.model.AuditLogEntry;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuditLogRepository extends CrudRepository<AuditLogEntry, Long> {
}
