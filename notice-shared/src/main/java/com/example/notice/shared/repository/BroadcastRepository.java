package com.example.notice.shared.repository;

import com.example.notice.shared.model.BroadcastRecord;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Plain create/read access to broadcast rows. Every state transition after creation goes through
 * {@link BroadcastLeaseRepository}, never through {@code save}.
 */
@Repository
public interface BroadcastRepository extends CrudRepository<BroadcastRecord, Long> {

    @Query("""
        SELECT * FROM notification_broadcasts
        WHERE (CAST(:status AS VARCHAR(32)) IS NULL OR status = :status)
          AND (CAST(:targetMode AS VARCHAR(32)) IS NULL OR target_mode = :targetMode)
          AND (CAST(:organizationId AS VARCHAR(255)) IS NULL OR organization_id = :organizationId)
        ORDER BY created_at DESC, id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<BroadcastRecord> search(@Param("status") String status,
                                 @Param("targetMode") String targetMode,
                                 @Param("organizationId") String organizationId,
                                 @Param("limit") int limit,
                                 @Param("offset") long offset);

    @Query("""
        SELECT COUNT(*) FROM notification_broadcasts
        WHERE (CAST(:status AS VARCHAR(32)) IS NULL OR status = :status)
          AND (CAST(:targetMode AS VARCHAR(32)) IS NULL OR target_mode = :targetMode)
          AND (CAST(:organizationId AS VARCHAR(255)) IS NULL OR organization_id = :organizationId)
    """)
    long countMatching(@Param("status") String status,
                       @Param("targetMode") String targetMode,
                       @Param("organizationId") String organizationId);
}
