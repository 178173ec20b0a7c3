package com.example.notice.shared.repository;

import com.example.notice.shared.model.InboxNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionOperations;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

@Slf4j
@Repository
@RequiredArgsConstructor
public class InboxNotificationRepository {

    private static final String INSERT_SQL = """
        INSERT INTO inbox_notifications
            (user_id, company_id, broadcast_id, type, title, description, link, is_read, is_broadcast,
             target_mode, created_by, metadata, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionOperations transactionOperations;

    /**
     * Inserts one batch of inbox rows without letting a bad row take the others down with it.
     * The batch is first written as a single JDBC batch inside one transaction; if that fails the
     * transaction is rolled back, each row is retried on its own and rows that still fail are logged
     * and skipped.
     *
     * @return the number of rows actually created
     */
    public int insertUnordered(Long broadcastId, List<InboxNotification> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        try {
            Integer inserted = transactionOperations.execute(status -> countInserted(
                    jdbcTemplate.batchUpdate(INSERT_SQL, rows, rows.size(),
                            (PreparedStatement ps, InboxNotification row) -> bind(ps, broadcastId, row))));
            return inserted == null ? 0 : inserted;
        } catch (DataAccessException batchFailure) {
            log.warn("Batch insert of {} inbox rows for broadcast {} failed, retrying row by row: {}",
                    rows.size(), broadcastId, batchFailure.getMessage());
        }

        int created = 0;
        for (InboxNotification row : rows) {
            try {
                created += jdbcTemplate.update(INSERT_SQL, ps -> bind(ps, broadcastId, row));
            } catch (DataAccessException rowFailure) {
                log.warn("Skipping inbox row for user {} of broadcast {}: {}",
                        row.getUserId(), broadcastId, rowFailure.getMessage());
            }
        }
        return created;
    }

    private static void bind(PreparedStatement ps, Long broadcastId, InboxNotification row) throws SQLException {
        ps.setString(1, row.getUserId());
        ps.setString(2, row.getCompanyId());
        ps.setObject(3, broadcastId);
        ps.setString(4, row.getType());
        ps.setString(5, row.getTitle());
        ps.setString(6, row.getDescription());
        ps.setString(7, row.getLink());
        ps.setBoolean(8, row.isRead());
        ps.setBoolean(9, row.isBroadcast());
        ps.setString(10, row.getTargetMode());
        ps.setString(11, row.getCreatedBy());
        ps.setString(12, row.getMetadata());
        ps.setObject(13, row.getCreatedAt());
    }

    private static int countInserted(int[][] counts) {
        int inserted = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                // some drivers report SUCCESS_NO_INFO instead of a row count
                inserted += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0);
            }
        }
        return inserted;
    }
}
