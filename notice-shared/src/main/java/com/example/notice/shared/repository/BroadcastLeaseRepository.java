package com.example.notice.shared.repository;

import com.example.notice.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Lease and status transitions of broadcast rows.
 * <p>
 * Every method here is a single conditional UPDATE whose WHERE clause carries the expected current
 * state, so the row count alone tells the caller whether it won. Candidate ids are looked up with a
 * plain SELECT, but ownership is only ever decided by the UPDATE.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class BroadcastLeaseRepository {

    private static final String SCHEDULED = Constants.BroadcastStatus.SCHEDULED.name();
    private static final String SENDING = Constants.BroadcastStatus.SENDING.name();
    private static final String FAILED = Constants.BroadcastStatus.FAILED.name();

    private static final int CANDIDATE_WINDOW = 20;

    // due SCHEDULED rows with no lease or a stale one, plus SENDING rows whose holder went silent
    private static final String CLAIMABLE = """
        ((status = ? AND scheduled_at <= ? AND (locked_at IS NULL OR locked_at < ?))
          OR (status = ? AND locked_at < ?))
        """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Claims one due broadcast for {@code owner}: sets status SENDING and stamps the lease in a
     * single statement.
     *
     * @return the id of the claimed broadcast, or empty when nothing claimable is left
     */
    public Optional<Long> claimNextDue(String owner, OffsetDateTime now, OffsetDateTime staleBefore) {
        for (Long candidateId : findClaimCandidateIds(now, staleBefore, CANDIDATE_WINDOW)) {
            if (tryClaim(candidateId, owner, now, staleBefore)) {
                return Optional.of(candidateId);
            }
        }
        return Optional.empty();
    }

    List<Long> findClaimCandidateIds(OffsetDateTime now, OffsetDateTime staleBefore, int limit) {
        String sql = "SELECT id FROM notification_broadcasts WHERE " + CLAIMABLE
                + " ORDER BY scheduled_at, id LIMIT ?";
        return jdbcTemplate.queryForList(sql, Long.class,
                SCHEDULED, now, staleBefore, SENDING, staleBefore, limit);
    }

    /**
     * Attempts to take the lease on one specific broadcast.
     *
     * @return true only for the single caller whose update matched the row
     */
    public boolean tryClaim(Long id, String owner, OffsetDateTime now, OffsetDateTime staleBefore) {
        String sql = "UPDATE notification_broadcasts SET status = ?, locked_at = ?, lock_owner = ?, updated_at = ? "
                + "WHERE id = ? AND " + CLAIMABLE;
        try {
            int updated = jdbcTemplate.update(sql,
                    SENDING, now, owner, now, id,
                    SCHEDULED, now, staleBefore, SENDING, staleBefore);
            return updated == 1;
        } catch (ConcurrencyFailureException e) {
            // another instance holds the row lock; it is the winner
            log.debug("Lost claim race for broadcast {}: {}", id, e.getMessage());
            return false;
        }
    }

    /**
     * Writes the outcome of a delivery run and releases the lease. Only the current lease holder of a
     * SENDING broadcast can record an outcome; a holder whose lease was reclaimed matches nothing.
     *
     * @return true if the outcome was recorded, false if {@code owner} no longer holds the lease
     */
    public boolean completeDelivery(Long id, String owner, String status, OffsetDateTime sentAt,
                                    String deliveryJson, String lastError, OffsetDateTime now) {
        String sql = """
            UPDATE notification_broadcasts
            SET status = ?, sent_at = COALESCE(?, sent_at), delivery = ?, last_error = ?,
                locked_at = NULL, lock_owner = NULL, updated_at = ?
            WHERE id = ? AND status = ? AND lock_owner = ?
            """;
        return jdbcTemplate.update(sql, status, sentAt, deliveryJson, lastError, now, id, SENDING, owner) == 1;
    }

    /**
     * Moves a FAILED broadcast back to SENDING under a fresh lease for a manual retry.
     *
     * @return false if the broadcast was not FAILED
     */
    public boolean reopenFailed(Long id, String owner, OffsetDateTime now) {
        String sql = "UPDATE notification_broadcasts SET status = ?, locked_at = ?, lock_owner = ?, updated_at = ? "
                + "WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql, SENDING, now, owner, now, id, FAILED) == 1;
    }
}
