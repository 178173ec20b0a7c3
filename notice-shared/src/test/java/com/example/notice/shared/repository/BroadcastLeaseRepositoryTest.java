package com.example.notice.shared.repository;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BroadcastLeaseRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime STALE_BEFORE = NOW.minusMinutes(10);

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private BroadcastLeaseRepository repository;

    @BeforeEach
    void setUp() {
        database = EmbeddedDatabases.withSchema();
        jdbcTemplate = new JdbcTemplate(database);
        repository = new BroadcastLeaseRepository(jdbcTemplate);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void claimsDueScheduledBroadcast() {
        insert(1L, "SCHEDULED", NOW.minusMinutes(1), null, null);

        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).contains(1L);
        assertThat(status(1L)).isEqualTo("SENDING");
        assertThat(owner(1L)).isEqualTo("node-a");
    }

    @Test
    void ignoresBroadcastScheduledInTheFuture() {
        insert(1L, "SCHEDULED", NOW.plusMinutes(5), null, null);

        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).isEmpty();
        assertThat(status(1L)).isEqualTo("SCHEDULED");
    }

    @Test
    void ignoresBroadcastWithFreshLease() {
        insert(1L, "SCHEDULED", NOW.minusMinutes(1), NOW.minusMinutes(2), "node-b");

        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).isEmpty();
    }

    @Test
    void reclaimsScheduledBroadcastWithStaleLease() {
        insert(1L, "SCHEDULED", NOW.minusHours(1), NOW.minusMinutes(30), "node-b");

        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).contains(1L);
        assertThat(owner(1L)).isEqualTo("node-a");
    }

    @Test
    void reclaimsSendingBroadcastWhoseHolderWentSilent() {
        insert(1L, "SENDING", NOW.minusHours(1), NOW.minusMinutes(11), "crashed-node");
        insert(2L, "SENDING", NOW.minusHours(1), NOW.minusMinutes(1), "busy-node");

        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).contains(1L);
        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).isEmpty();
        assertThat(owner(2L)).isEqualTo("busy-node");
    }

    @Test
    void neverClaimsFailedOrSentBroadcasts() {
        insert(1L, "FAILED", NOW.minusHours(1), null, null);
        insert(2L, "SENT", NOW.minusHours(1), null, null);

        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).isEmpty();
    }

    @Test
    void claimsOldestDueBroadcastFirst() {
        insert(1L, "SCHEDULED", NOW.minusMinutes(1), null, null);
        insert(2L, "SCHEDULED", NOW.minusMinutes(5), null, null);

        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).contains(2L);
        assertThat(repository.claimNextDue("node-a", NOW, STALE_BEFORE)).contains(1L);
    }

    @Test
    void exactlyOneConcurrentClaimWins() throws Exception {
        insert(1L, "SCHEDULED", NOW.minusMinutes(1), null, null);
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String owner = "node-" + i;
                attempts.add(pool.submit(() -> {
                    start.await();
                    return repository.tryClaim(1L, owner, NOW, STALE_BEFORE);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(status(1L)).isEqualTo("SENDING");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void completeDeliveryRecordsOutcomeAndReleasesLease() {
        insert(1L, "SENDING", NOW.minusMinutes(1), NOW, "node-a");

        boolean recorded = repository.completeDelivery(1L, "node-a", "SENT", NOW, "{\"inApp\":{\"created\":3}}", null, NOW);

        assertThat(recorded).isTrue();
        assertThat(status(1L)).isEqualTo("SENT");
        assertThat(owner(1L)).isNull();
        assertThat(jdbcTemplate.queryForObject("SELECT locked_at FROM notification_broadcasts WHERE id = 1",
                OffsetDateTime.class)).isNull();
        assertThat(jdbcTemplate.queryForObject("SELECT delivery FROM notification_broadcasts WHERE id = 1",
                String.class)).contains("\"created\":3");
    }

    @Test
    void completeDeliveryNeverOverwritesTerminalBroadcast() {
        insert(1L, "SENT", NOW.minusMinutes(1), null, null);
        insert(2L, "FAILED", NOW.minusMinutes(1), null, null);

        assertThat(repository.completeDelivery(1L, "node-a", "FAILED", null, "{}", "IN_APP failed: boom", NOW)).isFalse();
        assertThat(repository.completeDelivery(2L, "node-a", "SENT", NOW, "{}", null, NOW)).isFalse();

        assertThat(status(1L)).isEqualTo("SENT");
        assertThat(jdbcTemplate.queryForObject("SELECT last_error FROM notification_broadcasts WHERE id = 1",
                String.class)).isNull();
        assertThat(status(2L)).isEqualTo("FAILED");
    }

    @Test
    void holderWhoseLeaseWasReclaimedCannotRecordOutcome() {
        insert(1L, "SENDING", NOW.minusHours(1), NOW.minusMinutes(20), "node-a");
        assertThat(repository.tryClaim(1L, "node-b", NOW, STALE_BEFORE)).isTrue();

        boolean slowHolderRecorded = repository.completeDelivery(1L, "node-a", "FAILED", null, "{}",
                "PUSH failed: timeout", NOW.plusSeconds(5));

        assertThat(slowHolderRecorded).isFalse();
        assertThat(status(1L)).isEqualTo("SENDING");
        assertThat(owner(1L)).isEqualTo("node-b");

        assertThat(repository.completeDelivery(1L, "node-b", "SENT", NOW.plusSeconds(10), "{}", null,
                NOW.plusSeconds(10))).isTrue();
        assertThat(status(1L)).isEqualTo("SENT");
        assertThat(repository.completeDelivery(1L, "node-a", "FAILED", null, "{}", "late", NOW.plusSeconds(20)))
                .isFalse();
        assertThat(status(1L)).isEqualTo("SENT");
    }

    @Test
    void reopenFailedOnlyMovesFailedBroadcasts() {
        insert(1L, "FAILED", NOW.minusMinutes(1), null, null);
        insert(2L, "SENT", NOW.minusMinutes(1), null, null);

        assertThat(repository.reopenFailed(1L, "node-a", NOW)).isTrue();
        assertThat(repository.reopenFailed(1L, "node-a", NOW)).isFalse();
        assertThat(repository.reopenFailed(2L, "node-a", NOW)).isFalse();
        assertThat(status(1L)).isEqualTo("SENDING");
        assertThat(owner(1L)).isEqualTo("node-a");
    }

    private void insert(Long id, String status, OffsetDateTime scheduledAt, OffsetDateTime lockedAt, String lockOwner) {
        jdbcTemplate.update("""
                INSERT INTO notification_broadcasts
                    (id, title, message, type, target_mode, channels, scheduled_at, status, created_by,
                     created_at, updated_at, locked_at, lock_owner)
                VALUES (?, 'Title', 'Body', 'INFO', 'ALL_USERS', '["IN_APP"]', ?, ?, 'admin-1', ?, ?, ?, ?)
                """, id, scheduledAt, status, NOW.minusDays(1), NOW.minusDays(1), lockedAt, lockOwner);
    }

    private String status(Long id) {
        return jdbcTemplate.queryForObject("SELECT status FROM notification_broadcasts WHERE id = ?", String.class, id);
    }

    private String owner(Long id) {
        return jdbcTemplate.queryForObject("SELECT lock_owner FROM notification_broadcasts WHERE id = ?", String.class, id);
    }
}
