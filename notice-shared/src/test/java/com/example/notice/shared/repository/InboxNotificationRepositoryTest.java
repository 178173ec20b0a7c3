package com.example.notice.shared.repository;

import com.example.notice.shared.model.InboxNotification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InboxNotificationRepositoryTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private InboxNotificationRepository repository;

    @BeforeEach
    void setUp() {
        database = EmbeddedDatabases.withSchema();
        jdbcTemplate = new JdbcTemplate(database);
        repository = new InboxNotificationRepository(jdbcTemplate,
                new TransactionTemplate(new DataSourceTransactionManager(database)));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void insertsWholeBatch() {
        int created = repository.insertUnordered(7L, List.of(row("u1", "Hello"), row("u2", "Hello"), row("u3", "Hello")));

        assertThat(created).isEqualTo(3);
        assertThat(inboxUsers(7L)).hasSize(3);
        assertThat(inboxUsers(7L)).containsExactlyInAnyOrder("u1", "u2", "u3");
    }

    @Test
    void skipsOnlyTheMalformedRowWhenTheBatchFails() {
        int created = repository.insertUnordered(7L, List.of(row("u1", "Hello"), row("u2", null), row("u3", "Hello")));

        assertThat(created).isEqualTo(2);
        assertThat(inboxUsers(7L)).containsExactlyInAnyOrder("u1", "u3");
    }

    @Test
    void returnsZeroForEmptyInput() {
        assertThat(repository.insertUnordered(7L, List.of())).isZero();
        assertThat(inboxUsers(7L)).isEmpty();
    }

    private List<String> inboxUsers(Long broadcastId) {
        return jdbcTemplate.queryForList("SELECT user_id FROM inbox_notifications WHERE broadcast_id = ?",
                String.class, broadcastId);
    }

    private static InboxNotification row(String userId, String title) {
        return InboxNotification.builder()
                .userId(userId)
                .type("BROADCAST")
                .title(title)
                .description("Body")
                .link("/notifications")
                .targetMode("ALL_USERS")
                .createdBy("admin-1")
                .metadata("{\"broadcastId\":7,\"broadcastType\":\"INFO\"}")
                .createdAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
    }
}
