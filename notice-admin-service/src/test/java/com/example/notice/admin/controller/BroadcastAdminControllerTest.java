package com.example.notice.admin.controller;

import com.example.notice.admin.dto.Actor;
import com.example.notice.admin.dto.BroadcastFilter;
import com.example.notice.admin.dto.BroadcastPageResponse;
import com.example.notice.admin.dto.BroadcastRequest;
import com.example.notice.admin.dto.BroadcastResponse;
import com.example.notice.admin.mapper.AdminBroadcastMapperImpl;
import com.example.notice.admin.service.BroadcastOrchestrator;
import com.example.notice.admin.service.BroadcastQueryService;
import com.example.notice.shared.exception.BroadcastStateConflictException;
import com.example.notice.shared.exception.BroadcastValidationException;
import com.example.notice.shared.exception.ResourceNotFoundException;
import com.example.notice.shared.model.BroadcastRecord;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = BroadcastAdminController.class)
@Import({AdminBroadcastMapperImpl.class, BroadcastAdminControllerTest.ImmediateJdbcScheduler.class})
class BroadcastAdminControllerTest {

    private static final String VALID_BODY = """
            {"title":"Maintenance","message":"Down from 2am","type":"MAINTENANCE",
             "targetMode":"ALL_USERS","channels":["IN_APP","PUSH"]}
            """;

    @TestConfiguration
    static class ImmediateJdbcScheduler {
        @Bean
        Scheduler jdbcScheduler() {
            return Schedulers.immediate();
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private BroadcastOrchestrator broadcastOrchestrator;

    @MockBean
    private BroadcastQueryService broadcastQueryService;

    @Test
    void createReturns201WithTheStoredBroadcast() {
        when(broadcastOrchestrator.createBroadcast(any(Actor.class), any(BroadcastRequest.class)))
                .thenReturn(record(7L, "SENT"));

        webTestClient.post().uri("/api/admin/broadcasts")
                .header(BroadcastAdminController.ACTOR_ID_HEADER, "root")
                .header(BroadcastAdminController.ACTOR_ROLE_HEADER, "SUPER_ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().exists("X-Correlation-ID")
                .expectBody()
                .jsonPath("$.id").isEqualTo(7)
                .jsonPath("$.status").isEqualTo("SENT")
                .jsonPath("$.channels[0]").isEqualTo("IN_APP")
                .jsonPath("$.delivery.inApp.created").isEqualTo(3);

        ArgumentCaptor<Actor> actor = ArgumentCaptor.forClass(Actor.class);
        ArgumentCaptor<BroadcastRequest> request = ArgumentCaptor.forClass(BroadcastRequest.class);
        verify(broadcastOrchestrator).createBroadcast(actor.capture(), request.capture());
        assertThat(actor.getValue().getId()).isEqualTo("root");
        assertThat(request.getValue().getChannels()).hasSize(2);
    }

    @Test
    void missingIdentityIsUnauthorized() {
        webTestClient.post().uri("/api/admin/broadcasts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isUnauthorized();
        verifyNoInteractions(broadcastOrchestrator);
    }

    @Test
    void nonSuperAdminIsForbidden() {
        webTestClient.post().uri("/api/admin/broadcasts")
                .header(BroadcastAdminController.ACTOR_ID_HEADER, "bob")
                .header(BroadcastAdminController.ACTOR_ROLE_HEADER, "COMPANY_ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.status").isEqualTo(403);
        verifyNoInteractions(broadcastOrchestrator);
    }

    @Test
    void invalidBodyIsRejectedBeforeReachingTheOrchestrator() {
        webTestClient.post().uri("/api/admin/broadcasts")
                .header(BroadcastAdminController.ACTOR_ID_HEADER, "root")
                .header(BroadcastAdminController.ACTOR_ROLE_HEADER, "SUPER_ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\":\"m\",\"type\":\"INFO\",\"targetMode\":\"ALL_USERS\",\"channels\":[\"IN_APP\"]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Title is required");
        verifyNoInteractions(broadcastOrchestrator);
    }

    @Test
    void orchestratorValidationErrorIsBadRequest() {
        when(broadcastOrchestrator.createBroadcast(any(), any()))
                .thenThrow(new BroadcastValidationException("organizationId is required when targetMode is COMPANY"));

        webTestClient.post().uri("/api/admin/broadcasts")
                .header(BroadcastAdminController.ACTOR_ID_HEADER, "root")
                .header(BroadcastAdminController.ACTOR_ROLE_HEADER, "SUPER_ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY.replace("ALL_USERS", "COMPANY"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("organizationId is required when targetMode is COMPANY")
                .jsonPath("$.path").isEqualTo("/api/admin/broadcasts");
    }

    @Test
    void listPassesFiltersAndReturnsPage() {
        when(broadcastQueryService.listBroadcasts(any(BroadcastFilter.class))).thenReturn(BroadcastPageResponse.builder()
                .items(List.of(BroadcastResponse.builder().id(1L).status("FAILED").build()))
                .page(2).limit(5).total(6).totalPages(2)
                .build());

        webTestClient.get().uri("/api/admin/broadcasts?page=2&limit=5&status=FAILED&organizationId=acme")
                .header(BroadcastAdminController.ACTOR_ID_HEADER, "root")
                .header(BroadcastAdminController.ACTOR_ROLE_HEADER, "SUPER_ADMIN")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.items[0].status").isEqualTo("FAILED")
                .jsonPath("$.totalPages").isEqualTo(2)
                .jsonPath("$.total").isEqualTo(6);

        ArgumentCaptor<BroadcastFilter> filter = ArgumentCaptor.forClass(BroadcastFilter.class);
        verify(broadcastQueryService).listBroadcasts(filter.capture());
        assertThat(filter.getValue().getPage()).isEqualTo(2);
        assertThat(filter.getValue().getLimit()).isEqualTo(5);
        assertThat(filter.getValue().getStatus()).isEqualTo("FAILED");
        assertThat(filter.getValue().getOrganizationId()).isEqualTo("acme");
        assertThat(filter.getValue().getTargetMode()).isNull();
    }

    @Test
    void unknownBroadcastIsNotFound() {
        when(broadcastQueryService.getBroadcast(42L)).thenThrow(new ResourceNotFoundException("Broadcast not found with ID: 42"));

        webTestClient.get().uri("/api/admin/broadcasts/42")
                .header(BroadcastAdminController.ACTOR_ID_HEADER, "root")
                .header(BroadcastAdminController.ACTOR_ROLE_HEADER, "SUPER_ADMIN")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void retryOfBroadcastThatIsNotFailedIsConflict() {
        when(broadcastOrchestrator.retryBroadcast(any(Actor.class), eq(5L)))
                .thenThrow(new BroadcastStateConflictException("Broadcast 5 is SENT; only FAILED broadcasts can be retried"));

        webTestClient.post().uri("/api/admin/broadcasts/5/retry")
                .header(BroadcastAdminController.ACTOR_ID_HEADER, "root")
                .header(BroadcastAdminController.ACTOR_ROLE_HEADER, "SUPER_ADMIN")
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    void retryReturnsTheRedeliveredBroadcast() {
        when(broadcastOrchestrator.retryBroadcast(any(Actor.class), eq(5L))).thenReturn(record(5L, "SENT"));

        webTestClient.post().uri("/api/admin/broadcasts/5/retry")
                .header(BroadcastAdminController.ACTOR_ID_HEADER, "root")
                .header(BroadcastAdminController.ACTOR_ROLE_HEADER, "SUPER_ADMIN")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("SENT");
    }

    private static BroadcastRecord record(Long id, String status) {
        OffsetDateTime now = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        return BroadcastRecord.builder()
                .id(id)
                .title("Maintenance")
                .message("Down from 2am")
                .type("MAINTENANCE")
                .targetMode("ALL_USERS")
                .channels("[\"IN_APP\",\"PUSH\"]")
                .status(status)
                .createdBy("root")
                .createdAt(now)
                .updatedAt(now)
                .sentAt(now)
                .delivery("{\"inApp\":{\"created\":3},\"push\":{\"topic\":\"all_users\",\"messageId\":\"m-1\"}}")
                .build();
    }
}
