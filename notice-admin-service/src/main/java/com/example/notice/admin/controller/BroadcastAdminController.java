package com.example.notice.admin.controller;

import com.example.notice.admin.dto.Actor;
import com.example.notice.admin.dto.BroadcastFilter;
import com.example.notice.admin.dto.BroadcastPageResponse;
import com.example.notice.admin.dto.BroadcastRequest;
import com.example.notice.admin.dto.BroadcastResponse;
import com.example.notice.admin.mapper.AdminBroadcastMapper;
import com.example.notice.admin.service.BroadcastOrchestrator;
import com.example.notice.admin.service.BroadcastQueryService;
import com.example.notice.shared.exception.BroadcastAuthorizationException;
import com.example.notice.shared.util.Constants;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Admin API for broadcasts. The gateway in front of this service authenticates the caller and
 * forwards its identity in {@value #ACTOR_ID_HEADER} and {@value #ACTOR_ROLE_HEADER}.
 */
@RestController
@RequestMapping("/api/admin/broadcasts")
@RequiredArgsConstructor
@Slf4j
public class BroadcastAdminController {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_ROLE_HEADER = "X-Actor-Role";

    private final BroadcastOrchestrator broadcastOrchestrator;
    private final BroadcastQueryService broadcastQueryService;
    private final AdminBroadcastMapper adminBroadcastMapper;
    private final Scheduler jdbcScheduler;

    @PostMapping
    @RateLimiter(name = "createBroadcastLimiter")
    public Mono<ResponseEntity<BroadcastResponse>> createBroadcast(
            @RequestHeader(value = ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = ACTOR_ROLE_HEADER, required = false) String actorRole,
            @Valid @RequestBody BroadcastRequest request) {
        Actor actor = authenticate(actorId, actorRole);
        log.info("Received broadcast creation request from {}: targetMode={}, channels={}",
                actor.getId(), request.getTargetMode(), request.getChannels());
        return Mono.fromCallable(() -> broadcastOrchestrator.createBroadcast(actor, request))
                .subscribeOn(jdbcScheduler)
                .map(adminBroadcastMapper::toBroadcastResponse)
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @GetMapping
    public Mono<ResponseEntity<BroadcastPageResponse>> listBroadcasts(
            @RequestHeader(value = ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = ACTOR_ROLE_HEADER, required = false) String actorRole,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String targetMode,
            @RequestParam(required = false) String organizationId) {
        authenticate(actorId, actorRole);
        BroadcastFilter filter = BroadcastFilter.builder()
                .page(page)
                .limit(limit)
                .status(status)
                .targetMode(targetMode)
                .organizationId(organizationId)
                .build();
        return Mono.fromCallable(() -> broadcastQueryService.listBroadcasts(filter))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<BroadcastResponse>> getBroadcast(
            @RequestHeader(value = ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = ACTOR_ROLE_HEADER, required = false) String actorRole,
            @PathVariable Long id) {
        authenticate(actorId, actorRole);
        return Mono.fromCallable(() -> broadcastQueryService.getBroadcast(id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/retry")
    public Mono<ResponseEntity<BroadcastResponse>> retryBroadcast(
            @RequestHeader(value = ACTOR_ID_HEADER, required = false) String actorId,
            @RequestHeader(value = ACTOR_ROLE_HEADER, required = false) String actorRole,
            @PathVariable Long id) {
        Actor actor = authenticate(actorId, actorRole);
        log.info("Admin {} retrying broadcast {}", actor.getId(), id);
        return Mono.fromCallable(() -> broadcastOrchestrator.retryBroadcast(actor, id))
                .subscribeOn(jdbcScheduler)
                .map(adminBroadcastMapper::toBroadcastResponse)
                .map(ResponseEntity::ok);
    }

    private static Actor authenticate(String actorId, String actorRole) {
        if (actorId == null || actorId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing " + ACTOR_ID_HEADER + " header");
        }
        if (!Constants.SUPER_ADMIN_ROLE.equals(actorRole)) {
            throw new BroadcastAuthorizationException(actorId, "Only SUPER_ADMIN may manage broadcasts");
        }
        return new Actor(actorId, actorRole);
    }
}
