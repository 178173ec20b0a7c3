package com.example.notice.admin.service;

import com.example.notice.admin.delivery.BroadcastContent;
import com.example.notice.admin.delivery.EmailDeliverer;
import com.example.notice.admin.delivery.InAppDeliverer;
import com.example.notice.admin.delivery.PushDeliverer;
import com.example.notice.admin.dto.Actor;
import com.example.notice.admin.dto.BroadcastRequest;
import com.example.notice.admin.mapper.AdminBroadcastMapper;
import com.example.notice.shared.aspect.Monitored;
import com.example.notice.shared.config.InstanceIdentity;
import com.example.notice.shared.config.MonitoringConfig;
import com.example.notice.shared.exception.BroadcastAuthorizationException;
import com.example.notice.shared.exception.BroadcastDeliveryException;
import com.example.notice.shared.exception.BroadcastStateConflictException;
import com.example.notice.shared.exception.BroadcastValidationException;
import com.example.notice.shared.exception.ChannelDeliveryException;
import com.example.notice.shared.exception.ResourceNotFoundException;
import com.example.notice.shared.model.BroadcastRecord;
import com.example.notice.shared.model.DeliveryReport;
import com.example.notice.shared.model.Recipient;
import com.example.notice.shared.repository.BroadcastLeaseRepository;
import com.example.notice.shared.repository.BroadcastRepository;
import com.example.notice.shared.service.AuditService;
import com.example.notice.shared.service.PrincipalDirectory;
import com.example.notice.shared.util.Constants;
import com.example.notice.shared.util.Constants.BroadcastStatus;
import com.example.notice.shared.util.Constants.Channel;
import com.example.notice.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Creates broadcasts and runs their delivery.
 * <p>
 * Delivery is an idempotent entry point: a broadcast that is already SENT is returned untouched,
 * anything else is delivered over every requested channel and ends in SENT (no channel-level
 * error) or FAILED. The outcome is written with a conditional update that never replaces SENT.
 */
@Slf4j
@Service
@Monitored("service")
@RequiredArgsConstructor
public class BroadcastOrchestrator {

    private final BroadcastRepository broadcastRepository;
    private final BroadcastLeaseRepository broadcastLeaseRepository;
    private final PrincipalDirectory principalDirectory;
    private final RecipientResolver recipientResolver;
    private final InAppDeliverer inAppDeliverer;
    private final EmailDeliverer emailDeliverer;
    private final PushDeliverer pushDeliverer;
    private final AuditService auditService;
    private final AdminBroadcastMapper adminBroadcastMapper;
    private final InstanceIdentity instanceIdentity;
    private final TransactionOperations transactionOperations;
    private final MonitoringConfig.BroadcastMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * Validates and stores a new broadcast. A broadcast without a future send time is delivered
     * before this returns; a FAILED outcome is logged and the stored record returned.
     */
    public BroadcastRecord createBroadcast(Actor actor, BroadcastRequest request) {
        requireSuperAdmin(actor);
        Set<Channel> channels = validate(request);

        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean immediate = request.getScheduledAt() == null || !request.getScheduledAt().isAfter(now);
        BroadcastStatus initialStatus = immediate ? BroadcastStatus.SENDING : BroadcastStatus.SCHEDULED;

        BroadcastRecord mapped = adminBroadcastMapper
                .toBroadcastRecord(request, channels, initialStatus.name(), actor.getId(), now);
        if (request.getTargetMode() != Constants.TargetMode.COMPANY) {
            mapped = mapped.withOrganizationId(null);
        }
        if (immediate) {
            // stamp the lease so a crash mid-delivery is recovered like a stale scheduled claim
            mapped = mapped.withLockedAt(now).withLockOwner(instanceIdentity.getOwnerId());
        }
        BroadcastRecord toInsert = mapped;

        BroadcastRecord saved = transactionOperations.execute(status -> {
            BroadcastRecord inserted = broadcastRepository.save(toInsert);
            auditService.log(actor.getId(), Constants.AUDIT_ENTITY_BROADCAST, String.valueOf(inserted.getId()),
                    Constants.AuditAction.CREATE, creationDiff(inserted, channels));
            return inserted;
        });
        metricsCollector.incrementCounter("notice.broadcasts.created", "mode", immediate ? "immediate" : "scheduled");
        log.info("Broadcast {} created by {} with status {}", saved.getId(), actor.getId(), initialStatus);

        if (!immediate) {
            return saved;
        }
        return deliverAndReport(saved.getId(), toInsert.getLockOwner());
    }

    /**
     * Delivers one broadcast over all requested channels and records the outcome. Runs only while
     * {@code leaseOwner} holds the SENDING lease; anything else is returned untouched.
     *
     * @throws ResourceNotFoundException if the broadcast does not exist
     * @throws BroadcastDeliveryException if the broadcast ended FAILED (already persisted)
     */
    public BroadcastRecord deliverBroadcast(Long broadcastId, String leaseOwner) {
        BroadcastRecord broadcast = findBroadcast(broadcastId);
        if (broadcast.alreadySent()) {
            log.debug("Broadcast {} already SENT, nothing to do", broadcastId);
            return broadcast;
        }
        if (!broadcast.isLeasedBy(leaseOwner)) {
            log.warn("Broadcast {} is {} with lease owner {}, not {}; skipping delivery",
                    broadcastId, broadcast.getStatus(), broadcast.getLockOwner(), leaseOwner);
            return broadcast;
        }

        long startTime = System.currentTimeMillis();
        Set<Channel> requested = broadcast.requestedChannels();
        BroadcastContent content = BroadcastContent.from(broadcast);
        DeliveryReport report = new DeliveryReport();
        List<String> errors = new ArrayList<>();

        List<Recipient> recipients = List.of();
        boolean recipientsResolved = true;
        if (requested.contains(Channel.IN_APP) || requested.contains(Channel.EMAIL)) {
            try {
                recipients = recipientResolver.resolveRecipients(content.getTargetMode(), content.getOrganizationId());
            } catch (RuntimeException e) {
                recipientsResolved = false;
                errors.add("RECIPIENTS failed: " + reason(e));
                log.error("Broadcast {}: could not resolve recipients", broadcastId, e);
            }
        }

        if (requested.contains(Channel.IN_APP) && recipientsResolved) {
            try {
                report.setInApp(new DeliveryReport.InApp(inAppDeliverer.createInAppNotifications(recipients, content)));
            } catch (RuntimeException e) {
                errors.add(channelError(Channel.IN_APP, e));
            }
        }
        if (requested.contains(Channel.EMAIL) && recipientsResolved) {
            try {
                report.setEmail(emailDeliverer.sendEmails(recipients, content));
            } catch (RuntimeException e) {
                errors.add(channelError(Channel.EMAIL, e));
            }
        }
        if (requested.contains(Channel.PUSH)) {
            try {
                report.setPush(pushDeliverer.sendPush(content));
            } catch (RuntimeException e) {
                errors.add(channelError(Channel.PUSH, e));
            }
        }

        BroadcastStatus outcome = errors.isEmpty() ? BroadcastStatus.SENT : BroadcastStatus.FAILED;
        String lastError = errors.isEmpty() ? null : String.join(" | ", errors);
        OffsetDateTime finishedAt = OffsetDateTime.now(clock);

        boolean recorded = broadcastLeaseRepository.completeDelivery(broadcastId, leaseOwner, outcome.name(),
                outcome == BroadcastStatus.SENT ? finishedAt : null, JsonUtils.toJson(report), lastError, finishedAt);
        if (!recorded) {
            log.warn("Lease on broadcast {} passed from {} to another holder; discarding this run's {} outcome",
                    broadcastId, leaseOwner, outcome);
            return findBroadcast(broadcastId);
        }

        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("status", outcome.name());
        diff.put("delivery", report);
        diff.put("lastError", lastError);
        auditService.log(broadcast.getCreatedBy(), Constants.AUDIT_ENTITY_BROADCAST, String.valueOf(broadcastId),
                Constants.AuditAction.STATUS_CHANGE, diff);

        long duration = System.currentTimeMillis() - startTime;
        metricsCollector.incrementCounter("notice.broadcasts.delivered", "status", outcome.name());
        metricsCollector.recordTimer("notice.delivery.latency", duration);

        if (outcome == BroadcastStatus.FAILED) {
            throw new BroadcastDeliveryException(broadcastId, errors);
        }
        log.info("Broadcast {} SENT in {}ms", broadcastId, duration);
        return findBroadcast(broadcastId);
    }

    /**
     * Operator action: puts a FAILED broadcast back into SENDING under this instance's lease and
     * delivers it again.
     *
     * @throws BroadcastStateConflictException if the broadcast is not FAILED
     */
    public BroadcastRecord retryBroadcast(Actor actor, Long broadcastId) {
        requireSuperAdmin(actor);
        BroadcastRecord broadcast = findBroadcast(broadcastId);

        OffsetDateTime now = OffsetDateTime.now(clock);
        String owner = instanceIdentity.getOwnerId();
        if (!broadcastLeaseRepository.reopenFailed(broadcastId, owner, now)) {
            throw new BroadcastStateConflictException("Broadcast " + broadcastId + " is " + broadcast.getStatus()
                    + "; only FAILED broadcasts can be retried");
        }

        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("previousStatus", BroadcastStatus.FAILED.name());
        diff.put("previousError", broadcast.getLastError());
        auditService.log(actor.getId(), Constants.AUDIT_ENTITY_BROADCAST, String.valueOf(broadcastId),
                Constants.AuditAction.RETRY, diff);
        log.info("Broadcast {} reopened for retry by {}", broadcastId, actor.getId());

        return deliverAndReport(broadcastId, owner);
    }

    private BroadcastRecord deliverAndReport(Long broadcastId, String leaseOwner) {
        try {
            return deliverBroadcast(broadcastId, leaseOwner);
        } catch (BroadcastDeliveryException e) {
            log.warn("Broadcast {} FAILED: {}", broadcastId, e.getMessage());
            return findBroadcast(broadcastId);
        }
    }

    private void requireSuperAdmin(Actor actor) {
        if (actor == null || actor.getId() == null) {
            throw new BroadcastAuthorizationException(null, "An authenticated actor is required");
        }
        String role = principalDirectory.findUserRole(actor.getId()).orElse(null);
        if (!Constants.SUPER_ADMIN_ROLE.equals(role)) {
            throw new BroadcastAuthorizationException(actor.getId(), "Only SUPER_ADMIN may manage broadcasts");
        }
    }

    private static Set<Channel> validate(BroadcastRequest request) {
        if (request.getType() == null) {
            throw new BroadcastValidationException("type is required");
        }
        if (request.getTargetMode() == null) {
            throw new BroadcastValidationException("targetMode is required");
        }
        if (request.getTargetMode() == Constants.TargetMode.COMPANY
                && (request.getOrganizationId() == null || request.getOrganizationId().isBlank())) {
            throw new BroadcastValidationException("organizationId is required when targetMode is COMPANY");
        }
        if (request.getChannels() == null || request.getChannels().stream().allMatch(Objects::isNull)) {
            throw new BroadcastValidationException("At least one channel is required");
        }
        Set<Channel> channels = EnumSet.noneOf(Channel.class);
        request.getChannels().stream().filter(Objects::nonNull).forEach(channels::add);
        return channels;
    }

    private BroadcastRecord findBroadcast(Long broadcastId) {
        return broadcastRepository.findById(broadcastId)
                .orElseThrow(() -> new ResourceNotFoundException("Broadcast not found with ID: " + broadcastId));
    }

    private static Map<String, Object> creationDiff(BroadcastRecord broadcast, Set<Channel> channels) {
        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("title", broadcast.getTitle());
        diff.put("type", broadcast.getType());
        diff.put("targetMode", broadcast.getTargetMode());
        diff.put("organizationId", broadcast.getOrganizationId());
        diff.put("channels", channels);
        diff.put("scheduledAt", broadcast.getScheduledAt());
        return diff;
    }

    private static String channelError(Channel channel, RuntimeException e) {
        Channel failed = e instanceof ChannelDeliveryException channelFailure ? channelFailure.getChannel() : channel;
        return failed.name() + " failed: " + reason(e);
    }

    private static String reason(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
