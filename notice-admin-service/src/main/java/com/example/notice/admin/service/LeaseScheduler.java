package com.example.notice.admin.service;

import com.example.notice.shared.config.AppProperties;
import com.example.notice.shared.config.InstanceIdentity;
import com.example.notice.shared.config.MonitoringConfig;
import com.example.notice.shared.exception.BroadcastDeliveryException;
import com.example.notice.shared.repository.BroadcastLeaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Claims due broadcasts one at a time and delivers each one. Any number of instances may run this
 * concurrently; the conditional claim update guarantees a single owner per broadcast.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaseScheduler {

    private final BroadcastLeaseRepository broadcastLeaseRepository;
    private final BroadcastOrchestrator broadcastOrchestrator;
    private final AppProperties appProperties;
    private final InstanceIdentity instanceIdentity;
    private final MonitoringConfig.BroadcastMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * @return how many broadcasts this call claimed
     */
    public int processDueScheduled() {
        AppProperties.Scheduler scheduler = appProperties.getScheduler();
        String owner = instanceIdentity.getOwnerId();
        int claimed = 0;

        while (claimed < scheduler.getBatchSize()) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            Optional<Long> next = broadcastLeaseRepository.claimNextDue(owner, now,
                    now.minus(scheduler.getLeaseStaleness()));
            if (next.isEmpty()) {
                break;
            }
            claimed++;
            Long broadcastId = next.get();
            metricsCollector.incrementCounter("notice.broadcasts.claimed");
            log.info("Claimed broadcast {} as {}", broadcastId, owner);

            try {
                broadcastOrchestrator.deliverBroadcast(broadcastId, owner);
            } catch (BroadcastDeliveryException e) {
                log.warn("Scheduled broadcast {} FAILED: {}", broadcastId, e.getMessage());
            } catch (RuntimeException e) {
                // lease stays in place and expires, so another tick picks the broadcast up again
                log.error("Delivery of scheduled broadcast {} aborted", broadcastId, e);
            }
        }
        return claimed;
    }
}
