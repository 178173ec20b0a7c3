package com.example.notice.admin.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledBroadcastTrigger {

    private final LeaseScheduler leaseScheduler;

    @Scheduled(fixedDelayString = "${app.scheduler.tick-interval:PT30S}",
               initialDelayString = "${app.scheduler.initial-delay:PT10S}")
    public void tick() {
        try {
            int claimed = leaseScheduler.processDueScheduled();
            if (claimed > 0) {
                log.info("Scheduler tick processed {} broadcast(s)", claimed);
            }
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }
}
