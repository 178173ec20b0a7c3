package com.example.notice.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for broadcast creation and delivery.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder noticeMetrics() {
        return registry -> {
            registry.counter("notice.broadcasts.created", "mode", "immediate");
            registry.counter("notice.broadcasts.created", "mode", "scheduled");
            registry.counter("notice.broadcasts.delivered", "status", "SENT");
            registry.counter("notice.broadcasts.delivered", "status", "FAILED");
            registry.counter("notice.broadcasts.claimed");
            Timer.builder("notice.delivery.latency")
                    .description("Time taken to deliver one broadcast over all requested channels")
                    .register(registry);
        };
    }

    @Bean
    public BroadcastMetricsCollector broadcastMetricsCollector(MeterRegistry registry) {
        return new BroadcastMetricsCollector(registry);
    }

    public static class BroadcastMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public BroadcastMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long durationMs, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMs, TimeUnit.MILLISECONDS);
        }
    }
}
