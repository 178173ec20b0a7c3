package com.example.notice.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    /** Lease owner written by this instance. Falls back to hostname:pid when blank. */
    private String instanceId;

    @Valid
    private final Scheduler scheduler = new Scheduler();
    @Valid
    private final Delivery delivery = new Delivery();
    @Valid
    private final Push push = new Push();
    @Valid
    private final Mail mail = new Mail();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        @NotNull
        private Duration tickInterval = Duration.ofSeconds(30);
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(10);
        @Positive
        private int batchSize = 10;
        @NotNull
        private Duration leaseStaleness = Duration.ofMinutes(10);
    }

    @Data
    public static class Delivery {
        @Positive
        @Max(10000)
        private int inAppBatchSize = 1000;
        @Positive
        private int emailConcurrency = 10;
    }

    @Data
    public static class Push {
        private String endpoint = "http://localhost:8089/push/topics";
        private String apiKey;
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Mail {
        private String from = "no-reply@localhost";
    }
}
