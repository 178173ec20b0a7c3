package com.example.notice.shared.config;

import com.example.notice.shared.concurrent.BoundedConcurrencyExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Threads for per-recipient fan-out. Sized to the fan-out width so every logical worker gets a thread.
     */
    @Bean
    public ThreadPoolTaskExecutor fanOutTaskExecutor(AppProperties appProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(appProperties.getDelivery().getEmailConcurrency());
        executor.setThreadNamePrefix("fanout-");
        executor.initialize();
        return executor;
    }

    @Bean
    public BoundedConcurrencyExecutor emailFanOutExecutor(
            @Qualifier("fanOutTaskExecutor") ThreadPoolTaskExecutor fanOutTaskExecutor,
            AppProperties appProperties) {
        return new BoundedConcurrencyExecutor(fanOutTaskExecutor, appProperties.getDelivery().getEmailConcurrency());
    }

    /**
     * Customizes the thread pool for @Scheduled methods.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Scheduler jdbcScheduler() {
        // delivery blocks on the push gateway, so this must not be a non-blocking scheduler
        return Schedulers.newBoundedElastic(10, 10_000, "jdbc-io-");
    }
}
