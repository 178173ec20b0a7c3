package com.example.notice.admin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import reactor.core.publisher.Hooks;

/**
 * Admin service for broadcast notifications: accepts broadcasts over REST, delivers them to the
 * in-app inbox, email and push, and runs the lease-based scheduler for future-dated broadcasts.
 */
@SpringBootApplication(scanBasePackages = "com.example.notice")
@EnableScheduling
public class NoticeAdminApplication {

    static {
        // carry the MDC correlation id across Reactor thread hops
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(NoticeAdminApplication.class, args);
    }
}
