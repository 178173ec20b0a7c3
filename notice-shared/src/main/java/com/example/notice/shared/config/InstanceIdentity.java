package com.example.notice.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Identity this instance writes into the lease owner column.
 */
@Slf4j
@Component
public class InstanceIdentity {

    private final String ownerId;

    public InstanceIdentity(AppProperties appProperties) {
        String configured = appProperties.getInstanceId();
        this.ownerId = configured != null && !configured.isBlank()
                ? configured
                : hostName() + ":" + ProcessHandle.current().pid();
        log.info("Lease owner id for this instance: {}", ownerId);
    }

    public String getOwnerId() {
        return ownerId;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local host name, using 'localhost': {}", e.getMessage());
            return "localhost";
        }
    }
}
