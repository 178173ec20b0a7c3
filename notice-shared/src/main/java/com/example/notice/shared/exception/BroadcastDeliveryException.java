package com.example.notice.shared.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised to the internal caller of a delivery run that ended in FAILED. The failure has already
 * been persisted on the broadcast by the time this is thrown.
 */
@Getter
public class BroadcastDeliveryException extends RuntimeException {

    private final Long broadcastId;
    private final List<String> channelErrors;

    public BroadcastDeliveryException(Long broadcastId, List<String> channelErrors) {
        super(String.join(" | ", channelErrors));
        this.broadcastId = broadcastId;
        this.channelErrors = List.copyOf(channelErrors);
    }
}
