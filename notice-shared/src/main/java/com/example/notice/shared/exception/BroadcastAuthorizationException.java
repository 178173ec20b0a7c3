package com.example.notice.shared.exception;

import lombok.Getter;

/**
 * The acting principal is not allowed to send or manage broadcasts.
 */
@Getter
public class BroadcastAuthorizationException extends RuntimeException {

    private final String actorId;

    public BroadcastAuthorizationException(String actorId, String message) {
        super(message);
        this.actorId = actorId;
    }
}
