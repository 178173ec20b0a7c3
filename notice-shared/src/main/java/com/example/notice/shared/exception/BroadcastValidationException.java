package com.example.notice.shared.exception;

/**
 * A create request that violates a broadcast invariant. Raised before anything is persisted.
 */
public class BroadcastValidationException extends RuntimeException {

    public BroadcastValidationException(String message) {
        super(message);
    }
}
