package com.example.notice.shared.exception;

public class BroadcastStateConflictException extends RuntimeException {

    public BroadcastStateConflictException(String message) {
        super(message);
    }
}
