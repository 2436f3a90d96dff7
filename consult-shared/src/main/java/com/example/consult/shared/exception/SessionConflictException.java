package com.example.consult.shared.exception;

import lombok.Getter;

/**
 * A transition was rejected because the session is not in the state it requires, or a concurrent
 * request won the compare-and-swap first. {@code state} is the re-read state the caller should act on.
 */
@Getter
public class SessionConflictException extends RuntimeException {

    private final String roomId;
    private final String state;

    public SessionConflictException(String roomId, String state, String message) {
        super(message);
        this.roomId = roomId;
        this.state = state;
    }
}
