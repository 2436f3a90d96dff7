package com.example.consult.shared.exception;

import com.example.consult.shared.util.Constants.SessionState;
import lombok.Getter;

@Getter
public class SessionClosedException extends RuntimeException {

    private final String roomId;
    private final SessionState state;

    public SessionClosedException(String roomId, SessionState state) {
        super(state == SessionState.CANCELLED ? "This consultation was cancelled" : "This consultation has ended");
        this.roomId = roomId;
        this.state = state;
    }
}
