package com.example.consult.shared.exception;

import com.example.consult.shared.util.Constants.ParticipantRole;
import lombok.Getter;

/**
 * The relay and the session store disagree about whether a connection may be present in a room.
 * Handled like a conflict: the client re-checks the status before trying again.
 */
@Getter
public class RelayRefusedException extends RuntimeException {

    private final String roomId;
    private final ParticipantRole role;
    private final String state;

    public RelayRefusedException(String roomId, ParticipantRole role, String state, String message) {
        super(message);
        this.roomId = roomId;
        this.role = role;
        this.state = state;
    }
}
