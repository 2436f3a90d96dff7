package com.example.consult.shared.exception;

import lombok.Getter;

/**
 * The caller is authenticated but is not the doctor or patient bound to the room, or its role may not
 * perform the requested operation.
 */
@Getter
public class ForbiddenException extends RuntimeException {

    private final String roomId;

    public ForbiddenException(String roomId, String message) {
        super(message);
        this.roomId = roomId;
    }
}
