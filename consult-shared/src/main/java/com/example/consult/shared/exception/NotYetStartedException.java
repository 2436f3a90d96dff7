package com.example.consult.shared.exception;

import lombok.Getter;

@Getter
public class NotYetStartedException extends RuntimeException {

    private final String roomId;

    public NotYetStartedException(String roomId) {
        super("Consultation not started yet. Please wait for the doctor.");
        this.roomId = roomId;
    }
}
