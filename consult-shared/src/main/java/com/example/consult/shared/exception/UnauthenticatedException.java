package com.example.consult.shared.exception;

/**
 * No usable caller identity was supplied by the auth context. Never retried; the client re-authenticates.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
