package com.example.consult.shared.model;

import com.example.consult.shared.util.Constants.CloseReason;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Columns written together with a state change. Null fields are left untouched.
 */
public record StateTransition(
        OffsetDateTime startedAt,
        OffsetDateTime endedAt,
        CloseReason closeReason,
        Long durationSeconds,
        OffsetDateTime occurredAt) {

    public static StateTransition started(OffsetDateTime at) {
        return new StateTransition(at, null, null, null, at);
    }

    public static StateTransition ended(OffsetDateTime at, OffsetDateTime startedAt, CloseReason reason) {
        Long duration = startedAt == null ? null : Math.max(0L, Duration.between(startedAt, at).getSeconds());
        return new StateTransition(null, at, reason, duration, at);
    }

    public static StateTransition cancelled(OffsetDateTime at, CloseReason reason) {
        return new StateTransition(null, null, reason, null, at);
    }
}
