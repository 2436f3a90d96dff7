package com.example.consult.session.service;

import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.model.MeetingSession;
import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.SessionState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Decides when an active session has been abandoned by its patient. The same cutoffs drive the
 * guarded update in the session store, so the in-memory and SQL predicates agree.
 */
@Component
@RequiredArgsConstructor
public class GracePolicy {

    private final AppProperties appProperties;

    public Duration graceWindow() {
        return appProperties.getSession().getPatientGraceWindow();
    }

    public Duration noShowTimeout() {
        return appProperties.getSession().getPatientNoShowTimeout();
    }

    public Duration doctorNoShowTimeout() {
        return appProperties.getSession().getDoctorNoShowTimeout();
    }

    public OffsetDateTime graceCutoff(OffsetDateTime now) {
        return now.minus(graceWindow());
    }

    public OffsetDateTime noShowCutoff(OffsetDateTime now) {
        return now.minus(noShowTimeout());
    }

    public OffsetDateTime doctorNoShowCutoff(OffsetDateTime now) {
        return now.minus(doctorNoShowTimeout());
    }

    /**
     * True when the doctor started the session but never joined the call within the no-show timeout.
     */
    public boolean doctorAbsent(MeetingSession session, OffsetDateTime now) {
        return session.getState() == SessionState.ACTIVE
                && session.getDoctorJoinedAt() == null
                && session.getStartedAt() != null
                && session.getStartedAt().isBefore(doctorNoShowCutoff(now));
    }

    /**
     * True once a patient that was seen has been gone longer than the grace window.
     */
    public boolean reconnectWindowElapsed(MeetingSession session, OffsetDateTime now) {
        return session.getLastPatientSeenAt() != null
                && session.getLastPatientSeenAt().isBefore(graceCutoff(now));
    }

    public Optional<CloseReason> abandonmentReason(MeetingSession session, OffsetDateTime now) {
        if (session.getState() != SessionState.ACTIVE) {
            return Optional.empty();
        }
        if (session.getLastPatientSeenAt() != null) {
            return reconnectWindowElapsed(session, now) ? Optional.of(CloseReason.PATIENT_GRACE_EXPIRED) : Optional.empty();
        }
        if (session.getStartedAt() != null && session.getStartedAt().isBefore(noShowCutoff(now))) {
            return Optional.of(CloseReason.PATIENT_NO_SHOW);
        }
        return Optional.empty();
    }
}
