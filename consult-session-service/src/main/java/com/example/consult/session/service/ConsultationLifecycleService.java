package com.example.consult.session.service;

import com.example.consult.session.relay.ParticipantDisconnectedEvent;
import com.example.consult.session.relay.SignalingRelay;
import com.example.consult.session.security.CallerIdentity;
import com.example.consult.session.security.RoomCapability;
import com.example.consult.shared.aspect.Monitored;
import com.example.consult.shared.config.MonitoringConfig.ConsultMetricsCollector;
import com.example.consult.shared.exception.NotYetStartedException;
import com.example.consult.shared.exception.SessionClosedException;
import com.example.consult.shared.exception.SessionConflictException;
import com.example.consult.shared.model.AppointmentRef;
import com.example.consult.shared.model.MeetingSession;
import com.example.consult.shared.model.StateTransition;
import com.example.consult.shared.repository.MeetingSessionRepository;
import com.example.consult.shared.util.Constants;
import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionOperation;
import com.example.consult.shared.util.Constants.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Session lifecycle state machine.
 * <pre>
 *   SCHEDULED --start--> ACTIVE --end / doctor disconnect or no-show / patient grace expiry--> ENDED
 *   SCHEDULED --cancel--> CANCELLED
 * </pre>
 * Every transition is a single compare-and-swap in the session store. A caller that loses the race
 * re-reads the session and gets a conflict carrying the state it lost to; nothing is retried.
 * All methods block on JDBC.
 */
@Service
@Monitored("service")
@RequiredArgsConstructor
@Slf4j
public class ConsultationLifecycleService {

    private final MeetingSessionRepository sessionRepository;
    private final AppointmentDirectory appointmentDirectory;
    private final SignalingRelay signalingRelay;
    private final GracePolicy gracePolicy;
    private final ConsultMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * Returns the room of the capability's appointment, creating it in SCHEDULED on first use.
     */
    public MeetingSession open(RoomCapability capability) {
        capability.requireFor(SessionOperation.OPEN);
        MeetingSession session = sessionRepository.getOrCreate(capability.roomId(), capability.appointment(), now());
        if (session.getState() == SessionState.SCHEDULED) {
            Optional<AppointmentRef> appointment = appointmentDirectory.refresh(capability.appointmentId());
            if (appointment.map(AppointmentRef::isCancelled).orElse(false)) {
                cancelForCancelledAppointment(capability.roomId());
                return read(capability.roomId());
            }
        }
        return session;
    }

    public List<MeetingSession> mySessions(CallerIdentity caller) {
        return sessionRepository.findByParticipant(caller.userId());
    }

    /**
     * SCHEDULED -> ACTIVE. Doctor only.
     */
    public MeetingSession start(RoomCapability capability) {
        capability.requireFor(SessionOperation.START);
        String roomId = capability.roomId();
        MeetingSession session = sessionRepository.getOrCreate(roomId, capability.appointment(), now());

        if (session.getState() == SessionState.SCHEDULED
                && appointmentDirectory.refresh(capability.appointmentId()).map(AppointmentRef::isCancelled).orElse(false)) {
            cancelForCancelledAppointment(roomId);
            throw new SessionClosedException(roomId, read(roomId).getState());
        }

        if (session.getState() != SessionState.SCHEDULED) {
            throw conflictForStart(roomId, session.getState());
        }

        OffsetDateTime startedAt = now();
        if (!sessionRepository.compareAndSwapState(roomId, SessionState.SCHEDULED, SessionState.ACTIVE, StateTransition.started(startedAt))) {
            MeetingSession current = read(roomId);
            log.info("Start of room {} lost the race, session is now {}", roomId, current.getState());
            throw conflictForStart(roomId, current.getState());
        }

        metricsCollector.incrementCounter("consult.sessions.transitions", "to", SessionState.ACTIVE.name(), "reason", "started");
        log.info("Doctor {} started consultation in room {}", capability.userId(), roomId);
        return read(roomId);
    }

    /**
     * Validates that the caller may be present in the room right now and hands the connection to the
     * relay. A patient returning after the grace window closes the room instead of joining it.
     */
    public Flux<ServerSentEvent<String>> join(RoomCapability capability, String connectionId) {
        capability.requireFor(SessionOperation.JOIN);
        String roomId = capability.roomId();
        MeetingSession session = sessionRepository.findByRoomId(roomId)
                .orElseThrow(() -> new NotYetStartedException(roomId));

        switch (session.getState()) {
            case SCHEDULED -> throw new NotYetStartedException(roomId);
            case ENDED, CANCELLED -> throw new SessionClosedException(roomId, session.getState());
            default -> { }
        }

        if (capability.role() == ParticipantRole.PATIENT) {
            OffsetDateTime now = now();
            if (gracePolicy.reconnectWindowElapsed(session, now)) {
                log.info("Patient {} came back to room {} after the grace window", capability.userId(), roomId);
                expireGrace(session, now);
                throw new SessionClosedException(roomId, read(roomId).getState());
            }
            if (sessionRepository.touchPatientSeen(roomId, now) == 0) {
                throw notJoinable(roomId);
            }
        } else if (sessionRepository.markDoctorJoined(roomId, now()) == 0) {
            throw notJoinable(roomId);
        }

        return signalingRelay.admit(capability, connectionId);
    }

    /**
     * ACTIVE -> ENDED by the doctor. Ending an already ended session returns it unchanged.
     */
    public MeetingSession end(RoomCapability capability) {
        capability.requireFor(SessionOperation.END);
        String roomId = capability.roomId();
        MeetingSession session = sessionRepository.findByRoomId(roomId)
                .orElseThrow(() -> conflict(roomId, SessionState.SCHEDULED));

        if (session.getState() == SessionState.ENDED) {
            log.debug("Room {} already ended, end request is a no-op", roomId);
            return session;
        }
        if (session.getState() != SessionState.ACTIVE) {
            throw conflict(roomId, session.getState());
        }

        if (!endActive(session, CloseReason.DOCTOR_ENDED)) {
            MeetingSession current = read(roomId);
            if (current.getState() == SessionState.ENDED) {
                return current;
            }
            throw conflict(roomId, current.getState());
        }
        log.info("Doctor {} ended consultation in room {}", capability.userId(), roomId);
        return read(roomId);
    }

    /**
     * SCHEDULED -> CANCELLED by the doctor. Cancelling an already cancelled session returns it unchanged.
     */
    public MeetingSession cancel(RoomCapability capability) {
        capability.requireFor(SessionOperation.CANCEL);
        String roomId = capability.roomId();
        MeetingSession session = sessionRepository.getOrCreate(roomId, capability.appointment(), now());

        if (session.getState() == SessionState.CANCELLED) {
            return session;
        }
        if (session.getState() != SessionState.SCHEDULED) {
            throw conflict(roomId, session.getState());
        }

        if (!sessionRepository.compareAndSwapState(roomId, SessionState.SCHEDULED, SessionState.CANCELLED,
                StateTransition.cancelled(now(), CloseReason.CANCELLED_BY_DOCTOR))) {
            MeetingSession current = read(roomId);
            if (current.getState() == SessionState.CANCELLED) {
                return current;
            }
            throw conflict(roomId, current.getState());
        }
        metricsCollector.incrementCounter("consult.sessions.transitions", "to", SessionState.CANCELLED.name(), "reason", CloseReason.CANCELLED_BY_DOCTOR.name());
        log.info("Doctor {} cancelled consultation in room {}", capability.userId(), roomId);
        return read(roomId);
    }

    /**
     * Reacts to a relay connection that went away. A doctor leaving ends the consultation; a patient
     * leaving starts the grace window.
     */
    public void handleParticipantDisconnect(ParticipantDisconnectedEvent event) {
        String roomId = event.getRoomId();
        if (event.getRole() == ParticipantRole.PATIENT) {
            int stamped = sessionRepository.touchPatientSeen(roomId, event.getDisconnectedAt());
            if (stamped > 0) {
                log.info("Patient {} disconnected from room {}, grace window of {} started",
                        event.getUserId(), roomId, gracePolicy.graceWindow());
            }
            return;
        }

        if (signalingRelay.isBound(roomId, ParticipantRole.DOCTOR)) {
            // The doctor is already back on a newer connection
            log.debug("Ignoring stale doctor disconnect for room {} (connection {})", roomId, event.getConnectionId());
            return;
        }
        Optional<MeetingSession> session = sessionRepository.findByRoomId(roomId);
        if (session.isEmpty() || session.get().getState() != SessionState.ACTIVE) {
            return;
        }
        if (endActive(session.get(), CloseReason.DOCTOR_DISCONNECTED)) {
            log.info("Doctor {} disconnected, consultation in room {} ended", event.getUserId(), roomId);
        }
    }

    /**
     * Ends {@code candidate} if its patient is still gone. Guarded in the store, so a patient that
     * reconnects in the meantime wins and repeated calls end the session at most once.
     *
     * @return true if this call ended the session
     */
    public boolean expireGrace(MeetingSession candidate, OffsetDateTime now) {
        Optional<CloseReason> reason = gracePolicy.abandonmentReason(candidate, now);
        if (reason.isEmpty()) {
            return false;
        }
        String roomId = candidate.getRoomId();
        boolean expired = sessionRepository.expireIfAbandoned(roomId,
                gracePolicy.graceCutoff(now),
                gracePolicy.noShowCutoff(now),
                StateTransition.ended(now, candidate.getStartedAt(), reason.get()));
        if (expired) {
            signalingRelay.closeRoom(roomId, SessionState.ENDED, reason.get());
            metricsCollector.incrementCounter("consult.sessions.transitions", "to", SessionState.ENDED.name(), "reason", reason.get().name());
            log.info("Consultation in room {} ended: {}", roomId, reason.get());
        }
        return expired;
    }

    /**
     * Ends {@code candidate} if its doctor started it but never joined the call. A doctor joining in
     * the meantime makes this a no-op.
     *
     * @return true if this call ended the session
     */
    public boolean expireDoctorNoShow(MeetingSession candidate, OffsetDateTime now) {
        if (!gracePolicy.doctorAbsent(candidate, now)) {
            return false;
        }
        String roomId = candidate.getRoomId();
        boolean expired = sessionRepository.expireIfDoctorAbsent(roomId, gracePolicy.doctorNoShowCutoff(now),
                StateTransition.ended(now, candidate.getStartedAt(), CloseReason.DOCTOR_NO_SHOW));
        if (expired) {
            signalingRelay.closeRoom(roomId, SessionState.ENDED, CloseReason.DOCTOR_NO_SHOW);
            metricsCollector.incrementCounter("consult.sessions.transitions", "to", SessionState.ENDED.name(), "reason", CloseReason.DOCTOR_NO_SHOW.name());
            log.info("Consultation in room {} ended: doctor never joined", roomId);
        }
        return expired;
    }

    private boolean endActive(MeetingSession session, CloseReason reason) {
        String roomId = session.getRoomId();
        boolean ended = sessionRepository.compareAndSwapState(roomId, SessionState.ACTIVE, SessionState.ENDED,
                StateTransition.ended(now(), session.getStartedAt(), reason));
        if (ended) {
            signalingRelay.closeRoom(roomId, SessionState.ENDED, reason);
            metricsCollector.incrementCounter("consult.sessions.transitions", "to", SessionState.ENDED.name(), "reason", reason.name());
        }
        return ended;
    }

    private void cancelForCancelledAppointment(String roomId) {
        if (sessionRepository.compareAndSwapState(roomId, SessionState.SCHEDULED, SessionState.CANCELLED,
                StateTransition.cancelled(now(), CloseReason.APPOINTMENT_CANCELLED))) {
            metricsCollector.incrementCounter("consult.sessions.transitions", "to", SessionState.CANCELLED.name(), "reason", CloseReason.APPOINTMENT_CANCELLED.name());
            log.info("Appointment behind room {} was cancelled, session cancelled", roomId);
        }
    }

    private RuntimeException notJoinable(String roomId) {
        MeetingSession current = read(roomId);
        return current.getState() == SessionState.SCHEDULED
                ? new NotYetStartedException(roomId)
                : new SessionClosedException(roomId, current.getState());
    }

    private MeetingSession read(String roomId) {
        return sessionRepository.findByRoomId(roomId)
                .orElseThrow(() -> new IllegalStateException("Meeting session disappeared: " + roomId));
    }

    private SessionConflictException conflictForStart(String roomId, SessionState state) {
        if (state == SessionState.ACTIVE) {
            return new SessionConflictException(roomId, Constants.CONFLICT_ALREADY_ACTIVE, "Consultation already started");
        }
        return conflict(roomId, state);
    }

    private SessionConflictException conflict(String roomId, SessionState state) {
        String message = switch (state) {
            case SCHEDULED -> "Consultation has not started";
            case ACTIVE -> "Consultation is in progress";
            case ENDED -> "Consultation has already ended";
            case CANCELLED -> "Consultation was cancelled";
        };
        return new SessionConflictException(roomId, state.name(), message);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
