package com.example.consult.session.security;

import com.example.consult.session.service.AppointmentDirectory;
import com.example.consult.session.service.SessionAuditService;
import com.example.consult.shared.exception.ForbiddenException;
import com.example.consult.shared.exception.UnauthenticatedException;
import com.example.consult.shared.model.AppointmentRef;
import com.example.consult.shared.util.Constants.AuditOutcome;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionOperation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Ownership check in front of every consultation operation. Blocking: call it from the JDBC scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionAccessGate {

    private static final String NOT_AUTHORIZED = "Not authorized for this consultation";

    private final RoomIdCodec roomIdCodec;
    private final AppointmentDirectory appointmentDirectory;
    private final SessionAuditService auditService;

    public RoomCapability authorize(Optional<CallerIdentity> caller, String roomId, SessionOperation operation) {
        CallerIdentity identity = requireIdentity(caller, roomId, operation);

        OptionalLong appointmentId = roomIdCodec.decode(roomId);
        if (appointmentId.isEmpty()) {
            throw deny(identity, roomId, operation, "invalid room id");
        }
        return authorizeParticipant(identity, roomId, appointmentId.getAsLong(), operation);
    }

    public RoomCapability authorizeAppointment(Optional<CallerIdentity> caller, long appointmentId, SessionOperation operation) {
        String roomId = roomIdCodec.encode(appointmentId);
        CallerIdentity identity = requireIdentity(caller, roomId, operation);
        return authorizeParticipant(identity, roomId, appointmentId, operation);
    }

    public CallerIdentity requireIdentity(Optional<CallerIdentity> caller, SessionOperation operation) {
        CallerIdentity identity = requireIdentity(caller, null, operation);
        auditService.record(identity, null, operation, AuditOutcome.GRANTED, null);
        return identity;
    }

    private CallerIdentity requireIdentity(Optional<CallerIdentity> caller, String roomId, SessionOperation operation) {
        if (caller.isEmpty()) {
            auditService.record(null, roomId, operation, AuditOutcome.UNAUTHENTICATED, null);
            throw new UnauthenticatedException("Authentication required");
        }
        return caller.get();
    }

    private RoomCapability authorizeParticipant(CallerIdentity identity, String roomId, long appointmentId, SessionOperation operation) {
        if (identity.role() == null) {
            throw deny(identity, roomId, operation, "role " + identity.claimedRole() + " cannot take part in consultations");
        }
        Optional<AppointmentRef> appointment = appointmentDirectory.find(appointmentId);
        if (appointment.isEmpty()) {
            throw deny(identity, roomId, operation, "unknown appointment " + appointmentId);
        }
        ParticipantRole boundRole = appointment.get().roleOf(identity.userId(), identity.role());
        if (boundRole == null) {
            throw deny(identity, roomId, operation, "not a participant of appointment " + appointmentId);
        }
        if (!operation.permits(boundRole)) {
            auditService.record(identity, roomId, operation, AuditOutcome.FORBIDDEN, "operation not allowed for " + boundRole);
            throw new ForbiddenException(roomId, "Only the doctor can " + operation.name().toLowerCase() + " this consultation");
        }
        auditService.record(identity, roomId, operation, AuditOutcome.GRANTED, null);
        return new RoomCapability(roomId, appointment.get(), identity.userId(), boundRole, operation);
    }

    private ForbiddenException deny(CallerIdentity identity, String roomId, SessionOperation operation, String detail) {
        auditService.record(identity, roomId, operation, AuditOutcome.FORBIDDEN, detail);
        return new ForbiddenException(roomId, NOT_AUTHORIZED);
    }
}
