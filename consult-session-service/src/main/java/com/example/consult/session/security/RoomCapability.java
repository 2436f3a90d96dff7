package com.example.consult.session.security;

import com.example.consult.shared.exception.ForbiddenException;
import com.example.consult.shared.model.AppointmentRef;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionOperation;

/**
 * Proof that {@link SessionAccessGate} authorized {@code userId} as {@code role} in {@code roomId}
 * for {@code operation}. Only the gate can mint one; lifecycle, status and relay operations take it
 * instead of raw identifiers.
 */
public final class RoomCapability {

    private final String roomId;
    private final AppointmentRef appointment;
    private final String userId;
    private final ParticipantRole role;
    private final SessionOperation operation;

    RoomCapability(String roomId, AppointmentRef appointment, String userId, ParticipantRole role, SessionOperation operation) {
        this.roomId = roomId;
        this.appointment = appointment;
        this.userId = userId;
        this.role = role;
        this.operation = operation;
    }

    public String roomId() {
        return roomId;
    }

    public AppointmentRef appointment() {
        return appointment;
    }

    public long appointmentId() {
        return appointment.appointmentId();
    }

    public String userId() {
        return userId;
    }

    public ParticipantRole role() {
        return role;
    }

    public SessionOperation operation() {
        return operation;
    }

    public boolean isDoctor() {
        return role == ParticipantRole.DOCTOR;
    }

    /**
     * Checks that this capability was minted for {@code expected} and that its role may perform it.
     *
     * @return this capability
     * @throws ForbiddenException otherwise
     */
    public RoomCapability requireFor(SessionOperation expected) {
        if (operation != expected || !expected.permits(role)) {
            throw new ForbiddenException(roomId, "Capability for " + operation + " as " + role + " does not allow " + expected);
        }
        return this;
    }

    @Override
    public String toString() {
        return "RoomCapability[" + roomId + ", " + role + ":" + userId + ", " + operation + "]";
    }
}
