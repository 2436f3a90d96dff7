package com.example.consult.shared.model;

import com.example.consult.shared.util.Constants.ParticipantRole;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Read-only view of an appointment owned by the scheduling system.
 */
public record AppointmentRef(
        Long appointmentId,
        String doctorId,
        String patientId,
        OffsetDateTime scheduledAt,
        String status) {

    public static final String STATUS_CANCELLED = "cancelled";

    public boolean isCancelled() {
        return STATUS_CANCELLED.equalsIgnoreCase(status);
    }

    /**
     * The participant role {@code userId} holds in this appointment when it claims {@code claimedRole},
     * or null when the claim does not match the appointment.
     */
    public ParticipantRole roleOf(String userId, ParticipantRole claimedRole) {
        if (userId == null || claimedRole == null) {
            return null;
        }
        String boundId = claimedRole == ParticipantRole.DOCTOR ? doctorId : patientId;
        return Objects.equals(boundId, userId) ? claimedRole : null;
    }
}
