package com.example.consult.shared.model;

import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

import java.time.OffsetDateTime;

/**
 * Durable record of one appointment's video consultation room.
 * Mutated only through compare-and-swap on {@code state}; retained as an audit record once closed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
public class MeetingSession {
    private String roomId;
    private Long appointmentId;
    private String doctorId;
    private String patientId;
    private SessionState state;
    private OffsetDateTime scheduledAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime endedAt;
    private OffsetDateTime lastPatientSeenAt;
    private OffsetDateTime doctorJoinedAt;
    private CloseReason closeReason;
    private Long durationSeconds;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    /**
     * Only a live session may hold relay connections, for either role.
     */
    public boolean permitsPresenceOf(ParticipantRole role) {
        return role != null && state == SessionState.ACTIVE;
    }
}
