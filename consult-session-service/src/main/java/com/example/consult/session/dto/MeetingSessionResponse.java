package com.example.consult.session.dto;

import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.SessionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeetingSessionResponse {
    private String roomId;
    private Long appointmentId;
    private String doctorId;
    private String patientId;
    private SessionState state;
    private OffsetDateTime scheduledAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime endedAt;
    private CloseReason closeReason;
    private Long durationSeconds;
}
