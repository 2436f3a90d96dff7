package com.example.consult.session.dto;

import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionState;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * What a polling client needs to decide its next step. {@code nextPollMs} is null once the session is
 * terminal, telling the client to stop polling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionStatusResponse {
    private String roomId;
    private ParticipantRole role;
    private SessionState state;
    private boolean canJoin;
    private String message;
    private boolean peerConnected;
    private OffsetDateTime startedAt;
    private OffsetDateTime endedAt;
    private CloseReason closeReason;
    private Long nextPollMs;
}
