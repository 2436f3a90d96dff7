package com.example.consult.session.dto;

import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.SessionState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Result of start, end and cancel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransitionResponse {
    private String roomId;
    private SessionState state;
    private OffsetDateTime startedAt;
    private OffsetDateTime endedAt;
    private CloseReason closeReason;
    private Long durationSeconds;
}
