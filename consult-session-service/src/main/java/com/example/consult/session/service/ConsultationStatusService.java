package com.example.consult.session.service;

import com.example.consult.session.dto.SessionStatusResponse;
import com.example.consult.session.relay.SignalingRelay;
import com.example.consult.session.security.RoomCapability;
import com.example.consult.shared.aspect.Monitored;
import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.model.MeetingSession;
import com.example.consult.shared.repository.MeetingSessionRepository;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionOperation;
import com.example.consult.shared.util.Constants.SessionState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only projection of a room for pollers. Never writes, so concurrent polling cannot disturb
 * the lifecycle.
 */
@Service
@Monitored("service")
@RequiredArgsConstructor
public class ConsultationStatusService {

    private final MeetingSessionRepository sessionRepository;
    private final SignalingRelay signalingRelay;
    private final AppProperties appProperties;

    public SessionStatusResponse getStatus(RoomCapability capability) {
        capability.requireFor(SessionOperation.STATUS);
        String roomId = capability.roomId();
        ParticipantRole role = capability.role();
        Optional<MeetingSession> session = sessionRepository.findByRoomId(roomId);
        SessionState state = session.map(MeetingSession::getState).orElse(SessionState.SCHEDULED);

        boolean ownSlotBound = signalingRelay.isBound(roomId, role);
        boolean canJoin = state == SessionState.ACTIVE && !ownSlotBound;

        return SessionStatusResponse.builder()
                .roomId(roomId)
                .role(role)
                .state(state)
                .canJoin(canJoin)
                .message(messageFor(state, role, canJoin))
                .peerConnected(state == SessionState.ACTIVE && signalingRelay.isBound(roomId, role.peer()))
                .startedAt(session.map(MeetingSession::getStartedAt).orElse(null))
                .endedAt(session.map(MeetingSession::getEndedAt).orElse(null))
                .closeReason(session.map(MeetingSession::getCloseReason).orElse(null))
                .nextPollMs(state.isTerminal() ? null : appProperties.getStatus().getPollIntervalMs())
                .build();
    }

    static String messageFor(SessionState state, ParticipantRole role, boolean canJoin) {
        return switch (state) {
            case SCHEDULED -> role == ParticipantRole.DOCTOR
                    ? "Start the consultation when you are ready."
                    : "Consultation not started yet. Please wait for the doctor.";
            case ACTIVE -> {
                if (!canJoin) {
                    yield "You are connected to this consultation.";
                }
                yield role == ParticipantRole.DOCTOR
                        ? "Consultation in progress. Rejoin the call."
                        : "The doctor is ready. You can join the consultation.";
            }
            case ENDED -> "This consultation has ended";
            case CANCELLED -> "This consultation was cancelled";
        };
    }
}
