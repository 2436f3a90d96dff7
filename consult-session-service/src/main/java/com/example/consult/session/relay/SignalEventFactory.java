package com.example.consult.session.relay;

import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.RelayEventType;
import com.example.consult.shared.util.Constants.SessionState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SignalEventFactory {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Serializes {@code data} as the JSON body of an SSE event named {@code eventName}.
     *
     * @return the event, or null if serialization fails
     */
    public ServerSentEvent<String> createEvent(String eventName, String eventId, Object data) {
        try {
            String payload = objectMapper.writeValueAsString(data);
            return ServerSentEvent.<String>builder()
                .event(eventName)
                .id(eventId)
                .data(payload)
                .build();
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for relay event {}: {}", eventName, e.getMessage());
            return null;
        }
    }

    public ServerSentEvent<String> createConnectedEvent(String roomId, String connectionId, ParticipantRole role, boolean peerConnected) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("roomId", roomId);
        data.put("connectionId", connectionId);
        data.put("role", role.name());
        data.put("peerConnected", peerConnected);
        data.put("timestamp", now());
        return createEvent(RelayEventType.CONNECTED.name(), connectionId, data);
    }

    public ServerSentEvent<String> createPeerJoinedEvent(ParticipantRole peerRole) {
        return createEvent(RelayEventType.PEER_JOINED.name(), null, Map.of("role", peerRole.name(), "timestamp", now()));
    }

    public ServerSentEvent<String> createPeerLeftEvent(ParticipantRole peerRole) {
        return createEvent(RelayEventType.PEER_LEFT.name(), null, Map.of("role", peerRole.name(), "timestamp", now()));
    }

    /**
     * Forwards the frame verbatim; only the sender's role is added.
     */
    public ServerSentEvent<String> createSignalEvent(SignalFrame frame, ParticipantRole fromRole) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", frame.type().wireName());
        data.put("from", fromRole.name());
        data.put("payload", frame.payload());
        return createEvent(frame.type().wireName(), null, data);
    }

    public ServerSentEvent<String> createHeartbeatEvent() {
        return createEvent(RelayEventType.HEARTBEAT.name(), null, Map.of("timestamp", now()));
    }

    public ServerSentEvent<String> createReplacedEvent(String connectionId) {
        return createEvent(RelayEventType.REPLACED.name(), connectionId, Map.of(
            "message", "This consultation was opened in another window",
            "timestamp", now()));
    }

    public ServerSentEvent<String> createSessionEndedEvent(SessionState state, CloseReason reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("state", state.name());
        data.put("reason", reason != null ? reason.name() : null);
        data.put("timestamp", now());
        return createEvent(RelayEventType.SESSION_ENDED.name(), null, data);
    }

    public ServerSentEvent<String> createShutdownEvent() {
        return ServerSentEvent.<String>builder()
               .event(RelayEventType.SERVER_SHUTDOWN.name())
               .data("Server is shutting down. Please reconnect momentarily.")
               .build();
    }

    private String now() {
        return OffsetDateTime.now(clock).toString();
    }
}
