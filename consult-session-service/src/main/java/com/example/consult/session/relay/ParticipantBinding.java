package com.example.consult.session.relay;

import com.example.consult.shared.util.Constants.ParticipantRole;
import lombok.Getter;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.OffsetDateTime;

/**
 * One admitted connection and its outbound event stream. Emission is serialized per binding so
 * frames from one sender reach the peer in the order they were relayed.
 */
@Getter
public class ParticipantBinding {

    private final String connectionId;
    private final ParticipantRole role;
    private final String userId;
    private final OffsetDateTime boundAt;
    private final Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().unicast().onBackpressureBuffer();

    public ParticipantBinding(String connectionId, ParticipantRole role, String userId, OffsetDateTime boundAt) {
        this.connectionId = connectionId;
        this.role = role;
        this.userId = userId;
        this.boundAt = boundAt;
    }

    public synchronized boolean emit(ServerSentEvent<String> event) {
        if (event == null) {
            return false;
        }
        return sink.tryEmitNext(event).isSuccess();
    }

    public synchronized void complete() {
        sink.tryEmitComplete();
    }

    public Flux<ServerSentEvent<String>> asFlux() {
        return sink.asFlux();
    }
}
