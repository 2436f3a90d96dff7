package com.example.consult.session.relay;

import com.example.consult.shared.util.Constants.ParticipantRole;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.OffsetDateTime;

/**
 * Published when a participant's relay connection goes away on its own (transport closed or explicit
 * leave). Not published for replaced connections or for rooms the relay closed itself.
 */
@Getter
public class ParticipantDisconnectedEvent extends ApplicationEvent {
    private final String roomId;
    private final ParticipantRole role;
    private final String userId;
    private final String connectionId;
    private final OffsetDateTime disconnectedAt;

    public ParticipantDisconnectedEvent(Object source, String roomId, ParticipantRole role, String userId,
                                        String connectionId, OffsetDateTime disconnectedAt) {
        super(source);
        this.roomId = roomId;
        this.role = role;
        this.userId = userId;
        this.connectionId = connectionId;
        this.disconnectedAt = disconnectedAt;
    }
}
