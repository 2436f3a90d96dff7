package com.example.consult.session.service;

import com.example.consult.session.relay.ParticipantDisconnectedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Moves disconnect handling off the transport thread that noticed the closed stream.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ParticipantDisconnectListener {

    private final ConsultationLifecycleService lifecycleService;

    @Async
    @EventListener
    public void onParticipantDisconnected(ParticipantDisconnectedEvent event) {
        log.debug("Handling {} disconnect for room {} (connection {})", event.getRole(), event.getRoomId(), event.getConnectionId());
        try {
            lifecycleService.handleParticipantDisconnect(event);
        } catch (RuntimeException e) {
            log.error("Failed to handle {} disconnect for room {}: {}", event.getRole(), event.getRoomId(), e.getMessage(), e);
        }
    }
}
