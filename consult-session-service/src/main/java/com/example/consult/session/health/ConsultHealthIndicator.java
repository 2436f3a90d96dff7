package com.example.consult.session.health;

import com.example.consult.session.relay.RelayStats;
import com.example.consult.session.relay.SignalingRelay;
import com.example.consult.shared.repository.MeetingSessionRepository;
import com.example.consult.shared.util.Constants.SessionState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the relay and of the session store behind it.
 */
@Component
public class ConsultHealthIndicator implements HealthIndicator {

    private final SignalingRelay signalingRelay;
    private final MeetingSessionRepository sessionRepository;

    public ConsultHealthIndicator(SignalingRelay signalingRelay, MeetingSessionRepository sessionRepository) {
        this.signalingRelay = signalingRelay;
        this.sessionRepository = sessionRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        boolean relayHealthy = checkRelay(details);
        boolean storeHealthy = checkSessionStore(details);

        Health.Builder healthBuilder = relayHealthy && storeHealthy ? Health.up() : Health.down();
        return healthBuilder
                .withDetails(details)
                .build();
    }

    private boolean checkRelay(Map<String, Object> details) {
        try {
            RelayStats stats = signalingRelay.stats();
            details.put("relayRooms", stats.activeRooms());
            details.put("relayConnections", stats.totalConnections());
            details.put("relayStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("relayStatus", "DOWN");
            details.put("relayError", e.getMessage());
            return false;
        }
    }

    private boolean checkSessionStore(Map<String, Object> details) {
        try {
            details.put("activeSessions", sessionRepository.countByState(SessionState.ACTIVE));
            details.put("sessionStoreStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("sessionStoreStatus", "DOWN");
            details.put("sessionStoreError", e.getMessage());
            return false;
        }
    }
}
