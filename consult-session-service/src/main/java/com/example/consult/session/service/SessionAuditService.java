package com.example.consult.session.service;

import com.example.consult.session.security.CallerIdentity;
import com.example.consult.shared.config.MonitoringConfig.ConsultMetricsCollector;
import com.example.consult.shared.model.SessionAuditRecord;
import com.example.consult.shared.repository.SessionAuditRepository;
import com.example.consult.shared.util.Constants;
import com.example.consult.shared.util.Constants.AuditOutcome;
import com.example.consult.shared.util.Constants.SessionOperation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Audit trail of ownership decisions: one line on the AUDIT logger and one row in
 * {@code session_audit_log} per decision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionAuditService {

    private static final Logger AUDIT = LoggerFactory.getLogger(Constants.AUDIT_LOGGER);
    private static final int MAX_DETAIL_LENGTH = 255;

    private final SessionAuditRepository auditRepository;
    private final ConsultMetricsCollector metricsCollector;
    private final Clock clock;

    public void record(CallerIdentity caller, String roomId, SessionOperation operation, AuditOutcome outcome, String detail) {
        String userId = caller != null ? caller.userId() : null;
        String role = caller != null ? caller.claimedRole() : null;

        AUDIT.info("user={} role={} room={} operation={} outcome={}{}",
                userId, role, roomId, operation, outcome, detail != null ? " detail=" + detail : "");
        metricsCollector.incrementCounter("consult.gate.decisions", "operation", operation.name(), "outcome", outcome.name());

        SessionAuditRecord record = SessionAuditRecord.builder()
                .occurredAt(OffsetDateTime.now(clock))
                .userId(userId)
                .userRole(role)
                .roomId(roomId)
                .operation(operation.name())
                .outcome(outcome.name())
                .detail(truncate(detail))
                .build();
        try {
            auditRepository.save(record);
        } catch (RuntimeException e) {
            // Covers DbActionExecutionException, which Spring Data JDBC does not translate
            log.error("Failed to persist audit record for room {} ({} {}): {}", roomId, operation, outcome, e.getMessage());
        }
    }

    public List<SessionAuditRecord> findByRoom(String roomId) {
        return auditRepository.findByRoomIdOrderByOccurredAtAsc(roomId);
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH);
    }
}
