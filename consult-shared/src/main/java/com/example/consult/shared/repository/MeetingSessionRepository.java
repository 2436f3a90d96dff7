package com.example.consult.shared.repository;

import com.example.consult.shared.aspect.Monitored;
import com.example.consult.shared.model.AppointmentRef;
import com.example.consult.shared.model.MeetingSession;
import com.example.consult.shared.model.StateTransition;
import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Session store. Every state change goes through {@link #compareAndSwapState} (or its guarded
 * variant {@link #expireIfAbandoned}), a single conditional UPDATE, so two racing transitions on
 * the same room can never both commit.
 */
@Repository
@Monitored("repository")
@Slf4j
public class MeetingSessionRepository {

    private final JdbcTemplate jdbcTemplate;

    public MeetingSessionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<MeetingSession> sessionRowMapper = new RowMapper<>() {
        @Override
        public MeetingSession mapRow(ResultSet rs, int rowNum) throws SQLException {
            String closeReason = rs.getString("close_reason");
            long duration = rs.getLong("duration_seconds");
            Long durationSeconds = rs.wasNull() ? null : duration;
            return MeetingSession.builder()
                    .roomId(rs.getString("room_id"))
                    .appointmentId(rs.getLong("appointment_id"))
                    .doctorId(rs.getString("doctor_id"))
                    .patientId(rs.getString("patient_id"))
                    .state(SessionState.valueOf(rs.getString("state")))
                    .scheduledAt(toOffsetDateTime(rs.getTimestamp("scheduled_at")))
                    .startedAt(toOffsetDateTime(rs.getTimestamp("started_at")))
                    .endedAt(toOffsetDateTime(rs.getTimestamp("ended_at")))
                    .lastPatientSeenAt(toOffsetDateTime(rs.getTimestamp("last_patient_seen_at")))
                    .doctorJoinedAt(toOffsetDateTime(rs.getTimestamp("doctor_joined_at")))
                    .closeReason(closeReason != null ? CloseReason.valueOf(closeReason) : null)
                    .durationSeconds(durationSeconds)
                    .createdAt(toOffsetDateTime(rs.getTimestamp("created_at")))
                    .updatedAt(toOffsetDateTime(rs.getTimestamp("updated_at")))
                    .build();
        }
    };

    public Optional<MeetingSession> findByRoomId(String roomId) {
        String sql = "SELECT * FROM meeting_sessions WHERE room_id = ?";
        List<MeetingSession> results = jdbcTemplate.query(sql, sessionRowMapper, roomId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Creates the SCHEDULED record for a room, or returns the existing one. Safe to call concurrently:
     * the loser of an insert race reads the winner's row.
     */
    public MeetingSession getOrCreate(String roomId, AppointmentRef appointment, OffsetDateTime now) {
        Optional<MeetingSession> existing = findByRoomId(roomId);
        if (existing.isPresent()) {
            return existing.get();
        }
        String sql = """
            INSERT INTO meeting_sessions
                (room_id, appointment_id, doctor_id, patient_id, state, scheduled_at, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                    roomId,
                    appointment.appointmentId(),
                    appointment.doctorId(),
                    appointment.patientId(),
                    SessionState.SCHEDULED.name(),
                    toTimestamp(appointment.scheduledAt()),
                    toTimestamp(now),
                    toTimestamp(now));
            log.info("Created meeting session for room {} (appointment {})", roomId, appointment.appointmentId());
        } catch (DuplicateKeyException e) {
            log.debug("Meeting session for room {} was created concurrently, reading it back.", roomId);
        }
        return findByRoomId(roomId)
                .orElseThrow(() -> new IllegalStateException("Meeting session vanished after creation: " + roomId));
    }

    /**
     * Applies {@code expected -> next} only if the row is still in {@code expected}.
     *
     * @return true if this call won the transition
     */
    public boolean compareAndSwapState(String roomId, SessionState expected, SessionState next, StateTransition transition) {
        List<String> assignments = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        appendTransitionColumns(next, transition, assignments, args);

        String sql = "UPDATE meeting_sessions SET " + String.join(", ", assignments)
                + " WHERE room_id = ? AND state = ?";
        args.add(roomId);
        args.add(expected.name());
        int updated = jdbcTemplate.update(sql, args.toArray());
        return updated == 1;
    }

    /**
     * ACTIVE -> ENDED, only while the abandonment predicate still holds: the patient was last seen
     * before {@code graceCutoff}, or was never seen and the session started before {@code noShowCutoff}.
     * A patient reconnecting between the sweep's read and this update makes it a no-op.
     */
    public boolean expireIfAbandoned(String roomId, OffsetDateTime graceCutoff, OffsetDateTime noShowCutoff, StateTransition transition) {
        List<String> assignments = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        appendTransitionColumns(SessionState.ENDED, transition, assignments, args);

        String sql = "UPDATE meeting_sessions SET " + String.join(", ", assignments)
                + " WHERE room_id = ? AND state = ?"
                + " AND ((last_patient_seen_at IS NOT NULL AND last_patient_seen_at < ?)"
                + " OR (last_patient_seen_at IS NULL AND started_at < ?))";
        args.add(roomId);
        args.add(SessionState.ACTIVE.name());
        args.add(toTimestamp(graceCutoff));
        args.add(toTimestamp(noShowCutoff));
        return jdbcTemplate.update(sql, args.toArray()) == 1;
    }

    public List<MeetingSession> findAbandonedCandidates(OffsetDateTime graceCutoff, OffsetDateTime noShowCutoff, int limit) {
        String sql = """
            SELECT * FROM meeting_sessions
            WHERE state = 'ACTIVE'
              AND ((last_patient_seen_at IS NOT NULL AND last_patient_seen_at < ?)
                OR (last_patient_seen_at IS NULL AND started_at < ?))
            ORDER BY started_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, sessionRowMapper, toTimestamp(graceCutoff), toTimestamp(noShowCutoff), limit);
    }

    /**
     * ACTIVE -> ENDED, only while the doctor has still never joined the call and the session started
     * before {@code noShowCutoff}.
     */
    public boolean expireIfDoctorAbsent(String roomId, OffsetDateTime noShowCutoff, StateTransition transition) {
        List<String> assignments = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        appendTransitionColumns(SessionState.ENDED, transition, assignments, args);

        String sql = "UPDATE meeting_sessions SET " + String.join(", ", assignments)
                + " WHERE room_id = ? AND state = ? AND doctor_joined_at IS NULL AND started_at < ?";
        args.add(roomId);
        args.add(SessionState.ACTIVE.name());
        args.add(toTimestamp(noShowCutoff));
        return jdbcTemplate.update(sql, args.toArray()) == 1;
    }

    public List<MeetingSession> findDoctorNoShowCandidates(OffsetDateTime noShowCutoff, int limit) {
        String sql = """
            SELECT * FROM meeting_sessions
            WHERE state = 'ACTIVE'
              AND doctor_joined_at IS NULL
              AND started_at < ?
            ORDER BY started_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, sessionRowMapper, toTimestamp(noShowCutoff), limit);
    }

    /**
     * Stamps the first time the doctor joined an active session; later joins keep the first stamp.
     */
    public int markDoctorJoined(String roomId, OffsetDateTime joinedAt) {
        String sql = "UPDATE meeting_sessions SET doctor_joined_at = COALESCE(doctor_joined_at, ?) WHERE room_id = ? AND state = 'ACTIVE'";
        return jdbcTemplate.update(sql, toTimestamp(joinedAt), roomId);
    }

    public int touchPatientSeen(String roomId, OffsetDateTime seenAt) {
        String sql = "UPDATE meeting_sessions SET last_patient_seen_at = ? WHERE room_id = ? AND state = 'ACTIVE'";
        return jdbcTemplate.update(sql, toTimestamp(seenAt), roomId);
    }

    public int touchPatientsSeen(Collection<String> roomIds, OffsetDateTime seenAt) {
        if (roomIds == null || roomIds.isEmpty()) {
            return 0;
        }
        String sql = String.format(
            "UPDATE meeting_sessions SET last_patient_seen_at = ? WHERE state = 'ACTIVE' AND room_id IN (%s)",
            String.join(",", Collections.nCopies(roomIds.size(), "?"))
        );
        List<Object> args = new ArrayList<>(roomIds.size() + 1);
        args.add(toTimestamp(seenAt));
        args.addAll(roomIds);
        return jdbcTemplate.update(sql, args.toArray());
    }

    public List<MeetingSession> findByParticipant(String userId) {
        String sql = """
            SELECT * FROM meeting_sessions
            WHERE doctor_id = ? OR patient_id = ?
            ORDER BY scheduled_at DESC, created_at DESC
            """;
        return jdbcTemplate.query(sql, sessionRowMapper, userId, userId);
    }

    public long countByState(SessionState state) {
        String sql = "SELECT COUNT(*) FROM meeting_sessions WHERE state = ?";
        Long count = jdbcTemplate.queryForObject(sql, Long.class, state.name());
        return count != null ? count : 0L;
    }

    private void appendTransitionColumns(SessionState next, StateTransition transition, List<String> assignments, List<Object> args) {
        assignments.add("state = ?");
        args.add(next.name());
        if (transition.startedAt() != null) {
            assignments.add("started_at = ?");
            args.add(toTimestamp(transition.startedAt()));
        }
        if (transition.endedAt() != null) {
            assignments.add("ended_at = ?");
            args.add(toTimestamp(transition.endedAt()));
        }
        if (transition.closeReason() != null) {
            assignments.add("close_reason = ?");
            args.add(transition.closeReason().name());
        }
        if (transition.durationSeconds() != null) {
            assignments.add("duration_seconds = ?");
            args.add(transition.durationSeconds());
        }
        assignments.add("updated_at = ?");
        args.add(toTimestamp(transition.occurredAt()));
    }

    private static Timestamp toTimestamp(OffsetDateTime value) {
        return value != null ? Timestamp.from(value.toInstant()) : null;
    }

    private static OffsetDateTime toOffsetDateTime(Timestamp value) {
        return value != null ? value.toInstant().atOffset(ZoneOffset.UTC) : null;
    }
}
