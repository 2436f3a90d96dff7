package com.example.consult.shared.repository;

import com.example.consult.shared.aspect.Monitored;
import com.example.consult.shared.model.AppointmentRef;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the scheduling system's appointments table.
 */
@Repository
@Monitored("repository")
public class AppointmentRepository {

    private final JdbcTemplate jdbcTemplate;

    public AppointmentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<AppointmentRef> appointmentRowMapper = (rs, rowNum) -> new AppointmentRef(
            rs.getLong("id"),
            rs.getString("doctor_id"),
            rs.getString("patient_id"),
            rs.getTimestamp("appointment_date") != null
                    ? rs.getTimestamp("appointment_date").toInstant().atOffset(ZoneOffset.UTC) : null,
            rs.getString("status"));

    public Optional<AppointmentRef> findById(long appointmentId) {
        String sql = "SELECT id, doctor_id, patient_id, appointment_date, status FROM appointments WHERE id = ?";
        List<AppointmentRef> results = jdbcTemplate.query(sql, appointmentRowMapper, appointmentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
