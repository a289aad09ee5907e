/*
 * Where: Notification data access
 * What: JDBC implementation of AppointmentDirectory over the appointments and households tables
 * Why: Eligibility and re-render need the current row, never a cached copy
 */
package com.parcelsms.notification.repository;

import static com.parcelsms.common.JdbcTimestampUtils.toInstant;
import static com.parcelsms.common.JdbcTimestampUtils.toTimestamp;

import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.Household;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcAppointmentDirectory implements AppointmentDirectory {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<Appointment> findAppointment(UUID appointmentId) {
    final String sql =
        """
        SELECT a.appointment_id, a.household_id, a.location_id,
               a.pickup_window_start, a.pickup_window_end, a.is_fulfilled, a.cancelled_at,
               h.anonymized_at IS NOT NULL AS household_anonymized
        FROM appointments a
        JOIN households h ON h.household_id = a.household_id
        WHERE a.appointment_id = :appointmentId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("appointmentId", appointmentId);
    return jdbcTemplate.query(sql, params, this::mapAppointment).stream().findFirst();
  }

  @Override
  public Optional<Household> findHousehold(UUID householdId) {
    final String sql =
        """
        SELECT household_id, phone_number, locale, anonymized_at
        FROM households
        WHERE household_id = :householdId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("householdId", householdId);
    return jdbcTemplate.query(sql, params, this::mapHousehold).stream().findFirst();
  }

  @Override
  public boolean markCancelled(UUID appointmentId, String cancelledBy, Instant cancelledAt) {
    final String sql =
        """
        UPDATE appointments
        SET cancelled_at = :cancelledAt,
            cancelled_by = :cancelledBy
        WHERE appointment_id = :appointmentId
          AND cancelled_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cancelledAt", toTimestamp(cancelledAt))
            .addValue("cancelledBy", cancelledBy)
            .addValue("appointmentId", appointmentId);
    return jdbcTemplate.update(sql, params) > 0;
  }

  private Appointment mapAppointment(ResultSet rs, int rowNum) throws SQLException {
    return new Appointment(
        UUID.fromString(rs.getString("appointment_id")),
        UUID.fromString(rs.getString("household_id")),
        UUID.fromString(rs.getString("location_id")),
        toInstant(rs.getTimestamp("pickup_window_start")),
        toInstant(rs.getTimestamp("pickup_window_end")),
        rs.getBoolean("is_fulfilled"),
        toInstant(rs.getTimestamp("cancelled_at")),
        rs.getBoolean("household_anonymized"));
  }

  private Household mapHousehold(ResultSet rs, int rowNum) throws SQLException {
    return new Household(
        UUID.fromString(rs.getString("household_id")),
        rs.getString("phone_number"),
        rs.getString("locale"),
        rs.getTimestamp("anonymized_at") != null);
  }
}
