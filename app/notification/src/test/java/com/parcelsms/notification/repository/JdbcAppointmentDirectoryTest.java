/*
 * Where: Notification repository integration tests
 * What: Verifies appointment and household lookups and the one-shot soft delete
 */
package com.parcelsms.notification.repository;

import static com.parcelsms.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;

import com.parcelsms.notification.AbstractPostgresContainerTest;
import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.Household;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcAppointmentDirectoryTest extends AbstractPostgresContainerTest {

  private static final Instant START = Instant.parse("2025-10-15T10:00:00Z");
  private static final Instant END = Instant.parse("2025-10-15T12:00:00Z");

  @Autowired private AppointmentDirectory appointmentDirectory;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM appointments", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM households", new MapSqlParameterSource());
  }

  @Test
  void findAppointmentJoinsHouseholdAnonymization() {
    final UUID householdId = insertHousehold("0701234567", "en", Instant.parse("2025-01-01T00:00:00Z"));
    final UUID appointmentId = insertAppointment(householdId);

    final Appointment appointment = appointmentDirectory.findAppointment(appointmentId).orElseThrow();

    assertThat(appointment.householdId()).isEqualTo(householdId);
    assertThat(appointment.pickupWindowStart()).isEqualTo(START);
    assertThat(appointment.pickupWindowEnd()).isEqualTo(END);
    assertThat(appointment.fulfilled()).isFalse();
    assertThat(appointment.cancelled()).isFalse();
    assertThat(appointment.householdAnonymized()).isTrue();
  }

  @Test
  void findHouseholdMapsContactData() {
    final UUID householdId = insertHousehold(null, "sv", null);

    final Household household = appointmentDirectory.findHousehold(householdId).orElseThrow();

    assertThat(household.phoneNumber()).isNull();
    assertThat(household.locale()).isEqualTo("sv");
    assertThat(household.anonymized()).isFalse();
  }

  @Test
  void unknownIdsAreEmpty() {
    assertThat(appointmentDirectory.findAppointment(UUID.randomUUID())).isEmpty();
    assertThat(appointmentDirectory.findHousehold(UUID.randomUUID())).isEmpty();
  }

  @Test
  void markCancelledSucceedsOnlyOnce() {
    final UUID appointmentId = insertAppointment(insertHousehold("0701234567", "sv", null));
    final Instant cancelledAt = Instant.parse("2025-10-14T08:00:00Z");

    final boolean first = appointmentDirectory.markCancelled(appointmentId, "admin-1", cancelledAt);
    final boolean second =
        appointmentDirectory.markCancelled(appointmentId, "admin-2", cancelledAt.plusSeconds(5));

    assertThat(first).isTrue();
    assertThat(second).isFalse();
    assertThat(appointmentDirectory.findAppointment(appointmentId).orElseThrow().cancelledAt())
        .isEqualTo(cancelledAt);
  }

  private UUID insertHousehold(String phone, String locale, Instant anonymizedAt) {
    final UUID householdId = UUID.randomUUID();
    jdbcTemplate.update(
        """
        INSERT INTO households (household_id, phone_number, locale, anonymized_at)
        VALUES (:householdId, :phone, :locale, :anonymizedAt)
        """,
        new MapSqlParameterSource()
            .addValue("householdId", householdId)
            .addValue("phone", phone)
            .addValue("locale", locale)
            .addValue("anonymizedAt", toTimestamp(anonymizedAt)));
    return householdId;
  }

  private UUID insertAppointment(UUID householdId) {
    final UUID appointmentId = UUID.randomUUID();
    jdbcTemplate.update(
        """
        INSERT INTO appointments (
          appointment_id, household_id, location_id, pickup_window_start, pickup_window_end
        ) VALUES (:appointmentId, :householdId, :locationId, :start, :end)
        """,
        new MapSqlParameterSource()
            .addValue("appointmentId", appointmentId)
            .addValue("householdId", householdId)
            .addValue("locationId", UUID.randomUUID())
            .addValue("start", toTimestamp(START))
            .addValue("end", toTimestamp(END)));
    return appointmentId;
  }
}
