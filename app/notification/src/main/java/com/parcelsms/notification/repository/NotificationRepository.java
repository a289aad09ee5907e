/*
 * Where: Notification data access
 * What: Idempotent insert and conditional state transitions of the notifications table
 * Why: The table is the single source of truth for "has this SMS already gone out"
 */
package com.parcelsms.notification.repository;

import static com.parcelsms.common.JdbcTimestampUtils.toInstant;
import static com.parcelsms.common.JdbcTimestampUtils.toTimestamp;

import com.parcelsms.notification.model.FailureKind;
import com.parcelsms.notification.model.IneligibilityReason;
import com.parcelsms.notification.model.NotificationIntent;
import com.parcelsms.notification.model.NotificationRecord;
import com.parcelsms.notification.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String COLUMNS =
      """
      notification_id, intent, appointment_id, household_id, recipient, rendered_text, locale,
      status, idempotency_key, locked_by, locked_at, cancel_reason, failure_kind, error_message,
      provider_message_id, created_at, due_at, sent_at, finalized_at, dismissed_at, dismissed_by
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts the record unless its idempotency key is already taken.
   *
   * @return the inserted row, or empty when another record owns the key
   */
  public Optional<NotificationRecord> insertIfAbsent(NotificationRecord record) {
    // ON CONFLICT keeps the surrounding transaction usable, unlike catching a unique violation
    final String sql =
        """
        INSERT INTO notifications (
          notification_id, intent, appointment_id, household_id, recipient, rendered_text, locale,
          status, idempotency_key, created_at, due_at
        ) VALUES (
          :notificationId, :intent, :appointmentId, :householdId, :recipient, :renderedText, :locale,
          :status, :idempotencyKey, :createdAt, :dueAt
        )
        ON CONFLICT (idempotency_key) DO NOTHING
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("intent", record.intent().value())
            .addValue("appointmentId", record.appointmentId())
            .addValue("householdId", record.householdId())
            .addValue("recipient", record.recipient())
            .addValue("renderedText", record.renderedText())
            .addValue("locale", record.locale())
            .addValue("status", record.status().name())
            .addValue("idempotencyKey", record.idempotencyKey())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("dueAt", toTimestamp(record.dueAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql =
        "SELECT %s FROM notifications WHERE notification_id = :notificationId".formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<NotificationRecord> findByIdempotencyKey(String idempotencyKey) {
    final String sql =
        "SELECT %s FROM notifications WHERE idempotency_key = :idempotencyKey".formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("idempotencyKey", idempotencyKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationRecord> findByAppointmentId(UUID appointmentId) {
    final String sql =
        """
        SELECT %s
        FROM notifications
        WHERE appointment_id = :appointmentId
        ORDER BY created_at DESC, notification_id
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("appointmentId", appointmentId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Failed records an operator has not dismissed yet, newest first. */
  public List<NotificationRecord> findFailed(int limit) {
    final String sql =
        """
        SELECT %s
        FROM notifications
        WHERE status = 'FAILED'
          AND dismissed_at IS NULL
        ORDER BY finalized_at DESC NULLS LAST
        LIMIT :limit
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Sets or clears the dismissal of a FAILED record.
   *
   * @return the updated row, or empty when no FAILED record has that id
   */
  public Optional<NotificationRecord> updateDismissal(
      UUID notificationId, Instant dismissedAt, String dismissedBy) {
    final String sql =
        """
        UPDATE notifications
        SET dismissed_at = :dismissedAt,
            dismissed_by = :dismissedBy
        WHERE notification_id = :notificationId
          AND status = 'FAILED'
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dismissedAt", toTimestamp(dismissedAt), Types.TIMESTAMP)
            .addValue("dismissedBy", dismissedBy, Types.VARCHAR)
            .addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean existsSentForAppointment(
      UUID appointmentId, Collection<NotificationIntent> intents) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM notifications
          WHERE appointment_id = :appointmentId
            AND status = 'SENT'
            AND intent IN (:intents)
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("appointmentId", appointmentId)
            .addValue("intents", intents.stream().map(NotificationIntent::value).toList());
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /**
   * Moves due QUEUED rows to SENDING in one statement and returns only the rows this caller won.
   */
  public List<NotificationRecord> claimDue(int limit, Instant now, String lockedBy) {
    // SKIP LOCKED lets parallel workers take disjoint batches without waiting on each other
    final String sql =
        """
        WITH cte AS (
          SELECT notification_id
          FROM notifications
          WHERE status = 'QUEUED'
            AND due_at <= :now
          ORDER BY due_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notifications n
        SET status = 'SENDING',
            locked_by = :lockedBy,
            locked_at = :now
        FROM cte
        WHERE n.notification_id = cte.notification_id
          AND n.status = 'QUEUED'
        RETURNING %s
        """
            .formatted(qualified("n"));
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int updateRendered(UUID notificationId, String recipient, String text, String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET recipient = :recipient,
            rendered_text = :renderedText
        WHERE notification_id = :notificationId
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipient", recipient)
            .addValue("renderedText", text)
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markSent(
      UUID notificationId, Instant sentAt, String providerMessageId, String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'SENT',
            sent_at = :sentAt,
            finalized_at = :sentAt,
            provider_message_id = :providerMessageId,
            locked_by = NULL,
            locked_at = NULL
        WHERE notification_id = :notificationId
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("providerMessageId", providerMessageId)
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(
      UUID notificationId,
      FailureKind failureKind,
      String errorMessage,
      Instant failedAt,
      String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'FAILED',
            failure_kind = :failureKind,
            error_message = :errorMessage,
            finalized_at = :failedAt,
            locked_by = NULL,
            locked_at = NULL
        WHERE notification_id = :notificationId
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("failureKind", failureKind.name())
            .addValue("errorMessage", errorMessage)
            .addValue("failedAt", toTimestamp(failedAt))
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markCancelled(
      UUID notificationId, IneligibilityReason reason, Instant cancelledAt, String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'CANCELLED',
            cancel_reason = :reason,
            finalized_at = :cancelledAt,
            locked_by = NULL,
            locked_at = NULL
        WHERE notification_id = :notificationId
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reason", reason.code())
            .addValue("cancelledAt", toTimestamp(cancelledAt))
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** Cancels every QUEUED/SENDING record of the appointment and returns how many changed. */
  public int cancelAllNonTerminal(
      UUID appointmentId, IneligibilityReason reason, Instant cancelledAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'CANCELLED',
            cancel_reason = :reason,
            finalized_at = :cancelledAt,
            locked_by = NULL,
            locked_at = NULL
        WHERE appointment_id = :appointmentId
          AND status IN ('QUEUED', 'SENDING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reason", reason.code())
            .addValue("cancelledAt", toTimestamp(cancelledAt))
            .addValue("appointmentId", appointmentId);
    return jdbcTemplate.update(sql, params);
  }

  public int countDue(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE status = 'QUEUED'
          AND due_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * Deletes terminal records created before the threshold. Records of an appointment whose pickup
   * window has not ended yet are kept, because their keys still guard against duplicates and a
   * sent reminder still decides whether a cancellation notice goes out.
   */
  public int deleteTerminalOlderThan(Instant threshold, Instant now) {
    final String sql =
        """
        DELETE FROM notifications n
        WHERE n.created_at < :threshold
          AND n.status IN ('SENT', 'FAILED', 'CANCELLED')
          AND NOT EXISTS (
            SELECT 1
            FROM appointments a
            WHERE a.appointment_id = n.appointment_id
              AND a.pickup_window_end >= :now
          )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE created_at < :threshold
          AND status IN ('QUEUED', 'SENDING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private static String qualified(String alias) {
    return String.join(
        ", ",
        Arrays.stream(COLUMNS.split(","))
            .map(String::trim)
            .map(column -> alias + "." + column)
            .toList());
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String appointmentId = rs.getString("appointment_id");
    final String cancelReason = rs.getString("cancel_reason");
    final String failureKind = rs.getString("failure_kind");
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        NotificationIntent.fromValue(rs.getString("intent")),
        appointmentId == null ? null : UUID.fromString(appointmentId),
        UUID.fromString(rs.getString("household_id")),
        rs.getString("recipient"),
        rs.getString("rendered_text"),
        rs.getString("locale"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getString("idempotency_key"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        cancelReason == null ? null : IneligibilityReason.fromCode(cancelReason),
        failureKind == null ? null : FailureKind.valueOf(failureKind),
        rs.getString("error_message"),
        rs.getString("provider_message_id"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("due_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("finalized_at")),
        toInstant(rs.getTimestamp("dismissed_at")),
        rs.getString("dismissed_by"));
  }
}
