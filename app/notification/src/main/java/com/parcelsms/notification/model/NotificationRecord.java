/*
 * Where: Notification domain model
 * What: Snapshot of one row of the notifications table
 * Why: Shared by enqueue, dispatch, compensation and the admin history API
 */
package com.parcelsms.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    NotificationIntent intent,
    UUID appointmentId,
    UUID householdId,
    String recipient,
    String renderedText,
    String locale,
    NotificationStatus status,
    String idempotencyKey,
    String lockedBy,
    Instant lockedAt,
    IneligibilityReason cancelReason,
    FailureKind failureKind,
    String errorMessage,
    String providerMessageId,
    Instant createdAt,
    Instant dueAt,
    Instant sentAt,
    Instant finalizedAt,
    Instant dismissedAt,
    String dismissedBy) {

  public boolean dismissed() {
    return dismissedAt != null;
  }

  /** A freshly queued record; every dispatch-side field starts empty. */
  public static NotificationRecord queued(
      UUID notificationId,
      NotificationIntent intent,
      UUID appointmentId,
      UUID householdId,
      String recipient,
      String renderedText,
      String locale,
      String idempotencyKey,
      Instant createdAt,
      Instant dueAt) {
    return new NotificationRecord(
        notificationId,
        intent,
        appointmentId,
        householdId,
        recipient,
        renderedText,
        locale,
        NotificationStatus.QUEUED,
        idempotencyKey,
        null,
        null,
        null,
        null,
        null,
        null,
        createdAt,
        dueAt,
        null,
        null,
        null,
        null);
  }
}
