/*
 * Where: Notification admin API response DTO
 * What: One notification record as shown in the admin history
 * Why: Expose status and reasons while masking the recipient number
 */
package com.parcelsms.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.parcelsms.notification.model.NotificationRecord;
import com.parcelsms.notification.service.PhoneNumbers;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationView(
    UUID notificationId,
    String intent,
    UUID appointmentId,
    UUID householdId,
    String status,
    String recipient,
    String renderedText,
    String cancelReason,
    String failureKind,
    String errorMessage,
    String providerMessageId,
    Instant createdAt,
    Instant dueAt,
    Instant sentAt,
    Instant finalizedAt,
    Instant dismissedAt,
    String dismissedBy) {

  public static NotificationView from(NotificationRecord record) {
    return new NotificationView(
        record.notificationId(),
        record.intent().value(),
        record.appointmentId(),
        record.householdId(),
        record.status().name().toLowerCase(Locale.ROOT),
        PhoneNumbers.mask(record.recipient()),
        record.renderedText(),
        record.cancelReason() == null ? null : record.cancelReason().code(),
        record.failureKind() == null
            ? null
            : record.failureKind().name().toLowerCase(Locale.ROOT),
        record.errorMessage(),
        record.providerMessageId(),
        record.createdAt(),
        record.dueAt(),
        record.sentAt(),
        record.finalizedAt(),
        record.dismissedAt(),
        record.dismissedBy());
  }
}
