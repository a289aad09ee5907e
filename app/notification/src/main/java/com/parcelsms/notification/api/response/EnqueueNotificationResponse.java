package com.parcelsms.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.parcelsms.notification.service.EnqueueResult;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/** {@code created=false} means an existing notification already covers the request. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnqueueNotificationResponse(
    UUID notificationId, String intent, String status, boolean created, Instant dueAt) {

  public static EnqueueNotificationResponse from(EnqueueResult result) {
    return new EnqueueNotificationResponse(
        result.record().notificationId(),
        result.record().intent().value(),
        result.record().status().name().toLowerCase(Locale.ROOT),
        result.created(),
        result.record().dueAt());
  }
}
