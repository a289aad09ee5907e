package com.parcelsms.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationHistoryResponse(UUID appointmentId, List<NotificationView> notifications) {
  public NotificationHistoryResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
