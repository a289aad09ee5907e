package com.parcelsms.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailedNotificationsResponse(List<NotificationView> notifications) {
  public FailedNotificationsResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
