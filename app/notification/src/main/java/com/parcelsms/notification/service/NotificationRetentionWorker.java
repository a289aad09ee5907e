/*
 * Where: Notification retention worker
 * What: Runs the retention cleanup on a fixed delay when enabled
 * Why: Old terminal records disappear without an operator running SQL
 */
package com.parcelsms.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.retention.enabled", havingValue = "true")
public class NotificationRetentionWorker {

  private final NotificationRetentionService retentionService;

  @Scheduled(fixedDelayString = "${notification.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
