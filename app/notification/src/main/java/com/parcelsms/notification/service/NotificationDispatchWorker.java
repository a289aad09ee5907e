/*
 * Where: Notification dispatch worker
 * What: Triggers the dispatcher on a fixed delay
 * Why: Due notifications are picked up without an external trigger
 */
package com.parcelsms.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.dispatch.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDispatchWorker {

  private final NotificationDispatchService dispatchService;

  @Scheduled(fixedDelayString = "${notification.dispatch.poll-interval}")
  public void run() {
    dispatchService.processDueBatch();
  }
}
