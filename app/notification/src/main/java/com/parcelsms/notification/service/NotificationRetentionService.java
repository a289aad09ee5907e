/*
 * Where: Notification service layer
 * What: Applies the retention policy to notification records
 * Why: Prevent unbounded growth while keeping anomalous queued or sending records for inspection
 */
package com.parcelsms.notification.service;

import com.parcelsms.common.time.WallClock;
import com.parcelsms.notification.config.NotificationRetentionProperties;
import com.parcelsms.notification.repository.NotificationRepository;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationRetentionProperties properties;
  private final WallClock wallClock;

  public void cleanup() {
    final Instant now = wallClock.now();
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveCount = notificationRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      // SENDING rows are never reclaimed automatically; an operator decides whether they went out
      logger.error(
          "notification retention found stale active records count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deleted = notificationRepository.deleteTerminalOlderThan(threshold, now);
    logger.info(
        "notification retention cleanup deleted notifications={} threshold={}", deleted, threshold);
  }
}
