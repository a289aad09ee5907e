/*
 * Where: Notification service layer
 * What: Computes when a pickup reminder becomes due
 * Why: Households get the reminder a fixed lead time before pickup, or shortly after booking when it is too late for that
 */
package com.parcelsms.notification.service;

import com.parcelsms.notification.config.NotificationScheduleProperties;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReminderScheduler {

  private final NotificationScheduleProperties properties;

  /**
   * Returns {@code pickupWindowStart - lead} when the pickup is strictly more than the lead time
   * away, otherwise {@code now + grace}. The grace period lets the enqueueing transaction commit
   * before a dispatcher can claim the record.
   */
  public Instant computeDueAt(Instant pickupWindowStart, Instant now) {
    final Duration lead = properties.reminderLead();
    if (Duration.between(now, pickupWindowStart).compareTo(lead) > 0) {
      return pickupWindowStart.minus(lead);
    }
    return now.plus(properties.gracePeriod());
  }
}
