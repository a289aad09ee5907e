/*
 * Where: Notification application configuration binding
 * What: Holds the reminder lead time and the late-creation grace period
 * Why: Keep reminder timing tunable without touching the scheduling rule
 */
package com.parcelsms.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.schedule")
@Validated
public record NotificationScheduleProperties(
    @NotNull @DefaultValue("48h") Duration reminderLead,
    @NotNull @DefaultValue("5m") Duration gracePeriod) {

  @AssertTrue(message = "notification.schedule.reminder-lead must be positive")
  public boolean isReminderLeadPositive() {
    return reminderLead != null && !reminderLead.isZero() && !reminderLead.isNegative();
  }

  @AssertTrue(message = "notification.schedule.grace-period must not be negative")
  public boolean isGracePeriodNonNegative() {
    return gracePeriod != null && !gracePeriod.isNegative();
  }
}
