/*
 * Where: Notification configuration binding tests
 * What: Verifies Duration binding, defaults and start-up validation of the notification properties
 * Why: A mistyped lead time or interval must fail at start-up rather than shift every reminder
 */
package com.parcelsms.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class NotificationPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "notification.dispatch.enabled=true",
              "notification.dispatch.poll-interval=15s",
              "notification.dispatch.batch-size=20",
              "notification.dispatch.concurrency=3",
              "notification.dispatch.error-message-max-length=500",
              "notification.retention.enabled=true",
              "notification.retention.retention-days=90",
              "notification.retention.cleanup-interval=2h");

  @Test
  void contextStartsAndBindsDurationFields() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final NotificationDispatchProperties dispatch =
              context.getBean(NotificationDispatchProperties.class);
          final NotificationRetentionProperties retention =
              context.getBean(NotificationRetentionProperties.class);

          assertThat(dispatch.pollInterval()).isEqualTo(Duration.ofSeconds(15));
          assertThat(dispatch.batchSize()).isEqualTo(20);
          assertThat(dispatch.concurrency()).isEqualTo(3);
          assertThat(retention.retentionDays()).isEqualTo(90);
          assertThat(retention.cleanupInterval()).isEqualTo(Duration.ofHours(2));
        });
  }

  @Test
  void scheduleFallsBackToDefaults() {
    contextRunner.run(
        context -> {
          final NotificationScheduleProperties schedule =
              context.getBean(NotificationScheduleProperties.class);

          assertThat(schedule.reminderLead()).isEqualTo(Duration.ofHours(48));
          assertThat(schedule.gracePeriod()).isEqualTo(Duration.ofMinutes(5));
        });
  }

  @Test
  void zeroReminderLeadFailsStartup() {
    contextRunner
        .withPropertyValues("notification.schedule.reminder-lead=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void zeroBatchSizeFailsStartup() {
    contextRunner
        .withPropertyValues("notification.dispatch.batch-size=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    NotificationDispatchProperties.class,
    NotificationRetentionProperties.class,
    NotificationScheduleProperties.class
  })
  static class TestConfiguration {}
}
