/*
 * Where: Notification service layer
 * What: Records dispatch outcomes, cancellations, due-to-sent delay and the due backlog
 * Why: Pipeline health must be observable without querying the table
 */
package com.parcelsms.notification.service;

import com.parcelsms.notification.model.IneligibilityReason;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class NotificationMetrics {

  static final String RESULT_SENT = "sent";
  static final String RESULT_FAILED_TRANSIENT = "failed_transient";
  static final String RESULT_FAILED_PERMANENT = "failed_permanent";
  static final String RESULT_CANCELLED = "cancelled";
  static final String RESULT_LOCK_LOST = "lock_lost";

  private static final String METRIC_DISPATCH_TOTAL = "notification.dispatch.total";
  private static final String METRIC_CANCELLED_TOTAL = "notification.cancelled.total";
  private static final String METRIC_DISPATCH_DELAY = "notification.dispatch.delay";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<IneligibilityReason, Counter> cancelledCounters =
      new ConcurrentHashMap<>();
  private final Timer dispatchDelayTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Queued notifications that are already due")
        .register(meterRegistry);
    this.dispatchDelayTimer =
        Timer.builder(METRIC_DISPATCH_DELAY)
            .description("Delay between a notification's due time and its successful send")
            .register(meterRegistry);
  }

  public void recordDispatchResult(String result) {
    dispatchCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Notification dispatch outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCancelled(IneligibilityReason reason, int count) {
    if (count <= 0) {
      return;
    }
    cancelledCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_CANCELLED_TOTAL)
                    .description("Notifications cancelled without sending")
                    .tags(Tags.of("reason", reason.code()))
                    .register(meterRegistry))
        .increment(count);
  }

  public void recordDispatchDelay(Instant dueAt, Instant sentAt) {
    if (dueAt == null || sentAt == null || sentAt.isBefore(dueAt)) {
      return;
    }
    dispatchDelayTimer.record(Duration.between(dueAt, sentAt));
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
