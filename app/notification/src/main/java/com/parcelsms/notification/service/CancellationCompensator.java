/*
 * Where: Notification service layer
 * What: Reconciles notifications after an appointment is soft-deleted
 * Why: Unsent reminders are dropped silently; a household that already got a reminder is told about the cancellation exactly once
 */
package com.parcelsms.notification.service;

import com.parcelsms.common.time.WallClock;
import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.CancellationResult;
import com.parcelsms.notification.model.Household;
import com.parcelsms.notification.model.IneligibilityReason;
import com.parcelsms.notification.model.NotificationIntent;
import com.parcelsms.notification.model.RenderedMessage;
import com.parcelsms.notification.repository.NotificationRepository;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class CancellationCompensator {

  private static final Logger logger = LoggerFactory.getLogger(CancellationCompensator.class);
  private static final Set<NotificationIntent> RETRACTABLE_INTENTS =
      EnumSet.of(NotificationIntent.PICKUP_REMINDER, NotificationIntent.PICKUP_UPDATED);

  private final NotificationRepository notificationRepository;
  private final NotificationEnqueueService enqueueService;
  private final MessageRenderer messageRenderer;
  private final NotificationMetrics metrics;
  private final WallClock wallClock;

  /** Must join the transaction that soft-deletes the appointment. */
  @Transactional(propagation = Propagation.MANDATORY)
  public CancellationResult compensate(Appointment appointment, @Nullable Household household) {
    final Instant now = wallClock.now();
    // cancel first so the sent check below sees the final state of this appointment's history
    final int cancelled =
        notificationRepository.cancelAllNonTerminal(
            appointment.appointmentId(), IneligibilityReason.PARCEL_DELETED, now);
    metrics.recordCancelled(IneligibilityReason.PARCEL_DELETED, cancelled);
    final boolean reminderDelivered =
        notificationRepository.existsSentForAppointment(
            appointment.appointmentId(), RETRACTABLE_INTENTS);
    final boolean noticeCreated =
        reminderDelivered && enqueueCancellationNotice(appointment, household, now);
    logger.info(
        "appointment cancellation compensated appointmentId={} cancelledCount={} noticeCreated={}",
        appointment.appointmentId(),
        cancelled,
        noticeCreated);
    return new CancellationResult(cancelled > 0, noticeCreated);
  }

  private boolean enqueueCancellationNotice(
      Appointment appointment, @Nullable Household household, Instant now) {
    final Optional<RenderedMessage> message =
        household == null
            ? Optional.empty()
            : messageRenderer.render(NotificationIntent.PICKUP_CANCELLED, appointment, household);
    if (message.isEmpty()) {
      logger.warn(
          "cancellation notice skipped because household has no phone appointmentId={}",
          appointment.appointmentId());
      return false;
    }
    final EnqueueResult result =
        enqueueService.enqueue(
            EnqueueCommand.of(
                NotificationIntent.PICKUP_CANCELLED,
                appointment.appointmentId(),
                appointment.householdId(),
                message.get().recipient(),
                household.locale(),
                message.get().text(),
                now));
    return result.created();
  }
}
