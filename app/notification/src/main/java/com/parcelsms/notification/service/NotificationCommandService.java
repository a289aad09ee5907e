/*
 * Where: Notification service layer
 * What: Admin-triggered enqueue operations, failure handling and history queries
 * Why: Operators schedule reminders, resends, update notices and enrolment messages by hand
 */
package com.parcelsms.notification.service;

import com.parcelsms.common.time.WallClock;
import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.Household;
import com.parcelsms.notification.model.NotificationIntent;
import com.parcelsms.notification.model.NotificationRecord;
import com.parcelsms.notification.model.NotificationStatus;
import com.parcelsms.notification.model.RenderedMessage;
import com.parcelsms.notification.repository.AppointmentDirectory;
import com.parcelsms.notification.repository.NotificationRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationCommandService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationCommandService.class);
  static final Duration RESEND_MIN_LEAD = Duration.ofHours(1);
  static final Duration RESEND_COOLDOWN = Duration.ofMinutes(5);
  private static final int MAX_FAILURES = 200;

  private final AppointmentDirectory appointmentDirectory;
  private final NotificationRepository notificationRepository;
  private final NotificationEnqueueService enqueueService;
  private final ReminderScheduler reminderScheduler;
  private final MessageRenderer messageRenderer;
  private final WallClock wallClock;

  public EnqueueResult enqueueReminder(UUID appointmentId) {
    final Instant now = wallClock.now();
    final Appointment appointment = requireActiveAppointment(appointmentId);
    final Household household = requireHousehold(appointment.householdId());
    final RenderedMessage message =
        render(NotificationIntent.PICKUP_REMINDER, appointment, household);
    return enqueueService.enqueue(
        EnqueueCommand.of(
            NotificationIntent.PICKUP_REMINDER,
            appointmentId,
            household.householdId(),
            message.recipient(),
            household.locale(),
            message.text(),
            reminderScheduler.computeDueAt(appointment.pickupWindowStart(), now)));
  }

  /** Sends the reminder again right away under a fresh key derived from the operator's nonce. */
  public EnqueueResult enqueueResend(UUID appointmentId, String nonce) {
    if (nonce == null || nonce.isBlank()) {
      throw new InvalidNotificationRequestException("nonce is required");
    }
    final Instant now = wallClock.now();
    final Appointment appointment = requireActiveAppointment(appointmentId);
    checkResendWindow(appointment, null, now);
    final Household household = requireHousehold(appointment.householdId());
    final RenderedMessage message =
        render(NotificationIntent.PICKUP_REMINDER, appointment, household);
    final EnqueueResult result =
        enqueueService.enqueue(
            EnqueueCommand.of(
                    NotificationIntent.PICKUP_REMINDER,
                    appointmentId,
                    household.householdId(),
                    message.recipient(),
                    household.locale(),
                    message.text(),
                    now)
                .asResend(nonce));
    logger.info(
        "notification resend requested appointmentId={} created={}", appointmentId, result.created());
    return result;
  }

  /**
   * Queues a fresh copy of a failed pickup notification with the same intent, addressed to the
   * household's current number, and dismisses the failed original. A cancellation notice may be
   * retried although its appointment is cancelled.
   */
  @Transactional
  public EnqueueResult retryFailed(UUID notificationId, String nonce, String requestedBy) {
    if (nonce == null || nonce.isBlank()) {
      throw new InvalidNotificationRequestException("nonce is required");
    }
    final Instant now = wallClock.now();
    final NotificationRecord original =
        notificationRepository
            .findById(notificationId)
            .orElseThrow(() -> new NotificationNotFoundException(notificationId));
    if (original.status() != NotificationStatus.FAILED) {
      throw new InvalidNotificationRequestException("only failed notifications can be retried");
    }
    if (original.dismissed()) {
      throw new InvalidNotificationRequestException("notification has been dismissed");
    }
    final NotificationIntent intent = original.intent();
    if (!intent.appointmentBound()) {
      throw new InvalidNotificationRequestException(
          "intent " + intent.value() + " is not retryable");
    }
    final Appointment appointment = requireAppointment(original.appointmentId());
    if (intent != NotificationIntent.PICKUP_CANCELLED) {
      requireActive(appointment);
    }
    checkResendWindow(appointment, notificationId, now);
    final Household household = requireHousehold(appointment.householdId());
    final RenderedMessage message = render(intent, appointment, household);
    final EnqueueResult result =
        enqueueService.enqueue(
            EnqueueCommand.of(
                    intent,
                    appointment.appointmentId(),
                    household.householdId(),
                    message.recipient(),
                    household.locale(),
                    message.text(),
                    now)
                .asResend(nonce));
    notificationRepository.updateDismissal(notificationId, now, requestedBy);
    logger.info(
        "failed notification retried notificationId={} retryId={} intent={} requestedBy={}",
        notificationId,
        result.record().notificationId(),
        intent.value(),
        requestedBy);
    return result;
  }

  /** Dismisses a failed notification, or restores it to the failure list. */
  public NotificationRecord setDismissed(
      UUID notificationId, boolean dismissed, String dismissedBy) {
    if (dismissed && (dismissedBy == null || dismissedBy.isBlank())) {
      throw new InvalidNotificationRequestException("dismissed_by is required");
    }
    final NotificationRecord updated =
        notificationRepository
            .updateDismissal(
                notificationId, dismissed ? wallClock.now() : null, dismissed ? dismissedBy : null)
            .orElseThrow(() -> notDismissable(notificationId));
    logger.info(
        "notification dismissal changed notificationId={} dismissed={} by={}",
        notificationId,
        dismissed,
        dismissedBy);
    return updated;
  }

  /** Notifies the household that the pickup time or place changed. */
  public EnqueueResult enqueueUpdate(UUID appointmentId) {
    final Appointment appointment = requireActiveAppointment(appointmentId);
    final Household household = requireHousehold(appointment.householdId());
    final RenderedMessage message =
        render(NotificationIntent.PICKUP_UPDATED, appointment, household);
    return enqueueService.enqueue(
        EnqueueCommand.of(
            NotificationIntent.PICKUP_UPDATED,
            appointmentId,
            household.householdId(),
            message.recipient(),
            household.locale(),
            message.text(),
            wallClock.now()));
  }

  public EnqueueResult enqueueEnrolment(UUID householdId, boolean consent) {
    final Household household = requireHousehold(householdId);
    if (household.anonymized()) {
      throw new InvalidNotificationRequestException("household is anonymized");
    }
    final NotificationIntent intent =
        consent ? NotificationIntent.CONSENT_ENROLMENT : NotificationIntent.ENROLMENT;
    final RenderedMessage message = render(intent, null, household);
    return enqueueService.enqueue(
        EnqueueCommand.of(
            intent,
            null,
            householdId,
            message.recipient(),
            household.locale(),
            message.text(),
            wallClock.now()));
  }

  public List<NotificationRecord> getNotificationHistory(UUID appointmentId) {
    if (appointmentDirectory.findAppointment(appointmentId).isEmpty()) {
      throw new AppointmentNotFoundException(appointmentId);
    }
    return notificationRepository.findByAppointmentId(appointmentId);
  }

  public List<NotificationRecord> getFailures(int limit) {
    return notificationRepository.findFailed(Math.max(1, Math.min(limit, MAX_FAILURES)));
  }

  private RuntimeException notDismissable(UUID notificationId) {
    if (notificationRepository.findById(notificationId).isEmpty()) {
      return new NotificationNotFoundException(notificationId);
    }
    return new InvalidNotificationRequestException("only failed notifications can be dismissed");
  }

  // lead time before pickup and a per-appointment cooldown; the retried record itself is ignored
  private void checkResendWindow(Appointment appointment, UUID retriedId, Instant now) {
    if (!appointment.pickupWindowStart().isAfter(now.plus(RESEND_MIN_LEAD))) {
      throw new InvalidNotificationRequestException(
          "resend requires the pickup to start more than "
              + RESEND_MIN_LEAD.toMinutes()
              + " minutes from now");
    }
    final boolean recentlyQueued =
        notificationRepository.findByAppointmentId(appointment.appointmentId()).stream()
            .filter(record -> !record.notificationId().equals(retriedId))
            .anyMatch(record -> record.createdAt().isAfter(now.minus(RESEND_COOLDOWN)));
    if (recentlyQueued) {
      throw new InvalidNotificationRequestException(
          "a notification for this appointment was queued less than "
              + RESEND_COOLDOWN.toMinutes()
              + " minutes ago");
    }
  }

  private Appointment requireActiveAppointment(UUID appointmentId) {
    return requireActive(requireAppointment(appointmentId));
  }

  private Appointment requireAppointment(UUID appointmentId) {
    return appointmentDirectory
        .findAppointment(appointmentId)
        .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
  }

  private Appointment requireActive(Appointment appointment) {
    if (appointment.cancelled()) {
      throw new InvalidNotificationRequestException("appointment is cancelled");
    }
    if (appointment.fulfilled()) {
      throw new InvalidNotificationRequestException("appointment is already picked up");
    }
    return appointment;
  }

  private Household requireHousehold(UUID householdId) {
    return appointmentDirectory
        .findHousehold(householdId)
        .orElseThrow(() -> new HouseholdNotFoundException(householdId));
  }

  private RenderedMessage render(
      NotificationIntent intent, Appointment appointment, Household household) {
    return messageRenderer
        .render(intent, appointment, household)
        .orElseThrow(
            () -> new InvalidNotificationRequestException("household has no phone number"));
  }
}
