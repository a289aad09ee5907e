/*
 * Where: Notification service layer
 * What: Claims due notifications, re-checks eligibility, re-renders and sends them
 * Why: One claim per record guarantees at most one send or cancel per idempotency key
 */
package com.parcelsms.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.parcelsms.common.time.WallClock;
import com.parcelsms.notification.config.NotificationDispatchProperties;
import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.EligibilityResult;
import com.parcelsms.notification.model.FailureKind;
import com.parcelsms.notification.model.Household;
import com.parcelsms.notification.model.NotificationRecord;
import com.parcelsms.notification.model.RenderedMessage;
import com.parcelsms.notification.repository.AppointmentDirectory;
import com.parcelsms.notification.repository.NotificationRepository;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatchService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final NotificationRepository notificationRepository;
  private final AppointmentDirectory appointmentDirectory;
  private final EligibilityEvaluator eligibilityEvaluator;
  private final MessageRenderer messageRenderer;
  private final SmsTransport smsTransport;
  private final NotificationMetrics metrics;
  private final NotificationDispatchProperties properties;
  private final WallClock wallClock;
  private final ExecutorService dispatchExecutor;
  // distinguishes service instances sharing a host, so lock owner guards stay per instance
  private final String instanceId = UUID.randomUUID().toString();

  /**
   * Processes one batch of due notifications.
   *
   * @return number of records claimed by this call
   */
  public int processDueBatch() {
    final Instant now = wallClock.now();
    final String lockedBy = resolveLockedBy();
    metrics.updateBacklogCurrent(notificationRepository.countDue(now));
    // claim is a single statement; the provider call never runs inside a transaction
    final List<NotificationRecord> claimed =
        notificationRepository.claimDue(properties.batchSize(), now, lockedBy);
    if (claimed.isEmpty()) {
      return 0;
    }
    logger.debug("notification batch claimed count={} lockedBy={}", claimed.size(), lockedBy);
    final CompletableFuture<?>[] futures =
        claimed.stream()
            .map(
                record ->
                    CompletableFuture.runAsync(
                        () -> dispatchIsolated(record, lockedBy), dispatchExecutor))
            .toArray(CompletableFuture[]::new);
    CompletableFuture.allOf(futures).join();
    return claimed.size();
  }

  @VisibleForTesting
  void dispatchIsolated(NotificationRecord record, String lockedBy) {
    try {
      dispatch(record, lockedBy);
    } catch (RuntimeException ex) {
      logger.error(
          "notification dispatch failed unexpectedly id={} intent={}",
          record.notificationId(),
          record.intent().value(),
          ex);
      try {
        finalizeFailed(record, FailureKind.PERMANENT, ex.getMessage(), lockedBy);
      } catch (RuntimeException finalizeEx) {
        // record stays SENDING and is reported by retention as stale
        logger.error(
            "notification failure could not be recorded id={}", record.notificationId(), finalizeEx);
      }
    }
  }

  private void dispatch(NotificationRecord record, String lockedBy) {
    final Instant now = wallClock.now();
    final Appointment appointment =
        record.appointmentId() == null
            ? null
            : appointmentDirectory.findAppointment(record.appointmentId()).orElse(null);
    if (record.intent().requiresEligibilityCheck()) {
      final EligibilityResult eligibility = eligibilityEvaluator.evaluate(appointment, now);
      if (!eligibility.eligible()) {
        cancel(record, eligibility, now, lockedBy);
        return;
      }
    }
    final Optional<RenderedMessage> payload = rerender(record, appointment, lockedBy);
    if (payload.isEmpty()) {
      return;
    }
    final SmsSendResult result =
        smsTransport.send(SmsSendRequest.of(payload.get().recipient(), payload.get().text()));
    if (!result.success()) {
      logger.warn(
          "notification send failed id={} intent={} to={} kind={} httpStatus={} error={}",
          record.notificationId(),
          record.intent().value(),
          PhoneNumbers.mask(payload.get().recipient()),
          result.failureKind(),
          result.httpStatus(),
          result.error());
      finalizeFailed(record, result.failureKind(), result.error(), lockedBy);
      return;
    }
    final Instant sentAt = wallClock.now();
    final int updated =
        notificationRepository.markSent(
            record.notificationId(), sentAt, result.messageId(), lockedBy);
    if (updated == 0) {
      logger.warn(
          "notification sent but lock was lost id={} key={}",
          record.notificationId(),
          record.idempotencyKey());
      metrics.recordDispatchResult(NotificationMetrics.RESULT_LOCK_LOST);
      return;
    }
    metrics.recordDispatchResult(NotificationMetrics.RESULT_SENT);
    metrics.recordDispatchDelay(record.dueAt(), sentAt);
    logger.info(
        "notification dispatched id={} intent={} to={} messageId={}",
        record.notificationId(),
        record.intent().value(),
        PhoneNumbers.mask(payload.get().recipient()),
        result.messageId());
  }

  private void cancel(
      NotificationRecord record, EligibilityResult eligibility, Instant now, String lockedBy) {
    final int updated =
        notificationRepository.markCancelled(
            record.notificationId(), eligibility.reason(), now, lockedBy);
    if (updated == 0) {
      logger.warn(
          "notification cancel skipped because lock was lost id={} reason={}",
          record.notificationId(),
          eligibility.reason().code());
      metrics.recordDispatchResult(NotificationMetrics.RESULT_LOCK_LOST);
      return;
    }
    metrics.recordDispatchResult(NotificationMetrics.RESULT_CANCELLED);
    metrics.recordCancelled(eligibility.reason(), 1);
    logger.info(
        "notification cancelled before send id={} intent={} reason={}",
        record.notificationId(),
        record.intent().value(),
        eligibility.reason().code());
  }

  /**
   * Returns what to send: freshly rendered values when they differ from the stored ones (after
   * persisting them), the stored values otherwise. Empty when the lock was lost on update.
   */
  @VisibleForTesting
  Optional<RenderedMessage> rerender(
      NotificationRecord record, Appointment appointment, String lockedBy) {
    final RenderedMessage stored = new RenderedMessage(record.recipient(), record.renderedText());
    if (record.intent().appointmentBound() && appointment == null) {
      return Optional.of(stored);
    }
    final Optional<Household> household = appointmentDirectory.findHousehold(record.householdId());
    if (household.isEmpty()) {
      return Optional.of(stored);
    }
    final Optional<RenderedMessage> fresh =
        messageRenderer.render(record.intent(), appointment, household.get());
    if (fresh.isEmpty() || !fresh.get().differsFrom(record)) {
      return Optional.of(stored);
    }
    final int updated =
        notificationRepository.updateRendered(
            record.notificationId(), fresh.get().recipient(), fresh.get().text(), lockedBy);
    if (updated == 0) {
      logger.warn("notification re-render skipped because lock was lost id={}", record.notificationId());
      metrics.recordDispatchResult(NotificationMetrics.RESULT_LOCK_LOST);
      return Optional.empty();
    }
    logger.info(
        "notification re-rendered before send id={} recipientChanged={}",
        record.notificationId(),
        !fresh.get().recipient().equals(record.recipient()));
    return fresh;
  }

  private void finalizeFailed(
      NotificationRecord record, FailureKind failureKind, String error, String lockedBy) {
    final int updated =
        notificationRepository.markFailed(
            record.notificationId(), failureKind, truncateError(error), wallClock.now(), lockedBy);
    if (updated == 0) {
      logger.warn(
          "notification failure not recorded because lock was lost id={}", record.notificationId());
      metrics.recordDispatchResult(NotificationMetrics.RESULT_LOCK_LOST);
      return;
    }
    metrics.recordDispatchResult(
        failureKind == FailureKind.TRANSIENT
            ? NotificationMetrics.RESULT_FAILED_TRANSIENT
            : NotificationMetrics.RESULT_FAILED_PERMANENT);
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  String resolveLockedBy() {
    return resolveHostname() + ":" + instanceId;
  }

  private String resolveHostname() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
