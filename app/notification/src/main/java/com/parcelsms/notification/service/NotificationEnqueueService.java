/*
 * Where: Notification service layer
 * What: Idempotent creation of notification records
 * Why: A repeated trigger for the same logical event must never produce a second SMS
 */
package com.parcelsms.notification.service;

import com.parcelsms.common.time.WallClock;
import com.parcelsms.notification.model.NotificationRecord;
import com.parcelsms.notification.repository.NotificationRepository;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationEnqueueService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEnqueueService.class);

  private final NotificationRepository notificationRepository;
  private final WallClock wallClock;

  public EnqueueResult enqueue(EnqueueCommand command) {
    // key derivation rejects appointment-bound intents without appointment id before any write
    final String naturalKey =
        IdempotencyKeys.naturalKey(
            command.intent(), command.appointmentId(), command.householdId(), command.recipient());
    final String key =
        command.resendNonce() == null
            ? naturalKey
            : IdempotencyKeys.resendKey(naturalKey, command.resendNonce());
    final Instant now = wallClock.now();
    final NotificationRecord candidate =
        NotificationRecord.queued(
            UUID.randomUUID(),
            command.intent(),
            command.appointmentId(),
            command.householdId(),
            command.recipient(),
            command.renderedText(),
            command.locale(),
            key,
            now,
            command.dueAt() == null ? now : command.dueAt());
    final Optional<NotificationRecord> inserted = notificationRepository.insertIfAbsent(candidate);
    if (inserted.isPresent()) {
      logger.info(
          "notification enqueued id={} intent={} key={} dueAt={}",
          inserted.get().notificationId(),
          command.intent().value(),
          key,
          inserted.get().dueAt());
      return new EnqueueResult(inserted.get(), true);
    }
    final NotificationRecord existing =
        notificationRepository
            .findByIdempotencyKey(key)
            .orElseThrow(
                () -> new IllegalStateException("idempotency conflict without a row key=" + key));
    logger.info(
        "notification enqueue deduplicated key={} existingId={} status={}",
        key,
        existing.notificationId(),
        existing.status());
    return new EnqueueResult(existing, false);
  }
}
