package com.parcelsms.notification.service;

import com.parcelsms.notification.model.NotificationIntent;
import java.time.Instant;
import java.util.UUID;

/**
 * Input of {@link NotificationEnqueueService#enqueue}. A non-null {@code resendNonce} mints a
 * resend key instead of the natural key.
 */
public record EnqueueCommand(
    NotificationIntent intent,
    UUID appointmentId,
    UUID householdId,
    String recipient,
    String locale,
    String renderedText,
    Instant dueAt,
    String resendNonce) {

  public static EnqueueCommand of(
      NotificationIntent intent,
      UUID appointmentId,
      UUID householdId,
      String recipient,
      String locale,
      String renderedText,
      Instant dueAt) {
    return new EnqueueCommand(
        intent, appointmentId, householdId, recipient, locale, renderedText, dueAt, null);
  }

  public EnqueueCommand asResend(String nonce) {
    return new EnqueueCommand(
        intent, appointmentId, householdId, recipient, locale, renderedText, dueAt, nonce);
  }
}
