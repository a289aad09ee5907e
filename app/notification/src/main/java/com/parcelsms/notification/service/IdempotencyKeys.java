/*
 * Where: Notification service layer
 * What: Derives idempotency keys from stable identifiers
 * Why: The same logical event must always map to the same key so the unique index can reject duplicates
 */
package com.parcelsms.notification.service;

import com.parcelsms.notification.model.NotificationIntent;
import java.util.UUID;

public final class IdempotencyKeys {

  private static final String SEPARATOR = "|";
  private static final String RESEND_MARKER = "resend";

  private IdempotencyKeys() {}

  /**
   * Natural key of a notification. Appointment-bound intents are keyed by appointment only and
   * enrolment intents by household and recipient, so text and timestamps never influence the
   * result.
   */
  public static String naturalKey(
      NotificationIntent intent, UUID appointmentId, UUID householdId, String recipient) {
    if (intent.appointmentBound()) {
      if (appointmentId == null) {
        throw new MissingAppointmentIdException(intent);
      }
      return intent.value() + SEPARATOR + appointmentId;
    }
    if (householdId == null || recipient == null || recipient.isBlank()) {
      throw new IllegalArgumentException("enrolment key requires householdId and recipient");
    }
    return intent.value() + SEPARATOR + householdId + SEPARATOR + recipient;
  }

  public static String resendKey(String naturalKey, String nonce) {
    if (nonce == null || nonce.isBlank()) {
      throw new IllegalArgumentException("resend nonce is required");
    }
    return naturalKey + SEPARATOR + RESEND_MARKER + SEPARATOR + nonce.trim();
  }
}
