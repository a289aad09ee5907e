/*
 * Where: Notification domain model
 * What: The fixed set of reasons a household receives an SMS
 * Why: Idempotency keys, eligibility gating and templates all branch on the intent
 */
package com.parcelsms.notification.model;

import java.util.Arrays;

public enum NotificationIntent {
  PICKUP_REMINDER("pickup_reminder", true),
  PICKUP_UPDATED("pickup_updated", true),
  PICKUP_CANCELLED("pickup_cancelled", true),
  ENROLMENT("enrolment", false),
  CONSENT_ENROLMENT("consent_enrolment", false);

  private final String value;
  private final boolean appointmentBound;

  NotificationIntent(String value, boolean appointmentBound) {
    this.value = value;
    this.appointmentBound = appointmentBound;
  }

  public String value() {
    return value;
  }

  public boolean appointmentBound() {
    return appointmentBound;
  }

  /** Reminder and update notices are re-checked against the live appointment before sending. */
  public boolean requiresEligibilityCheck() {
    return this == PICKUP_REMINDER || this == PICKUP_UPDATED;
  }

  public static NotificationIntent fromValue(String value) {
    return Arrays.stream(values())
        .filter(intent -> intent.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown notification intent=" + value));
  }
}
