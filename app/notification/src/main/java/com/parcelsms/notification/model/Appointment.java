/*
 * Where: Notification domain model
 * What: Read model of a scheduled pickup owned by the scheduling subsystem
 */
package com.parcelsms.notification.model;

import java.time.Instant;
import java.util.UUID;

public record Appointment(
    UUID appointmentId,
    UUID householdId,
    UUID locationId,
    Instant pickupWindowStart,
    Instant pickupWindowEnd,
    boolean fulfilled,
    Instant cancelledAt,
    boolean householdAnonymized) {

  public boolean cancelled() {
    return cancelledAt != null;
  }
}
