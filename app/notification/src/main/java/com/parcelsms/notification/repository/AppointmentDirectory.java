/*
 * Where: Notification data access
 * What: Read access to appointments and households plus the soft-delete write
 * Why: The pipeline reads live parcel state but does not own the appointment tables
 */
package com.parcelsms.notification.repository;

import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.Household;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface AppointmentDirectory {

  Optional<Appointment> findAppointment(UUID appointmentId);

  Optional<Household> findHousehold(UUID householdId);

  /**
   * Soft-deletes the appointment.
   *
   * @return {@code true} when this call performed the cancellation, {@code false} when the
   *     appointment was already cancelled or does not exist
   */
  boolean markCancelled(UUID appointmentId, String cancelledBy, Instant cancelledAt);
}
