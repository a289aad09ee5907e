/*
 * Where: Notification service layer
 * What: Soft-deletes an appointment and compensates its notifications in one transaction
 * Why: A dispatcher claim and the cancellation serialize on the same rows, so exactly one of send or cancel wins
 */
package com.parcelsms.notification.service;

import com.parcelsms.common.time.WallClock;
import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.CancellationResult;
import com.parcelsms.notification.model.Household;
import com.parcelsms.notification.repository.AppointmentDirectory;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AppointmentCancellationService {

  private static final Logger logger =
      LoggerFactory.getLogger(AppointmentCancellationService.class);

  private final AppointmentDirectory appointmentDirectory;
  private final CancellationCompensator compensator;
  private final WallClock wallClock;

  @Transactional
  public CancellationResult cancelAppointment(UUID appointmentId, String cancelledBy) {
    final Appointment appointment =
        appointmentDirectory
            .findAppointment(appointmentId)
            .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
    if (appointment.cancelled()) {
      logger.info("appointment already cancelled appointmentId={}", appointmentId);
      return CancellationResult.nothing();
    }
    if (!appointmentDirectory.markCancelled(appointmentId, cancelledBy, wallClock.now())) {
      // a concurrent request won the soft-delete and ran the compensation
      logger.info("appointment cancelled concurrently appointmentId={}", appointmentId);
      return CancellationResult.nothing();
    }
    final Household household =
        appointmentDirectory.findHousehold(appointment.householdId()).orElse(null);
    final CancellationResult result = compensator.compensate(appointment, household);
    logger.info(
        "appointment cancelled appointmentId={} cancelledBy={} smsCancelled={} smsSent={}",
        appointmentId,
        cancelledBy,
        result.smsCancelled(),
        result.smsSent());
    return result;
  }
}
