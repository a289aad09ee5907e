package com.parcelsms.notification.service;

import java.util.UUID;

public class AppointmentNotFoundException extends RuntimeException {

  public AppointmentNotFoundException(UUID appointmentId) {
    super("appointment not found: " + appointmentId);
  }
}
