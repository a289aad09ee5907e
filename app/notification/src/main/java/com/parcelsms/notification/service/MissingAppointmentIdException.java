package com.parcelsms.notification.service;

import com.parcelsms.notification.model.NotificationIntent;

public class MissingAppointmentIdException extends RuntimeException {

  private final NotificationIntent intent;

  public MissingAppointmentIdException(NotificationIntent intent) {
    super("appointmentId is required for intent=" + intent.value());
    this.intent = intent;
  }

  public NotificationIntent intent() {
    return intent;
  }
}
