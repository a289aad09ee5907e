/*
 * Where: Notification service layer
 * What: Renders recipient and text from the current appointment and household state
 * Why: Used at enqueue time and again right before sending, so a reschedule never ships a stale time
 */
package com.parcelsms.notification.service;

import com.parcelsms.common.time.CivilTime;
import com.parcelsms.common.time.WallClock;
import com.parcelsms.notification.config.SmsProviderProperties;
import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.Household;
import com.parcelsms.notification.model.NotificationIntent;
import com.parcelsms.notification.model.RenderedMessage;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MessageRenderer {

  private static final String DATE_PATTERN = "EEE d MMM";

  private final WallClock wallClock;
  private final SmsProviderProperties smsProperties;

  /**
   * Renders the message for the given intent.
   *
   * @return empty when the household has no phone number to send to
   */
  public Optional<RenderedMessage> render(
      NotificationIntent intent, @Nullable Appointment appointment, Household household) {
    if (household.phoneNumber() == null || household.phoneNumber().isBlank()) {
      return Optional.empty();
    }
    final String recipient = PhoneNumbers.normalizeToE164(household.phoneNumber());
    if (!intent.appointmentBound()) {
      return Optional.of(
          new RenderedMessage(recipient, SmsTemplates.enrolmentText(intent, household.locale())));
    }
    if (appointment == null) {
      throw new IllegalArgumentException("appointment is required for intent=" + intent.value());
    }
    final CivilTime pickup = wallClock.fromInstant(appointment.pickupWindowStart());
    final String date =
        pickup.format(
            DateTimeFormatter.ofPattern(
                DATE_PATTERN, SmsTemplates.formattingLocale(household.locale())));
    final String text =
        SmsTemplates.pickupText(
            intent, household.locale(), date, pickup.formatTime(), publicUrl(appointment));
    return Optional.of(new RenderedMessage(recipient, text));
  }

  private String publicUrl(Appointment appointment) {
    String base = smsProperties.publicBaseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + "/p/" + appointment.appointmentId();
  }
}
