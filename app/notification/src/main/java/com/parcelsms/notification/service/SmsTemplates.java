/*
 * Where: Notification service layer
 * What: Localized SMS texts per intent
 * Why: Messages must stay short enough for a single SMS segment
 */
package com.parcelsms.notification.service;

import com.parcelsms.notification.model.NotificationIntent;
import java.util.Locale;

final class SmsTemplates {

  static final String SWEDISH = "sv";
  static final Locale SWEDISH_LOCALE = Locale.forLanguageTag("sv-SE");

  private SmsTemplates() {}

  static Locale formattingLocale(String locale) {
    return isSwedish(locale) ? SWEDISH_LOCALE : Locale.UK;
  }

  static String pickupText(
      NotificationIntent intent, String locale, String date, String time, String publicUrl) {
    final boolean swedish = isSwedish(locale);
    return switch (intent) {
      case PICKUP_REMINDER ->
          swedish
              ? "Matpaket %s %s: %s".formatted(date, time, publicUrl)
              : "Food pickup %s %s: %s".formatted(date, time, publicUrl);
      case PICKUP_UPDATED ->
          swedish
              ? "Uppdatering! Matpaket %s %s: %s".formatted(date, time, publicUrl)
              : "Update! Food pickup %s %s: %s".formatted(date, time, publicUrl);
      case PICKUP_CANCELLED ->
          swedish
              ? "Matpaket %s %s är inställt.".formatted(date, time)
              : "Food pickup %s %s is cancelled.".formatted(date, time);
      default -> throw new IllegalArgumentException("not a pickup intent=" + intent.value());
    };
  }

  static String enrolmentText(NotificationIntent intent, String locale) {
    final boolean swedish = isSwedish(locale);
    return switch (intent) {
      case ENROLMENT ->
          swedish
              ? "Välkommen! Vi skickar ett SMS inför varje matpaket."
              : "Welcome! We will text you before each food pickup.";
      case CONSENT_ENROLMENT ->
          swedish
              ? "Tack för ditt samtycke. Du får nu SMS om dina matpaket."
              : "Thank you for your consent. You will now receive SMS about your food pickups.";
      default -> throw new IllegalArgumentException("not an enrolment intent=" + intent.value());
    };
  }

  private static boolean isSwedish(String locale) {
    return locale == null || locale.isBlank() || SWEDISH.equalsIgnoreCase(locale.trim());
  }
}
