/*
 * Where: Notification service layer
 * What: Normalizes Swedish-style phone numbers to E.164 and masks them for logs
 * Why: The provider only accepts E.164 and full numbers must not reach the logs
 */
package com.parcelsms.notification.service;

import java.util.regex.Pattern;

public final class PhoneNumbers {

  private static final String DEFAULT_COUNTRY_CODE = "46";
  private static final Pattern NON_DIGITS = Pattern.compile("\\D");
  private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");

  private PhoneNumbers() {}

  /**
   * Strips formatting and applies the Swedish country code: a leading trunk 0 becomes +46, a
   * leading 46 gets a plus, anything else is assumed to be a national number.
   */
  public static String normalizeToE164(String phone) {
    if (phone == null) {
      return null;
    }
    final String digits = NON_DIGITS.matcher(phone).replaceAll("");
    if (digits.startsWith("0")) {
      return "+" + DEFAULT_COUNTRY_CODE + digits.substring(1);
    }
    if (digits.startsWith(DEFAULT_COUNTRY_CODE)) {
      return "+" + digits;
    }
    return "+" + DEFAULT_COUNTRY_CODE + digits;
  }

  public static boolean isValidE164(String phone) {
    return phone != null && E164.matcher(phone).matches();
  }

  public static String mask(String phone) {
    if (phone == null || phone.length() <= 4) {
      return "****";
    }
    return "*".repeat(phone.length() - 4) + phone.substring(phone.length() - 4);
  }
}
