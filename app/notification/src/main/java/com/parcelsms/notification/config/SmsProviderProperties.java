/*
 * Where: Notification application configuration binding
 * What: Holds the SMS provider endpoint, credentials, sender name and timeouts
 * Why: A live deployment without credentials must fail at start-up, not at the first send
 */
package com.parcelsms.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.sms")
@Validated
public record SmsProviderProperties(
    @NotBlank String apiUrl,
    String username,
    String password,
    String from,
    boolean testMode,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @NotBlank String publicBaseUrl) {

  @AssertTrue(message = "notification.sms.username and password are required unless test-mode is on")
  public boolean isCredentialsPresentForLiveMode() {
    if (testMode) {
      return true;
    }
    return !isBlank(username) && !isBlank(password);
  }

  @AssertTrue(message = "notification.sms timeouts must be positive")
  public boolean isTimeoutsPositive() {
    return isPositiveDuration(connectTimeout) && isPositiveDuration(readTimeout);
  }

  public boolean hasSender() {
    return !isBlank(from);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null is reported by @NotNull
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @Override
  public String toString() {
    return "SmsProviderProperties[apiUrl=%s, username=%s, from=%s, testMode=%s]"
        .formatted(apiUrl, username, from, testMode);
  }
}
