/*
 * Where: Notification configuration validation tests
 * What: Verifies Bean Validation of the SMS provider settings
 * Why: Live mode without credentials must be rejected before the first send
 */
package com.parcelsms.notification.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmsProviderPropertiesValidationTest {

    private static final String API_URL = "https://api.hellosms.se/api/v1/sms/send";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(10);
    private static final String PUBLIC_BASE_URL = "https://pickup.example.se";

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void validationPassesInLiveModeWithCredentials() {
        SmsProviderProperties properties = properties("user", "secret", false, READ_TIMEOUT);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationPassesInTestModeWithoutCredentials() {
        SmsProviderProperties properties = properties(null, null, true, READ_TIMEOUT);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsInLiveModeWithoutPassword() {
        SmsProviderProperties properties = properties("user", " ", false, READ_TIMEOUT);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenReadTimeoutIsZero() {
        SmsProviderProperties properties = properties("user", "secret", false, Duration.ZERO);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void toStringOmitsPassword() {
        SmsProviderProperties properties = properties("user", "secret", false, READ_TIMEOUT);

        assertThat(properties.toString()).doesNotContain("secret");
    }

    private SmsProviderProperties properties(
            String username, String password, boolean testMode, Duration readTimeout) {
        return new SmsProviderProperties(
                API_URL, username, password, "Matcentral", testMode, CONNECT_TIMEOUT, readTimeout, PUBLIC_BASE_URL);
    }
}
