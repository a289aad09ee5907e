package com.parcelsms.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** {@code nonce} makes the resend key unique; replaying the same nonce is a no-op. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResendNotificationRequest(@NotBlank @Size(max = 64) String nonce) {}
