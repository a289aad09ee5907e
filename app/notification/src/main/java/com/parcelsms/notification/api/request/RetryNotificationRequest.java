package com.parcelsms.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** {@code requested_by} is recorded as the dismisser of the failed original. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RetryNotificationRequest(
    @NotBlank @Size(max = 64) String nonce, @NotBlank @Size(max = 128) String requestedBy) {}
