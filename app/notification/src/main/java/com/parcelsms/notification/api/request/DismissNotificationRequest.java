package com.parcelsms.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DismissNotificationRequest(
    @NotNull Boolean dismissed, @Size(max = 128) String dismissedBy) {}
