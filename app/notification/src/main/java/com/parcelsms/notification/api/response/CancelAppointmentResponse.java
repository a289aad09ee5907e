package com.parcelsms.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CancelAppointmentResponse(
    UUID appointmentId, boolean smsCancelled, boolean smsSent) {}
