package com.parcelsms.notification.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.parcelsms.notification.model.CancellationResult;
import com.parcelsms.notification.model.FailureKind;
import com.parcelsms.notification.model.NotificationIntent;
import com.parcelsms.notification.model.NotificationRecord;
import com.parcelsms.notification.model.NotificationStatus;
import com.parcelsms.notification.service.AppointmentCancellationService;
import com.parcelsms.notification.service.AppointmentNotFoundException;
import com.parcelsms.notification.service.EnqueueResult;
import com.parcelsms.notification.service.InvalidNotificationRequestException;
import com.parcelsms.notification.service.NotificationCommandService;
import com.parcelsms.notification.service.NotificationNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminNotificationController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AdminNotificationControllerTest {

  private static final UUID APPOINTMENT_ID = UUID.fromString("6f1c2a8e-0a4e-4d0c-9d61-2b1f7f1f0a01");
  private static final UUID HOUSEHOLD_ID = UUID.fromString("0b7e5d3c-7c55-4f0b-a3f2-5e6b8c9d0e11");
  private static final Instant DUE_AT = Instant.parse("2025-10-13T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationCommandService commandService;
  @MockitoBean private AppointmentCancellationService cancellationService;

  @Test
  void enqueueReminderReturns201WhenCreated() throws Exception {
    when(commandService.enqueueReminder(APPOINTMENT_ID))
        .thenReturn(new EnqueueResult(record(NotificationIntent.PICKUP_REMINDER), true));

    mockMvc
        .perform(post("/api/admin/appointments/{id}/notifications/reminder", APPOINTMENT_ID))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.intent").value("pickup_reminder"))
        .andExpect(jsonPath("$.status").value("queued"))
        .andExpect(jsonPath("$.created").value(true))
        .andExpect(jsonPath("$.due_at").value("2025-10-13T10:00:00Z"))
        .andExpect(header().exists("X-Request-Id"));
  }

  @Test
  void enqueueReminderReturns200WhenDeduplicated() throws Exception {
    when(commandService.enqueueReminder(APPOINTMENT_ID))
        .thenReturn(new EnqueueResult(record(NotificationIntent.PICKUP_REMINDER), false));

    mockMvc
        .perform(post("/api/admin/appointments/{id}/notifications/reminder", APPOINTMENT_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.created").value(false));
  }

  @Test
  void resendPassesNonce() throws Exception {
    when(commandService.enqueueResend(APPOINTMENT_ID, "op-1"))
        .thenReturn(new EnqueueResult(record(NotificationIntent.PICKUP_REMINDER), true));

    mockMvc
        .perform(
            post("/api/admin/appointments/{id}/notifications/resend", APPOINTMENT_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"nonce":"op-1"}
                    """))
        .andExpect(status().isCreated());
  }

  @Test
  void resendWithoutNonceReturns400() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/appointments/{id}/notifications/resend", APPOINTMENT_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));

    verify(commandService, never()).enqueueResend(any(), anyString());
  }

  @Test
  void enrolmentRequiresConsentFlag() throws Exception {
    when(commandService.enqueueEnrolment(HOUSEHOLD_ID, true))
        .thenReturn(new EnqueueResult(record(NotificationIntent.CONSENT_ENROLMENT), true));

    mockMvc
        .perform(
            post("/api/admin/households/{id}/notifications/enrolment", HOUSEHOLD_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"consent":true}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.intent").value("consent_enrolment"));
  }

  @Test
  void cancelledAppointmentReturns400WithReason() throws Exception {
    when(commandService.enqueueUpdate(APPOINTMENT_ID))
        .thenThrow(new InvalidNotificationRequestException("appointment is cancelled"));

    mockMvc
        .perform(post("/api/admin/appointments/{id}/notifications/update", APPOINTMENT_ID))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("appointment is cancelled"));
  }

  @Test
  void historyMasksRecipient() throws Exception {
    final NotificationRecord failed =
        new NotificationRecord(
            UUID.randomUUID(),
            NotificationIntent.PICKUP_REMINDER,
            APPOINTMENT_ID,
            HOUSEHOLD_ID,
            "+46701234567",
            "Matpaket ons 15 okt. 12:00",
            "sv",
            NotificationStatus.FAILED,
            "pickup_reminder|" + APPOINTMENT_ID,
            null,
            null,
            null,
            FailureKind.PERMANENT,
            "HTTP 400",
            null,
            DUE_AT.minusSeconds(3600),
            DUE_AT,
            null,
            DUE_AT,
            null,
            null);
    when(commandService.getNotificationHistory(APPOINTMENT_ID)).thenReturn(List.of(failed));

    mockMvc
        .perform(get("/api/admin/appointments/{id}/notifications", APPOINTMENT_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.appointment_id").value(APPOINTMENT_ID.toString()))
        .andExpect(jsonPath("$.notifications[0].status").value("failed"))
        .andExpect(jsonPath("$.notifications[0].failure_kind").value("permanent"))
        .andExpect(jsonPath("$.notifications[0].recipient").value("********4567"));
  }

  @Test
  void historyOfUnknownAppointmentReturns404() throws Exception {
    when(commandService.getNotificationHistory(APPOINTMENT_ID))
        .thenThrow(new AppointmentNotFoundException(APPOINTMENT_ID));

    mockMvc
        .perform(get("/api/admin/appointments/{id}/notifications", APPOINTMENT_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("APPOINTMENT_NOT_FOUND"));
  }

  @Test
  void malformedAppointmentIdReturns400() throws Exception {
    mockMvc
        .perform(get("/api/admin/appointments/not-a-uuid/notifications"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));
  }

  @Test
  void cancelAppointmentReportsSmsOutcome() throws Exception {
    when(cancellationService.cancelAppointment(APPOINTMENT_ID, "admin-1"))
        .thenReturn(new CancellationResult(false, true));

    mockMvc
        .perform(
            delete("/api/admin/appointments/{id}", APPOINTMENT_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"cancelled_by":"admin-1"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sms_cancelled").value(false))
        .andExpect(jsonPath("$.sms_sent").value(true));
  }

  @Test
  void failuresUsesDefaultLimit() throws Exception {
    when(commandService.getFailures(50)).thenReturn(List.of());

    mockMvc
        .perform(get("/api/admin/notifications/failures"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.notifications").isEmpty());
  }

  @Test
  void retryOfFailedNotificationReturns201() throws Exception {
    final UUID failedId = UUID.randomUUID();
    when(commandService.retryFailed(failedId, "op-9", "admin-1"))
        .thenReturn(new EnqueueResult(record(NotificationIntent.PICKUP_CANCELLED), true));

    mockMvc
        .perform(
            post("/api/admin/notifications/{id}/retry", failedId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"nonce":"op-9","requested_by":"admin-1"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.intent").value("pickup_cancelled"))
        .andExpect(jsonPath("$.created").value(true));
  }

  @Test
  void retryWithoutRequesterReturns400() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/notifications/{id}/retry", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"nonce":"op-9"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));

    verify(commandService, never()).retryFailed(any(), anyString(), anyString());
  }

  @Test
  void retryOfUnknownNotificationReturns404() throws Exception {
    final UUID failedId = UUID.randomUUID();
    when(commandService.retryFailed(failedId, "op-9", "admin-1"))
        .thenThrow(new NotificationNotFoundException(failedId));

    mockMvc
        .perform(
            post("/api/admin/notifications/{id}/retry", failedId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"nonce":"op-9","requested_by":"admin-1"}
                    """))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_NOT_FOUND"));
  }

  @Test
  void dismissReturnsUpdatedNotification() throws Exception {
    final Instant dismissedAt = Instant.parse("2025-10-13T11:00:00Z");
    final NotificationRecord queued = record(NotificationIntent.PICKUP_REMINDER);
    final NotificationRecord dismissed =
        new NotificationRecord(
            queued.notificationId(),
            queued.intent(),
            queued.appointmentId(),
            queued.householdId(),
            queued.recipient(),
            queued.renderedText(),
            queued.locale(),
            NotificationStatus.FAILED,
            queued.idempotencyKey(),
            null,
            null,
            null,
            FailureKind.TRANSIENT,
            "HTTP 503",
            null,
            queued.createdAt(),
            queued.dueAt(),
            null,
            DUE_AT,
            dismissedAt,
            "admin-1");
    when(commandService.setDismissed(queued.notificationId(), true, "admin-1"))
        .thenReturn(dismissed);

    mockMvc
        .perform(
            patch("/api/admin/notifications/{id}/dismiss", queued.notificationId())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"dismissed":true,"dismissed_by":"admin-1"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("failed"))
        .andExpect(jsonPath("$.dismissed_at").value("2025-10-13T11:00:00Z"))
        .andExpect(jsonPath("$.dismissed_by").value("admin-1"));
  }

  @Test
  void dismissWithoutFlagReturns400() throws Exception {
    mockMvc
        .perform(
            patch("/api/admin/notifications/{id}/dismiss", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());

    verify(commandService, never()).setDismissed(any(), anyBoolean(), any());
  }

  @Test
  void unexpectedErrorReturns500WithoutDetails() throws Exception {
    when(commandService.getFailures(10)).thenThrow(new IllegalStateException("db password=x"));

    mockMvc
        .perform(get("/api/admin/notifications/failures").param("limit", "10"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }

  private NotificationRecord record(NotificationIntent intent) {
    return NotificationRecord.queued(
        UUID.randomUUID(),
        intent,
        intent.appointmentBound() ? APPOINTMENT_ID : null,
        HOUSEHOLD_ID,
        "+46701234567",
        "text",
        "sv",
        "key",
        DUE_AT.minusSeconds(3600),
        DUE_AT);
  }
}
