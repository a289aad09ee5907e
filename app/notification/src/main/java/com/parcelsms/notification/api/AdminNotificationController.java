/*
 * Where: Notification admin API
 * What: Manual triggers, notification history and appointment cancellation endpoints
 * Why: The admin UI drives the pipeline only through these operations
 */
package com.parcelsms.notification.api;

import com.parcelsms.notification.api.request.CancelAppointmentRequest;
import com.parcelsms.notification.api.request.DismissNotificationRequest;
import com.parcelsms.notification.api.request.EnrolmentNotificationRequest;
import com.parcelsms.notification.api.request.ResendNotificationRequest;
import com.parcelsms.notification.api.request.RetryNotificationRequest;
import com.parcelsms.notification.api.response.CancelAppointmentResponse;
import com.parcelsms.notification.api.response.EnqueueNotificationResponse;
import com.parcelsms.notification.api.response.FailedNotificationsResponse;
import com.parcelsms.notification.api.response.NotificationHistoryResponse;
import com.parcelsms.notification.api.response.NotificationView;
import com.parcelsms.notification.model.CancellationResult;
import com.parcelsms.notification.service.AppointmentCancellationService;
import com.parcelsms.notification.service.EnqueueResult;
import com.parcelsms.notification.service.NotificationCommandService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminNotificationController {

  private final NotificationCommandService commandService;
  private final AppointmentCancellationService cancellationService;

  @GetMapping("/appointments/{appointmentId}/notifications")
  public ResponseEntity<NotificationHistoryResponse> history(
      @PathVariable("appointmentId") UUID appointmentId) {
    return ResponseEntity.ok(
        new NotificationHistoryResponse(
            appointmentId,
            commandService.getNotificationHistory(appointmentId).stream()
                .map(NotificationView::from)
                .toList()));
  }

  @PostMapping("/appointments/{appointmentId}/notifications/reminder")
  public ResponseEntity<EnqueueNotificationResponse> enqueueReminder(
      @PathVariable("appointmentId") UUID appointmentId) {
    return toResponse(commandService.enqueueReminder(appointmentId));
  }

  @PostMapping("/appointments/{appointmentId}/notifications/resend")
  public ResponseEntity<EnqueueNotificationResponse> enqueueResend(
      @PathVariable("appointmentId") UUID appointmentId,
      @Valid @RequestBody ResendNotificationRequest request) {
    return toResponse(commandService.enqueueResend(appointmentId, request.nonce()));
  }

  @PostMapping("/appointments/{appointmentId}/notifications/update")
  public ResponseEntity<EnqueueNotificationResponse> enqueueUpdate(
      @PathVariable("appointmentId") UUID appointmentId) {
    return toResponse(commandService.enqueueUpdate(appointmentId));
  }

  @PostMapping("/households/{householdId}/notifications/enrolment")
  public ResponseEntity<EnqueueNotificationResponse> enqueueEnrolment(
      @PathVariable("householdId") UUID householdId,
      @Valid @RequestBody EnrolmentNotificationRequest request) {
    return toResponse(commandService.enqueueEnrolment(householdId, request.consent()));
  }

  @DeleteMapping("/appointments/{appointmentId}")
  public ResponseEntity<CancelAppointmentResponse> cancelAppointment(
      @PathVariable("appointmentId") UUID appointmentId,
      @Valid @RequestBody CancelAppointmentRequest request) {
    final CancellationResult result =
        cancellationService.cancelAppointment(appointmentId, request.cancelledBy());
    return ResponseEntity.ok(
        new CancelAppointmentResponse(appointmentId, result.smsCancelled(), result.smsSent()));
  }

  @GetMapping("/notifications/failures")
  public ResponseEntity<FailedNotificationsResponse> failures(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    return ResponseEntity.ok(
        new FailedNotificationsResponse(
            commandService.getFailures(limit).stream().map(NotificationView::from).toList()));
  }

  @PostMapping("/notifications/{notificationId}/retry")
  public ResponseEntity<EnqueueNotificationResponse> retryFailed(
      @PathVariable("notificationId") UUID notificationId,
      @Valid @RequestBody RetryNotificationRequest request) {
    return toResponse(
        commandService.retryFailed(notificationId, request.nonce(), request.requestedBy()));
  }

  @PatchMapping("/notifications/{notificationId}/dismiss")
  public ResponseEntity<NotificationView> dismiss(
      @PathVariable("notificationId") UUID notificationId,
      @Valid @RequestBody DismissNotificationRequest request) {
    return ResponseEntity.ok(
        NotificationView.from(
            commandService.setDismissed(
                notificationId, request.dismissed(), request.dismissedBy())));
  }

  private ResponseEntity<EnqueueNotificationResponse> toResponse(EnqueueResult result) {
    return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
        .body(EnqueueNotificationResponse.from(result));
  }
}
