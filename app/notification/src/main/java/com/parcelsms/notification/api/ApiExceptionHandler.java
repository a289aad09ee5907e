/*
 * Where: Notification admin API
 * What: Maps domain exceptions to {code, message} error responses
 * Why: Callers get stable codes and never see provider error bodies or stack traces
 */
package com.parcelsms.notification.api;

import com.parcelsms.notification.service.AppointmentNotFoundException;
import com.parcelsms.notification.service.HouseholdNotFoundException;
import com.parcelsms.notification.service.InvalidNotificationRequestException;
import com.parcelsms.notification.service.MissingAppointmentIdException;
import com.parcelsms.notification.service.NotificationNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({
    InvalidNotificationRequestException.class,
    MissingAppointmentIdException.class
  })
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("NOTIFICATION_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("NOTIFICATION_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(AppointmentNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleAppointmentNotFound(
      AppointmentNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("APPOINTMENT_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(HouseholdNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleHouseholdNotFound(HouseholdNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("HOUSEHOLD_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(NotificationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotificationNotFound(
      NotificationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("NOTIFICATION_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("admin request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("NOTIFICATION_INTERNAL_ERROR", "internal error"));
  }
}
