package com.parcelsms.notification.service;

import com.parcelsms.notification.model.FailureKind;

public record SmsSendResult(
    boolean success,
    String messageId,
    String error,
    Integer httpStatus,
    FailureKind failureKind) {

  public static SmsSendResult sent(String messageId) {
    return new SmsSendResult(true, messageId, null, null, null);
  }

  public static SmsSendResult transientFailure(String error, Integer httpStatus) {
    return new SmsSendResult(false, null, error, httpStatus, FailureKind.TRANSIENT);
  }

  public static SmsSendResult permanentFailure(String error, Integer httpStatus) {
    return new SmsSendResult(false, null, error, httpStatus, FailureKind.PERMANENT);
  }
}
