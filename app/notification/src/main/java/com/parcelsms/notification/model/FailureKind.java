/*
 * Where: Notification domain model
 * What: Classifies a failed transport call
 * Why: Operators see whether a manual resend is likely to succeed
 */
package com.parcelsms.notification.model;

public enum FailureKind {
  TRANSIENT,
  PERMANENT
}
