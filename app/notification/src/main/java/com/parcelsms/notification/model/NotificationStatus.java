/*
 * Where: Notification domain model
 * What: Lifecycle states of a notification record
 * Why: Keep DB values and dispatcher transitions in one place
 */
package com.parcelsms.notification.model;

public enum NotificationStatus {
  QUEUED,
  SENDING,
  SENT,
  FAILED,
  CANCELLED;

  public boolean terminal() {
    return this == SENT || this == FAILED || this == CANCELLED;
  }
}
