/*
 * Where: Notification domain model
 * What: What the cancellation compensation did to the SMS pipeline
 * Why: Returned to the admin UI so staff know whether the household was notified
 */
package com.parcelsms.notification.model;

public record CancellationResult(boolean smsCancelled, boolean smsSent) {

  public static CancellationResult nothing() {
    return new CancellationResult(false, false);
  }
}
