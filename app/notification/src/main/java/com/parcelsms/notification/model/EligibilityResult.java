/*
 * Where: Notification domain model
 * What: Outcome of the send-time eligibility check
 */
package com.parcelsms.notification.model;

public record EligibilityResult(boolean eligible, IneligibilityReason reason) {

  private static final EligibilityResult ELIGIBLE = new EligibilityResult(true, null);

  public static EligibilityResult eligibleResult() {
    return ELIGIBLE;
  }

  public static EligibilityResult ineligible(IneligibilityReason reason) {
    return new EligibilityResult(false, reason);
  }
}
