/*
 * Where: Notification service layer
 * What: Decides at dispatch time whether a due notification should still be sent
 * Why: The appointment may have changed between enqueue and dispatch
 */
package com.parcelsms.notification.service;

import com.parcelsms.notification.model.Appointment;
import com.parcelsms.notification.model.EligibilityResult;
import com.parcelsms.notification.model.IneligibilityReason;
import java.time.Instant;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
public class EligibilityEvaluator {

  /**
   * Evaluates in a fixed priority order, first match wins: not found, deleted, picked up,
   * anonymized, window passed.
   */
  public EligibilityResult evaluate(@Nullable Appointment appointment, Instant now) {
    if (appointment == null) {
      return EligibilityResult.ineligible(IneligibilityReason.PARCEL_NOT_FOUND);
    }
    if (appointment.cancelled()) {
      return EligibilityResult.ineligible(IneligibilityReason.PARCEL_DELETED);
    }
    if (appointment.fulfilled()) {
      return EligibilityResult.ineligible(IneligibilityReason.PARCEL_PICKED_UP);
    }
    if (appointment.householdAnonymized()) {
      return EligibilityResult.ineligible(IneligibilityReason.HOUSEHOLD_ANONYMIZED);
    }
    if (appointment.pickupWindowEnd().isBefore(now)) {
      return EligibilityResult.ineligible(IneligibilityReason.PICKUP_TIME_PASSED);
    }
    return EligibilityResult.eligibleResult();
  }
}
