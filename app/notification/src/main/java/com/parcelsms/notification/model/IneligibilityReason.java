/*
 * Where: Notification domain model
 * What: Why a due notification was cancelled instead of sent
 * Why: Stored with the record so the pipeline can be audited without parsing messages
 */
package com.parcelsms.notification.model;

import java.util.Arrays;

public enum IneligibilityReason {
  PARCEL_NOT_FOUND("parcel_not_found"),
  PARCEL_DELETED("parcel_deleted"),
  PARCEL_PICKED_UP("parcel_picked_up"),
  HOUSEHOLD_ANONYMIZED("household_anonymized"),
  PICKUP_TIME_PASSED("pickup_time_passed");

  private final String code;

  IneligibilityReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static IneligibilityReason fromCode(String code) {
    return Arrays.stream(values())
        .filter(reason -> reason.code.equals(code))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown ineligibility reason=" + code));
  }
}
