package com.parcelsms.notification.service;

import java.util.UUID;

public class HouseholdNotFoundException extends RuntimeException {

  public HouseholdNotFoundException(UUID householdId) {
    super("household not found: " + householdId);
  }
}
