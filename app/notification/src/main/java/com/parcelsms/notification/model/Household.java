/*
 * Where: Notification domain model
 * What: Read model of the household contact data used for rendering
 */
package com.parcelsms.notification.model;

import java.util.UUID;

public record Household(UUID householdId, String phoneNumber, String locale, boolean anonymized) {}
