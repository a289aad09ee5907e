package com.parcelsms.notification.service;

import com.parcelsms.notification.model.NotificationRecord;

/** {@code created=false} means the key was already taken and {@code record} is the existing row. */
public record EnqueueResult(NotificationRecord record, boolean created) {}
