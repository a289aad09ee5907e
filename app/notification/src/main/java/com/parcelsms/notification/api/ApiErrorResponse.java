package com.parcelsms.notification.api;

/** Error body of every admin endpoint. */
public record ApiErrorResponse(String code, String message) {}
