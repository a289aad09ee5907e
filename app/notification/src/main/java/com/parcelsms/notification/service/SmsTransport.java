package com.parcelsms.notification.service;

/** Outbound SMS provider boundary. Failures are reported in the result, never thrown. */
public interface SmsTransport {

  SmsSendResult send(SmsSendRequest request);
}
