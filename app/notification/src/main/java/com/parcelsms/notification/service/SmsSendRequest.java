package com.parcelsms.notification.service;

/** {@code from} is optional; the transport falls back to its configured sender name. */
public record SmsSendRequest(String to, String text, String from) {

  public static SmsSendRequest of(String to, String text) {
    return new SmsSendRequest(to, text, null);
  }
}
