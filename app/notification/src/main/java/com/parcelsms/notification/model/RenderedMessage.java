/*
 * Where: Notification domain model
 * What: Recipient and text produced from live appointment/household state
 */
package com.parcelsms.notification.model;

public record RenderedMessage(String recipient, String text) {

  public boolean differsFrom(NotificationRecord record) {
    return !recipient.equals(record.recipient()) || !text.equals(record.renderedText());
  }
}
