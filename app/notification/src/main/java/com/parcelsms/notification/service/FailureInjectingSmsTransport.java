/*
 * Where: Notification service layer
 * What: CI/test-only transport that fails sends for matching recipients
 * Why: Reproduce transient and permanent provider failures end to end without a real provider
 */
package com.parcelsms.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.sms.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingSmsTransport implements SmsTransport {

  private final HelloSmsTransport delegate;

  @Value("${notification.sms.failure-injection.recipient-suffix:}")
  private String recipientSuffix;

  @Value("${notification.sms.failure-injection.transient:true}")
  private boolean transientFailure;

  @Override
  public SmsSendResult send(SmsSendRequest request) {
    if (!shouldInjectFailure(request.to())) {
      return delegate.send(request);
    }
    if (transientFailure) {
      return SmsSendResult.transientFailure("injected failure", 503);
    }
    return SmsSendResult.permanentFailure("injected failure", 400);
  }

  private boolean shouldInjectFailure(String recipient) {
    if (recipientSuffix == null || recipientSuffix.isBlank()) {
      return false;
    }
    return recipient != null && recipient.endsWith(recipientSuffix);
  }
}
