/*
 * Where: Notification service layer
 * What: Sends SMS through the HelloSMS HTTP API
 * Why: Classify provider outcomes into sent, transient failure and permanent failure
 */
package com.parcelsms.notification.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.parcelsms.notification.config.SmsProviderProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class HelloSmsTransport implements SmsTransport {

  private static final Logger logger = LoggerFactory.getLogger(HelloSmsTransport.class);
  private static final String SUCCESS_STATUS = "success";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  private final RestClient smsRestClient;

  private final SmsProviderProperties properties;

  public HelloSmsTransport(RestClient smsRestClient, SmsProviderProperties properties) {
    this.smsRestClient = smsRestClient;
    this.properties = properties;
  }

  @Override
  public SmsSendResult send(SmsSendRequest request) {
    if (!PhoneNumbers.isValidE164(request.to())) {
      return SmsSendResult.permanentFailure("recipient is not a valid E.164 number", null);
    }
    if (properties.testMode()) {
      final String messageId = testMessageId();
      logger.info(
          "sms test mode, provider call skipped to={} messageId={}",
          PhoneNumbers.mask(request.to()),
          messageId);
      return SmsSendResult.sent(messageId);
    }
    try {
      final HelloSmsResponse response =
          smsRestClient
              .post()
              .uri(properties.apiUrl())
              .contentType(MediaType.APPLICATION_JSON)
              .headers(headers -> headers.setBasicAuth(properties.username(), properties.password()))
              .body(requestBody(request))
              .retrieve()
              .body(HelloSmsResponse.class);
      return toResult(response);
    } catch (RestClientResponseException ex) {
      return mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      return mapResourceException(ex);
    } catch (RuntimeException ex) {
      logger.warn("sms provider response parse failed", ex);
      return SmsSendResult.permanentFailure("invalid provider response", null);
    }
  }

  private Map<String, Object> requestBody(SmsSendRequest request) {
    final String from = request.from() != null ? request.from() : properties.from();
    if (from == null || from.isBlank()) {
      return Map.of("to", request.to(), "message", request.text(), "sendApiCallback", false);
    }
    return Map.of(
        "to", request.to(), "message", request.text(), "from", from, "sendApiCallback", false);
  }

  private SmsSendResult toResult(HelloSmsResponse response) {
    if (response == null || !SUCCESS_STATUS.equals(response.status())) {
      final String statusText =
          response == null || response.statusText() == null
              ? "provider rejected the message"
              : response.statusText();
      return SmsSendResult.permanentFailure(statusText, null);
    }
    final String messageId =
        response.messageIds() == null
                || response.messageIds().isEmpty()
                || response.messageIds().get(0).apiMessageId() == null
            ? "unknown"
            : response.messageIds().get(0).apiMessageId();
    return SmsSendResult.sent(messageId);
  }

  private SmsSendResult mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn("sms provider failed with http status={} statusText={}", status, ex.getStatusText());
    // response bodies are never propagated to callers
    final String error = "HTTP " + status;
    if (status == 429 || status == 503) {
      return SmsSendResult.transientFailure(error, status);
    }
    return SmsSendResult.permanentFailure(error, status);
  }

  private SmsSendResult mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("sms provider timed out");
      return SmsSendResult.transientFailure("provider timeout", null);
    }
    logger.warn("sms provider connection failed", ex);
    return SmsSendResult.transientFailure("provider connection failed", null);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private String testMessageId() {
    return "test_"
        + System.currentTimeMillis()
        + "_"
        + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record HelloSmsResponse(String status, String statusText, List<MessageId> messageIds) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MessageId(String apiMessageId) {}
}
