/*
 * Where: Notification web configuration
 * What: Request-scoped MDC with the request id and the pickup identifiers named in the path
 * Why: Admin actions on one appointment or notification can be traced across request and logs
 */
package com.parcelsms.notification.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final Map<String, String> PATH_VARIABLE_KEYS =
      Map.of(
          "appointmentId", "appointment_id",
          "householdId", "household_id",
          "notificationId", "notification_id");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = resolveRequestId(request);
    put(keys, "request_id", requestId);
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    putPathVariables(keys, request);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (!(request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  // the handler mapping has already resolved the template variables when preHandle runs
  private void putPathVariables(List<String> keys, HttpServletRequest request) {
    if (!(request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables)) {
      return;
    }
    PATH_VARIABLE_KEYS.forEach(
        (variable, mdcKey) -> {
          if (variables.get(variable) instanceof String value) {
            put(keys, mdcKey, value);
          }
        });
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return UUID.randomUUID().toString();
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    final int comma = forwarded.indexOf(',');
    return comma < 0 ? forwarded.trim() : forwarded.substring(0, comma).trim();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
