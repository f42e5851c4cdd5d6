package com.example.notifyhub.notification.config;

import com.example.notifyhub.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Tags every log line of one API call with the request id, method, path and caller address. The
 * request id is echoed in the {@code X-Request-Id} response header so clients can quote it.
 */
@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  private static final String OWNED_KEYS = RequestMdcInterceptor.class.getName() + ".ownedKeys";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = blankToNull(request.getHeader(REQUEST_ID_HEADER));
    final String effectiveRequestId = requestId == null ? UUID.randomUUID().toString() : requestId;

    final Map<String, String> entries = new LinkedHashMap<>();
    entries.put("request_id", effectiveRequestId);
    if (MDC.get(TraceIds.MDC_KEY) == null) {
      // untraced call: the request id doubles as trace id
      entries.put(TraceIds.MDC_KEY, effectiveRequestId);
    }
    entries.put("http_method", request.getMethod());
    entries.put("http_path", request.getRequestURI());
    entries.put("client_ip", clientIp(request));
    entries.values().removeIf(value -> value == null || value.isBlank());

    entries.forEach(MDC::put);
    request.setAttribute(OWNED_KEYS, Set.copyOf(entries.keySet()));
    response.setHeader(REQUEST_ID_HEADER, effectiveRequestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(OWNED_KEYS) instanceof Set<?> owned) {
      owned.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private static String clientIp(HttpServletRequest request) {
    final String forwardedFor = blankToNull(request.getHeader(FORWARDED_FOR_HEADER));
    if (forwardedFor == null) {
      return request.getRemoteAddr();
    }
    // left-most entry is the original client
    final int comma = forwardedFor.indexOf(',');
    return (comma < 0 ? forwardedFor : forwardedFor.substring(0, comma)).trim();
  }

  @Nullable
  private static String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
