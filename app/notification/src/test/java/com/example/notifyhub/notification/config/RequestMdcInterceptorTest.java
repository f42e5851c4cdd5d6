package com.example.notifyhub.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.notifyhub.common.TraceIds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putsAndRemovesRequestKeys() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/notification-events");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/notification-events");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(response.getHeader("X-Request-Id")).isEqualTo("req-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get(TraceIds.MDC_KEY)).isNull();
    assertThat(MDC.get("client_ip")).isNull();
  }

  @Test
  void generatesRequestIdAndKeepsExistingTraceId() {
    MDC.put(TraceIds.MDC_KEY, "trace-from-agent");
    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/v1/users/user-1/preferences");
    request.setRemoteAddr("192.168.0.5");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    final String requestId = MDC.get("request_id");
    assertThat(requestId).isNotBlank();
    assertThat(response.getHeader("X-Request-Id")).isEqualTo(requestId);
    assertThat(MDC.get("client_ip")).isEqualTo("192.168.0.5");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo("trace-from-agent");
  }
}
