package com.example.notifyhub.notification.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.notifyhub.notification.config.NotificationRealtimeProperties;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

class UserHandshakeInterceptorTest {

  private final UserHandshakeInterceptor interceptor =
      new UserHandshakeInterceptor(
          new NotificationRealtimeProperties(true, null, null, null, true, null, 0, null, 0));

  @Test
  void acceptsHandshakeWithUserHeader() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/notifications");
    request.addHeader("X-User-Id", " user-1 ");
    final Map<String, Object> attributes = new HashMap<>();

    final boolean accepted =
        interceptor.beforeHandshake(
            new ServletServerHttpRequest(request),
            new ServletServerHttpResponse(new MockHttpServletResponse()),
            mock(WebSocketHandler.class),
            attributes);

    assertThat(accepted).isTrue();
    assertThat(attributes).containsEntry(UserHandshakeInterceptor.USER_ID_ATTRIBUTE, "user-1");
  }

  @Test
  void rejectsHandshakeWithoutUserHeader() throws Exception {
    final MockHttpServletResponse servletResponse = new MockHttpServletResponse();
    final ServletServerHttpResponse response = new ServletServerHttpResponse(servletResponse);
    final Map<String, Object> attributes = new HashMap<>();

    final boolean accepted =
        interceptor.beforeHandshake(
            new ServletServerHttpRequest(new MockHttpServletRequest("GET", "/ws/notifications")),
            response,
            mock(WebSocketHandler.class),
            attributes);
    response.flush();

    assertThat(accepted).isFalse();
    assertThat(servletResponse.getStatus()).isEqualTo(401);
    assertThat(attributes).isEmpty();
  }
}
