package com.example.notifyhub.notification.realtime;

import com.example.notifyhub.notification.config.NotificationRealtimeProperties;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

/**
 * Accepts a WebSocket handshake only when the gateway passed the authenticated user id header.
 * The id is stored under {@link #USER_ID_ATTRIBUTE} in the session attributes.
 */
@Component
@RequiredArgsConstructor
public class UserHandshakeInterceptor implements HandshakeInterceptor {

  public static final String USER_ID_ATTRIBUTE = "notification.userId";

  private static final Logger logger = LoggerFactory.getLogger(UserHandshakeInterceptor.class);

  private final NotificationRealtimeProperties properties;

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    final String userId = request.getHeaders().getFirst(properties.userIdHeader());
    if (userId == null || userId.isBlank()) {
      logger.warn("realtime handshake rejected: missing {} header", properties.userIdHeader());
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }
    attributes.put(USER_ID_ATTRIBUTE, userId.trim());
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      @Nullable Exception exception) {
    // nothing to clean up
  }
}
