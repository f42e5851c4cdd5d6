/*
 * Where: notification real-time configuration
 * What: exposes the notification WebSocket endpoint with the identity handshake check
 * Why: the endpoint can be switched off for worker-only deployments
 */
package com.example.notifyhub.notification.config;

import com.example.notifyhub.notification.realtime.NotificationWebSocketHandler;
import com.example.notifyhub.notification.realtime.UserHandshakeInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.realtime.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class WebSocketConfig implements WebSocketConfigurer {

  private final NotificationWebSocketHandler notificationWebSocketHandler;
  private final UserHandshakeInterceptor userHandshakeInterceptor;
  private final NotificationRealtimeProperties properties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    final WebSocketHandlerRegistration registration =
        registry
            .addHandler(notificationWebSocketHandler, properties.path())
            .addInterceptors(userHandshakeInterceptor);
    if (!properties.allowedOrigins().isEmpty()) {
      registration.setAllowedOrigins(properties.allowedOrigins().toArray(String[]::new));
    }
  }
}
