/*
 * Where: real-time gateway, WebSocket transport
 * What: registers each accepted session in the ConnectionRegistry and removes it on close
 * Why: the in-app handler pushes only through the registry, never through sessions directly
 */
package com.example.notifyhub.notification.realtime;

import com.example.notifyhub.notification.config.NotificationRealtimeProperties;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class NotificationWebSocketHandler extends TextWebSocketHandler {

  static final String HANDLE_ATTRIBUTE = "notification.connectionHandle";

  private static final Logger logger = LoggerFactory.getLogger(NotificationWebSocketHandler.class);

  private final ConnectionRegistry connectionRegistry;
  private final MissedNotificationReplayer replayer;
  private final NotificationRealtimeProperties properties;

  public NotificationWebSocketHandler(
      ConnectionRegistry connectionRegistry,
      MissedNotificationReplayer replayer,
      NotificationRealtimeProperties properties) {
    this.connectionRegistry = connectionRegistry;
    this.replayer = replayer;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    final String userId = userId(session);
    if (userId == null) {
      // the handshake interceptor guarantees the attribute; refuse anything else
      closeQuietly(session, CloseStatus.POLICY_VIOLATION);
      return;
    }
    // dispatch threads and the replay may write concurrently
    final ConcurrentWebSocketSessionDecorator concurrent =
        new ConcurrentWebSocketSessionDecorator(
            session,
            (int) properties.sendTimeLimit().toMillis(),
            properties.sendBufferSizeLimit());
    final ConnectionHandle handle = new WebSocketConnectionHandle(concurrent);
    session.getAttributes().put(HANDLE_ATTRIBUTE, handle);
    connectionRegistry.register(userId, handle);
    replayer.replay(userId, handle);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    logger.debug(
        "realtime client message ignored connectionId={} length={}",
        session.getId(),
        message.getPayloadLength());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.warn("realtime transport error connectionId={}", session.getId(), exception);
    release(session);
    closeQuietly(session, CloseStatus.SERVER_ERROR);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    release(session);
  }

  private void release(WebSocketSession session) {
    final String userId = userId(session);
    final Object handle = session.getAttributes().get(HANDLE_ATTRIBUTE);
    if (userId != null && handle instanceof ConnectionHandle connectionHandle) {
      connectionRegistry.unregister(userId, connectionHandle);
    }
  }

  private static String userId(WebSocketSession session) {
    final Object value = session.getAttributes().get(UserHandshakeInterceptor.USER_ID_ATTRIBUTE);
    return value instanceof String userId ? userId : null;
  }

  private static void closeQuietly(WebSocketSession session, CloseStatus status) {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(status);
    } catch (IOException ex) {
      logger.debug("websocket close failed connectionId={}", session.getId(), ex);
    }
  }
}
