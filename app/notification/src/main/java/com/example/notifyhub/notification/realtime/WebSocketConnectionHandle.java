package com.example.notifyhub.notification.realtime;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/** Adapts a thread-safe WebSocket session to {@link ConnectionHandle}. */
final class WebSocketConnectionHandle implements ConnectionHandle {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketConnectionHandle.class);

  private final WebSocketSession session;

  WebSocketConnectionHandle(WebSocketSession session) {
    this.session = session;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void send(String message) throws IOException {
    session.sendMessage(new TextMessage(message));
  }

  @Override
  public void close() {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.GOING_AWAY);
    } catch (IOException ex) {
      logger.debug("websocket close failed connectionId={}", session.getId(), ex);
    }
  }
}
