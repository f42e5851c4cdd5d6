/*
 * Where: real-time gateway
 * What: live connection handles per user and fan-out of in-app messages to them
 * Why: a user may be connected from several devices at once
 */
package com.example.notifyhub.notification.realtime;

import com.example.notifyhub.notification.service.NotificationMetrics;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-local registry of live connections.
 *
 * <p>Handles that vanish without a close signal stay registered until a push finds them closed or
 * failing, at which point they are pruned. A deployment with several gateway processes needs a
 * shared fan-out in front of this registry.
 */
@Component
public class ConnectionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ConcurrentMap<String, Set<ConnectionHandle>> connections =
      new ConcurrentHashMap<>();

  public ConnectionRegistry(NotificationMetrics metrics) {
    metrics.bindConnectionCount(this, ConnectionRegistry::connectionCount);
  }

  public void register(String userId, ConnectionHandle handle) {
    connections.compute(
        userId,
        (key, handles) -> {
          final Set<ConnectionHandle> target =
              handles == null ? ConcurrentHashMap.newKeySet() : handles;
          target.add(handle);
          return target;
        });
    logger.info("realtime connection registered userId={} connectionId={}", userId, handle.id());
  }

  public void unregister(String userId, ConnectionHandle handle) {
    final boolean[] removed = {false};
    connections.computeIfPresent(
        userId,
        (key, handles) -> {
          removed[0] = handles.remove(handle);
          return handles.isEmpty() ? null : handles;
        });
    if (removed[0]) {
      logger.info(
          "realtime connection unregistered userId={} connectionId={}", userId, handle.id());
    }
  }

  /**
   * Sends {@code message} to every live handle of the user.
   *
   * @return number of handles the message was written to; 0 when the user is offline
   */
  public int push(String userId, String message) {
    final Set<ConnectionHandle> handles = connections.get(userId);
    if (handles == null) {
      return 0;
    }
    int delivered = 0;
    for (ConnectionHandle handle : List.copyOf(handles)) {
      if (!handle.isOpen()) {
        unregister(userId, handle);
        continue;
      }
      try {
        handle.send(message);
        delivered++;
      } catch (IOException | RuntimeException ex) {
        logger.warn(
            "realtime push failed; pruning userId={} connectionId={}",
            userId,
            handle.id(),
            ex);
        unregister(userId, handle);
        handle.close();
      }
    }
    return delivered;
  }

  public boolean isOnline(String userId) {
    final Set<ConnectionHandle> handles = connections.get(userId);
    return handles != null && !handles.isEmpty();
  }

  public int connectionCount() {
    int count = 0;
    for (Set<ConnectionHandle> handles : connections.values()) {
      count += handles.size();
    }
    return count;
  }

  @PreDestroy
  public void closeAll() {
    final int count = connectionCount();
    for (Set<ConnectionHandle> handles : connections.values()) {
      for (ConnectionHandle handle : List.copyOf(handles)) {
        handle.close();
      }
    }
    connections.clear();
    logger.info("realtime connections closed count={}", count);
  }
}
