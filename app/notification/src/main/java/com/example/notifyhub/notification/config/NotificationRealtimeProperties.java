/*
 * Where: notification configuration binding
 * What: WebSocket endpoint, handshake identity header and missed-notification replay settings
 * Why: the gateway in front of this service decides origins and the identity header
 */
package com.example.notifyhub.notification.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.realtime")
public record NotificationRealtimeProperties(
    boolean enabled,
    String path,
    List<String> allowedOrigins,
    String userIdHeader,
    boolean replayMissed,
    Duration replayWindow,
    int replayLimit,
    Duration sendTimeLimit,
    int sendBufferSizeLimit) {

  public NotificationRealtimeProperties {
    path = path == null || path.isBlank() ? "/ws/notifications" : path;
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    userIdHeader = userIdHeader == null || userIdHeader.isBlank() ? "X-User-Id" : userIdHeader;
    replayWindow = replayWindow == null ? Duration.ofHours(24) : replayWindow;
    replayLimit = replayLimit <= 0 ? 50 : replayLimit;
    sendTimeLimit = sendTimeLimit == null ? Duration.ofSeconds(5) : sendTimeLimit;
    sendBufferSizeLimit = sendBufferSizeLimit <= 0 ? 512 * 1024 : sendBufferSizeLimit;
  }
}
