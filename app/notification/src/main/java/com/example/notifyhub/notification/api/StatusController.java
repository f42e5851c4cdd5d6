package com.example.notifyhub.notification.api;

import com.example.notifyhub.notification.config.NotificationRealtimeProperties;
import com.example.notifyhub.notification.config.NotificationWorkerProperties;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Which parts of the service run in this process. */
@RestController
@RequiredArgsConstructor
public class StatusController {

  private final NotificationWorkerProperties workerProperties;
  private final NotificationRealtimeProperties realtimeProperties;

  @GetMapping("/")
  public Map<String, Object> home() {
    return Map.of(
        "service", "notification",
        "worker_enabled", workerProperties.enabled(),
        "realtime_enabled", realtimeProperties.enabled());
  }
}
