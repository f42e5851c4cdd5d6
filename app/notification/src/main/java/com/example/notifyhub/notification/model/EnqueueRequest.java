/*
 * Where: notification domain model
 * What: one (recipient, channel, payload) unit handed to a backend
 * Why: producers describe what to deliver without knowing the storage layout
 */
package com.example.notifyhub.notification.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EnqueueRequest(
    String recipientId,
    NotificationChannel channel,
    String notificationType,
    Map<String, Object> payload,
    String idempotencyKey) {

  public EnqueueRequest {
    if (recipientId == null || recipientId.isBlank()) {
      throw new IllegalArgumentException("recipientId is required");
    }
    if (channel == null) {
      throw new IllegalArgumentException("channel is required");
    }
    if (notificationType == null || notificationType.isBlank()) {
      throw new IllegalArgumentException("notificationType is required");
    }
    payload =
        payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
