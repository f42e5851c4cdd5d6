/*
 * Where: notification domain model
 * What: a domain event addressed to one user
 * Why: the event receiver maps it to zero or more enqueue requests
 */
package com.example.notifyhub.notification.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NotificationEvent(
    NotificationEventType type,
    String recipientId,
    Map<String, Object> context,
    String idempotencyKey) {

  public NotificationEvent {
    context =
        context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public String contextString(String key) {
    final Object value = context.get(key);
    return value == null ? null : value.toString();
  }
}
