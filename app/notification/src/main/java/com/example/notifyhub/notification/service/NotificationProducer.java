package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.model.NotificationEvent;
import com.example.notifyhub.notification.model.NotificationEventType;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Entry point for code that wants to notify a user. Returns once the jobs are queued; delivery
 * happens on the worker. Store failures propagate so a notification is never lost silently.
 */
@Service
@RequiredArgsConstructor
public class NotificationProducer {

  private final NotificationEventReceiver receiver;

  public List<UUID> notify(
      String recipientId, NotificationEventType eventType, Map<String, Object> context) {
    return notify(recipientId, eventType, context, null);
  }

  /**
   * @param idempotencyKey stable key of the triggering occurrence; a repeat with the same key
   *     returns the existing jobs instead of queueing duplicates. May be null.
   */
  public List<UUID> notify(
      String recipientId,
      NotificationEventType eventType,
      Map<String, Object> context,
      String idempotencyKey) {
    return receiver.onEvent(new NotificationEvent(eventType, recipientId, context, idempotencyKey));
  }
}
