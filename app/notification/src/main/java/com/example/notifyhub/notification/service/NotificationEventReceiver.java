/*
 * Where: notification service layer
 * What: turns a domain event into queued jobs for the channels the recipient has enabled
 * Why: producers only enqueue; delivery happens later on the worker
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.backend.NotificationBackend;
import com.example.notifyhub.notification.model.EnqueueRequest;
import com.example.notifyhub.notification.model.NotificationEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationEventReceiver {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEventReceiver.class);

  private final NotificationTemplates templates;
  private final PreferenceService preferenceService;
  private final NotificationBackend backend;

  /**
   * Enqueues zero or more jobs for {@code event}.
   *
   * @return ids of the enqueued (or already existing, for a repeated idempotency key) jobs
   * @throws InvalidNotificationEventException when the event cannot be rendered
   */
  @Transactional
  public List<UUID> onEvent(NotificationEvent event) {
    final List<EnqueueRequest> requests = templates.render(event);
    final List<UUID> jobIds = new ArrayList<>(requests.size());
    for (EnqueueRequest request : requests) {
      if (!preferenceService.isChannelEnabled(request.recipientId(), request.channel())) {
        logger.info(
            "notification skipped by preference recipientId={} channel={} type={}",
            request.recipientId(),
            request.channel().value(),
            request.notificationType());
        continue;
      }
      jobIds.add(backend.enqueue(request));
    }
    return jobIds;
  }
}
