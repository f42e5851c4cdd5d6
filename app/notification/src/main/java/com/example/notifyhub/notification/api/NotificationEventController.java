/*
 * Where: notification API
 * What: accepts domain events from other services and queues their notifications
 * Why: producers in other processes reach the same receiver as in-process callers
 */
package com.example.notifyhub.notification.api;

import com.example.notifyhub.notification.model.NotificationEventType;
import com.example.notifyhub.notification.service.InvalidNotificationEventException;
import com.example.notifyhub.notification.service.NotificationProducer;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class NotificationEventController {

  private final NotificationProducer producer;

  @PostMapping("/v1/notification-events")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public NotificationEventResponse accept(@Valid @RequestBody NotificationEventRequest request) {
    final NotificationEventType type;
    try {
      type = NotificationEventType.fromValue(request.type());
    } catch (IllegalArgumentException ex) {
      throw new InvalidNotificationEventException(ex.getMessage(), ex);
    }
    final List<UUID> jobIds =
        producer.notify(
            request.recipientId(), type, request.context(), request.idempotencyKey());
    return new NotificationEventResponse(jobIds);
  }
}
