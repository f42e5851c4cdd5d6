/*
 * Where: notification delivery, in-app channel
 * What: pushes the job to every live connection of the recipient
 * Why: an offline recipient is reported as a retryable failure with a short attempt ceiling
 */
package com.example.notifyhub.notification.delivery;

import com.example.notifyhub.notification.model.DeliveryFailure;
import com.example.notifyhub.notification.model.DeliveryResult;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.model.NotificationJob;
import com.example.notifyhub.notification.realtime.ConnectionRegistry;
import com.example.notifyhub.notification.realtime.RealtimeMessageWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InAppDeliveryHandler implements DeliveryHandler {

  private static final Logger logger = LoggerFactory.getLogger(InAppDeliveryHandler.class);

  private final ConnectionRegistry connectionRegistry;
  private final RealtimeMessageWriter messageWriter;

  @Override
  public Set<NotificationChannel> channels() {
    return Set.of(NotificationChannel.IN_APP);
  }

  @Override
  public DeliveryResult deliver(NotificationJob job) {
    final String message;
    try {
      message = messageWriter.notification(job);
    } catch (JsonProcessingException ex) {
      return DeliveryResult.failed(DeliveryFailure.INVALID_PAYLOAD, "payload is not valid json");
    }
    final int delivered = connectionRegistry.push(job.recipientId(), message);
    if (delivered == 0) {
      return DeliveryResult.offline();
    }
    logger.debug("in-app notification pushed id={} connections={}", job.jobId(), delivered);
    return DeliveryResult.sent();
  }
}
