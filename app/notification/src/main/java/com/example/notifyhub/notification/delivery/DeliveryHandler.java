package com.example.notifyhub.notification.delivery;

import com.example.notifyhub.notification.model.DeliveryResult;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.model.NotificationJob;
import java.util.Set;

/**
 * Transmits one job over one channel.
 *
 * <p>Handlers report transport problems through the returned {@link DeliveryResult} and should
 * bound their own transport timeouts. A job may be delivered more than once, so delivery must be
 * safe to repeat.
 */
public interface DeliveryHandler {

  Set<NotificationChannel> channels();

  DeliveryResult deliver(NotificationJob job);
}
