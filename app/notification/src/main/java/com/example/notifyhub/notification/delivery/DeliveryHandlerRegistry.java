/*
 * Where: notification delivery
 * What: maps each channel to the handler bean that serves it
 * Why: new channels plug in as beans without touching the dispatch loop
 */
package com.example.notifyhub.notification.delivery;

import com.example.notifyhub.notification.model.NotificationChannel;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DeliveryHandlerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryHandlerRegistry.class);

  private final Map<NotificationChannel, DeliveryHandler> handlers;

  public DeliveryHandlerRegistry(List<DeliveryHandler> handlers) {
    final Map<NotificationChannel, DeliveryHandler> byChannel =
        new EnumMap<>(NotificationChannel.class);
    for (DeliveryHandler handler : handlers) {
      for (NotificationChannel channel : handler.channels()) {
        final DeliveryHandler previous = byChannel.putIfAbsent(channel, handler);
        if (previous != null) {
          throw new IllegalStateException(
              "multiple delivery handlers for channel "
                  + channel.value()
                  + ": "
                  + previous.getClass().getSimpleName()
                  + ", "
                  + handler.getClass().getSimpleName());
        }
      }
    }
    this.handlers = Collections.unmodifiableMap(byChannel);
    for (NotificationChannel channel : NotificationChannel.values()) {
      if (!this.handlers.containsKey(channel)) {
        logger.warn("no delivery handler registered for channel={}", channel.value());
      }
    }
  }

  public Optional<DeliveryHandler> find(NotificationChannel channel) {
    return Optional.ofNullable(handlers.get(channel));
  }
}
