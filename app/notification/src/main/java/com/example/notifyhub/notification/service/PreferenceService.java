/*
 * Where: notification service layer
 * What: reads and changes per-user channel opt-in flags
 * Why: a channel without a stored row counts as enabled
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.model.CommunicationPreference;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.repository.CommunicationPreferenceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PreferenceService {

  private static final Logger logger = LoggerFactory.getLogger(PreferenceService.class);

  private final CommunicationPreferenceRepository repository;
  private final Clock clock;

  public boolean isChannelEnabled(String userId, NotificationChannel channel) {
    return repository.findEnabled(userId, channel).orElse(Boolean.TRUE);
  }

  /** Every channel of the user, with defaults filled in for channels never changed. */
  public Map<NotificationChannel, Boolean> getPreferences(String userId) {
    requireUserId(userId);
    final Map<NotificationChannel, Boolean> preferences = new EnumMap<>(NotificationChannel.class);
    for (NotificationChannel channel : NotificationChannel.values()) {
      preferences.put(channel, Boolean.TRUE);
    }
    for (CommunicationPreference stored : repository.findByUserId(userId)) {
      preferences.put(stored.channel(), stored.enabled());
    }
    return Collections.unmodifiableMap(preferences);
  }

  public void updatePreference(String userId, NotificationChannel channel, boolean enabled) {
    requireUserId(userId);
    if (channel == null) {
      throw new IllegalArgumentException("channel is required");
    }
    repository.upsert(userId, channel, enabled, Instant.now(clock));
    logger.info(
        "communication preference updated userId={} channel={} enabled={}",
        userId,
        channel.value(),
        enabled);
  }

  private void requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
  }
}
