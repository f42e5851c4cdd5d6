/*
 * Where: notification domain model
 * What: one user's opt-in flag for one channel
 * Why: absence of a row means the channel is enabled
 */
package com.example.notifyhub.notification.model;

import java.time.Instant;

public record CommunicationPreference(
    String userId,
    NotificationChannel channel,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt) {}
