/*
 * Where: notification domain model
 * What: delivery media a job can be sent through
 * Why: the same value keys the handler registry, preferences and the jobs table
 */
package com.example.notifyhub.notification.model;

import java.util.Locale;

public enum NotificationChannel {
  EMAIL("email"),
  IN_APP("in_app");

  private final String value;

  NotificationChannel(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static NotificationChannel fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("channel is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (NotificationChannel channel : values()) {
      if (channel.value.equals(normalized)) {
        return channel;
      }
    }
    throw new IllegalArgumentException("unsupported channel: " + value);
  }
}
