/*
 * Where: notification domain model
 * What: application events that can produce notifications
 * Why: producers refer to events by a stable string value
 */
package com.example.notifyhub.notification.model;

import java.util.Locale;

public enum NotificationEventType {
  USER_REGISTERED("user_registered"),
  ARTICLE_PUBLISHED("article_published"),
  EMAIL_VERIFIED("email_verified");

  private final String value;

  NotificationEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static NotificationEventType fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("event type is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (NotificationEventType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported event type: " + value);
  }
}
