package com.example.notifyhub.notification.service;

/** A producer passed an event that cannot be turned into notifications; retrying will not help. */
public class InvalidNotificationEventException extends RuntimeException {

  public InvalidNotificationEventException(String message) {
    super(message);
  }

  public InvalidNotificationEventException(String message, Throwable cause) {
    super(message, cause);
  }
}
