package com.example.notifyhub.notification.service;

public class InvalidVerificationTokenException extends RuntimeException {

  public InvalidVerificationTokenException(String message) {
    super(message);
  }

  public InvalidVerificationTokenException(String message, Throwable cause) {
    super(message, cause);
  }
}
