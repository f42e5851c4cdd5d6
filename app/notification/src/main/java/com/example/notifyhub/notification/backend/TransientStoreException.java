package com.example.notifyhub.notification.backend;

/** The job store could not be reached or rejected the call for a reason that may clear. */
public class TransientStoreException extends RuntimeException {

  public TransientStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
