/*
 * Where: notification domain model
 * What: reasons a delivery attempt did not succeed
 * Why: the retry decision depends on the reason, not on the exception type
 */
package com.example.notifyhub.notification.model;

public enum DeliveryFailure {
  TRANSPORT("transport", true),
  OFFLINE("offline", true),
  UNEXPECTED("unexpected", true),
  SUPPRESSED("suppressed", false),
  RECIPIENT_UNKNOWN("recipient_unknown", false),
  INVALID_PAYLOAD("invalid_payload", false),
  NO_HANDLER("no_handler", false);

  private final String value;
  private final boolean retryable;

  DeliveryFailure(String value, boolean retryable) {
    this.value = value;
    this.retryable = retryable;
  }

  public String value() {
    return value;
  }

  public boolean retryable() {
    return retryable;
  }
}
