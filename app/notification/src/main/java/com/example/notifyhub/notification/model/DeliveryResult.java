/*
 * Where: notification domain model
 * What: outcome of one handler invocation for one job
 * Why: handlers report failures as values so a single job never aborts the batch
 */
package com.example.notifyhub.notification.model;

public record DeliveryResult(boolean delivered, DeliveryFailure failure, String detail) {

  private static final DeliveryResult SENT = new DeliveryResult(true, null, null);

  public DeliveryResult {
    if (!delivered && failure == null) {
      throw new IllegalArgumentException("failure reason is required for an undelivered result");
    }
  }

  public static DeliveryResult sent() {
    return SENT;
  }

  public static DeliveryResult failed(DeliveryFailure failure, String detail) {
    return new DeliveryResult(false, failure, detail);
  }

  public static DeliveryResult offline() {
    return new DeliveryResult(false, DeliveryFailure.OFFLINE, null);
  }

  public static DeliveryResult suppressed() {
    return new DeliveryResult(false, DeliveryFailure.SUPPRESSED, null);
  }

  public boolean retryable() {
    return !delivered && failure.retryable();
  }

  public String errorMessage() {
    if (delivered) {
      return null;
    }
    if (detail == null || detail.isBlank()) {
      return failure.value();
    }
    return failure.value() + ": " + detail;
  }
}
