package com.example.notifyhub.notification.service;

/** What happened to one claimed job in a dispatch cycle; also the metric result tag. */
public enum DispatchOutcome {
  SENT("sent"),
  RETRY_SCHEDULED("retry_scheduled"),
  FAILED("failed"),
  SUPPRESSED("suppressed"),
  CLAIM_LOST("claim_lost"),
  RECORD_FAILED("record_failed");

  private final String value;

  DispatchOutcome(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
