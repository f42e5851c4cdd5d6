/*
 * Where: notification domain model
 * What: snapshot of a notification_jobs row
 * Why: shared by the backend, the worker, handlers and the debug API
 */
package com.example.notifyhub.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationJob(
    UUID jobId,
    String recipientId,
    NotificationChannel channel,
    String notificationType,
    String payloadJson,
    JobStatus status,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    int attemptCount,
    int maxAttempts,
    Instant nextRetryAt,
    String lastError,
    DeliveryFailure failureReason,
    String idempotencyKey,
    Instant createdAt,
    Instant updatedAt,
    Instant sentAt,
    Instant readAt) {

  public static NotificationJob newPending(
      UUID jobId,
      String recipientId,
      NotificationChannel channel,
      String notificationType,
      String payloadJson,
      int maxAttempts,
      String idempotencyKey,
      Instant now) {
    return new NotificationJob(
        jobId,
        recipientId,
        channel,
        notificationType,
        payloadJson,
        JobStatus.PENDING,
        null,
        null,
        null,
        0,
        maxAttempts,
        null,
        null,
        null,
        idempotencyKey,
        now,
        now,
        null,
        null);
  }
}
