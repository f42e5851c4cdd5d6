package com.example.notifyhub.notification.api;

import com.example.notifyhub.notification.model.JobStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID jobId,
    String channel,
    String notificationType,
    JobStatus status,
    int attemptCount,
    String failureReason,
    String lastError,
    Instant createdAt,
    Instant sentAt,
    Instant readAt,
    JsonNode payload) {}
