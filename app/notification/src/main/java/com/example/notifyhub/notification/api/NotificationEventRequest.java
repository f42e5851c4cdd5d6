package com.example.notifyhub.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEventRequest(
    @NotBlank(message = "type is required") String type,
    @NotBlank(message = "recipient_id is required") String recipientId,
    Map<String, Object> context,
    String idempotencyKey) {}
