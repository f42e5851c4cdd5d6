package com.example.notifyhub.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEventResponse(List<UUID> jobIds) {
  public NotificationEventResponse {
    jobIds = jobIds == null ? List.of() : List.copyOf(jobIds);
  }
}
