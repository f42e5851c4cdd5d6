package com.example.notifyhub.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PreferencesResponse(String userId, List<PreferenceItem> preferences) {
  public PreferencesResponse {
    preferences = preferences == null ? List.of() : List.copyOf(preferences);
  }
}
