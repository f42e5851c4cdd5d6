/*
 * Where: notification API
 * What: reads and changes a user's per-channel notification preferences
 * Why: users opt out of a channel without contacting support
 */
package com.example.notifyhub.notification.api;

import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.service.PreferenceService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users/{userId}/preferences")
@RequiredArgsConstructor
public class PreferenceController {

  private final PreferenceService preferenceService;

  @GetMapping
  public PreferencesResponse list(@PathVariable("userId") String userId) {
    final Map<NotificationChannel, Boolean> preferences = preferenceService.getPreferences(userId);
    final List<PreferenceItem> items =
        preferences.entrySet().stream()
            .map(entry -> new PreferenceItem(entry.getKey().value(), entry.getValue()))
            .toList();
    return new PreferencesResponse(userId, items);
  }

  @PutMapping("/{channel}")
  public PreferenceItem update(
      @PathVariable("userId") String userId,
      @PathVariable("channel") String channel,
      @Valid @RequestBody PreferenceUpdateRequest request) {
    final NotificationChannel parsed = NotificationChannel.fromValue(channel);
    preferenceService.updatePreference(userId, parsed, request.enabled());
    return new PreferenceItem(parsed.value(), request.enabled());
  }
}
