package com.example.notifyhub.notification.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.Instant;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Archival of terminal jobs; the sweep only runs when {@code enabled} is set. */
@ConfigurationProperties(prefix = "notification.retention")
@Validated
public record NotificationRetentionProperties(
    boolean enabled, @Positive int retentionDays, @NotNull Duration cleanupInterval) {

  /** Jobs created strictly before the returned instant are past retention. */
  public Instant archiveThreshold(Instant now) {
    return now.minus(Duration.ofDays(retentionDays));
  }
}
