/*
 * Where: notification configuration binding
 * What: polling, claim, retry and drain settings of the delivery worker
 * Why: operational parameters are externalized and validated at startup
 */
package com.example.notifyhub.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.worker")
@Validated
public record NotificationWorkerProperties(
    boolean enabled,
    boolean runOnce,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int maxAttempts,
    @Positive int inAppMaxAttempts,
    @NotNull Duration staleAfter,
    @NotNull Duration errorBackoff,
    @NotNull Duration errorBackoffMax,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin,
    @Positive int errorMessageMaxLength,
    @Positive int dispatchParallelism,
    @NotNull Duration drainTimeout) {

  @AssertTrue(message = "notification.worker.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return isPositiveDuration(pollInterval);
  }

  @AssertTrue(message = "notification.worker.stale-after must be positive")
  public boolean isStaleAfterPositive() {
    return isPositiveDuration(staleAfter);
  }

  @AssertTrue(message = "notification.worker.in-app-max-attempts must not exceed max-attempts")
  public boolean isInAppMaxAttemptsWithinMaxAttempts() {
    return inAppMaxAttempts <= maxAttempts;
  }

  @AssertTrue(message = "notification.worker.backoff-jitter-min must not exceed backoff-jitter-max")
  public boolean isJitterRangeOrdered() {
    return backoffJitterMin <= backoffJitterMax;
  }

  private boolean isPositiveDuration(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
