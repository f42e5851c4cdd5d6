/*
 * Where: notification queue
 * What: attempt ceilings per channel and backoff durations for job retries and worker errors
 * Why: the backend and the worker share one set of backoff rules
 */
package com.example.notifyhub.notification.backend;

import com.example.notifyhub.notification.config.NotificationWorkerProperties;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class RetryPolicy {

  private final NotificationWorkerProperties properties;
  private final DoubleSupplier random;

  @Autowired
  public RetryPolicy(NotificationWorkerProperties properties) {
    this(properties, () -> ThreadLocalRandom.current().nextDouble());
  }

  @VisibleForTesting
  RetryPolicy(NotificationWorkerProperties properties, DoubleSupplier random) {
    this.properties = properties;
    this.random = random;
  }

  public int maxAttemptsFor(NotificationChannel channel) {
    if (channel == NotificationChannel.IN_APP) {
      return properties.inAppMaxAttempts();
    }
    return properties.maxAttempts();
  }

  /** Delay before the job becomes eligible again after its {@code attempt}-th failure. */
  public Duration computeBackoffDuration(int attempt) {
    double baseMillis = properties.backoffBase().toMillis();
    double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    double capped = Math.min(exp, properties.backoffMax().toMillis());
    double jitterMin = properties.backoffJitterMin();
    double jitterMax = properties.backoffJitterMax();
    double jitter = jitterMin + random.getAsDouble() * (jitterMax - jitterMin);
    long backoffMillis = (long) Math.ceil(capped * jitter);
    long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  /** Pause of the worker loop after {@code consecutiveErrors} failed cycles in a row. */
  public Duration errorBackoff(int consecutiveErrors) {
    if (consecutiveErrors <= 0) {
      return Duration.ZERO;
    }
    long baseMillis = properties.errorBackoff().toMillis();
    long maxMillis = properties.errorBackoffMax().toMillis();
    // doubling stops at the cap, so the shift never overflows
    int shift = Math.min(consecutiveErrors - 1, 30);
    long millis = baseMillis << shift;
    if (millis <= 0 || millis > maxMillis) {
      millis = maxMillis;
    }
    return Duration.ofMillis(millis);
  }

  public String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
