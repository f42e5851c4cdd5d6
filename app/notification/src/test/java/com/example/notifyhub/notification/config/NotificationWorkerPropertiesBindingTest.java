/*
 * Where: notification configuration binding test
 * What: binds worker and realtime settings and rejects inconsistent worker limits at startup
 */
package com.example.notifyhub.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class NotificationWorkerPropertiesBindingTest {

  private static final List<String> WORKER_PROPERTIES =
      List.of(
          "notification.worker.enabled=true",
          "notification.worker.poll-interval=10s",
          "notification.worker.batch-size=10",
          "notification.worker.max-attempts=3",
          "notification.worker.in-app-max-attempts=2",
          "notification.worker.stale-after=5m",
          "notification.worker.error-backoff=30s",
          "notification.worker.error-backoff-max=5m",
          "notification.worker.backoff-base=30s",
          "notification.worker.backoff-max=10m",
          "notification.worker.backoff-exponent-base=2.0",
          "notification.worker.backoff-jitter-min=0.5",
          "notification.worker.backoff-jitter-max=1.5",
          "notification.worker.backoff-min=1s",
          "notification.worker.error-message-max-length=255",
          "notification.worker.dispatch-parallelism=4",
          "notification.worker.drain-timeout=30s");

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(WORKER_PROPERTIES.toArray(String[]::new));

  @Test
  void bindsDurationsAndLimits() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final NotificationWorkerProperties properties =
              context.getBean(NotificationWorkerProperties.class);

          assertThat(properties.pollInterval()).isEqualTo(Duration.ofSeconds(10));
          assertThat(properties.staleAfter()).isEqualTo(Duration.ofMinutes(5));
          assertThat(properties.backoffMax()).isEqualTo(Duration.ofMinutes(10));
          assertThat(properties.maxAttempts()).isEqualTo(3);
          assertThat(properties.inAppMaxAttempts()).isEqualTo(2);
          assertThat(properties.runOnce()).isFalse();
        });
  }

  @Test
  void rejectsInAppCeilingAboveMaxAttempts() {
    contextRunner
        .withPropertyValues("notification.worker.in-app-max-attempts=5")
        .run(
            context ->
                assertThat(context)
                    .hasFailed()
                    .getFailure()
                    .rootCause()
                    .hasMessageContaining("in-app-max-attempts must not exceed max-attempts"));
  }

  @Test
  void rejectsZeroPollInterval() {
    contextRunner
        .withPropertyValues("notification.worker.poll-interval=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsMissingDuration() {
    final List<String> withoutStaleAfter = new ArrayList<>(WORKER_PROPERTIES);
    withoutStaleAfter.removeIf(property -> property.startsWith("notification.worker.stale-after"));

    new ApplicationContextRunner()
        .withUserConfiguration(TestConfiguration.class)
        .withPropertyValues(withoutStaleAfter.toArray(String[]::new))
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void realtimeSettingsFallBackToDefaults() {
    contextRunner
        .withPropertyValues("notification.realtime.enabled=true")
        .run(
            context -> {
              final NotificationRealtimeProperties realtime =
                  context.getBean(NotificationRealtimeProperties.class);
              assertThat(realtime.path()).isEqualTo("/ws/notifications");
              assertThat(realtime.userIdHeader()).isEqualTo("X-User-Id");
              assertThat(realtime.allowedOrigins()).isEmpty();
              assertThat(realtime.replayWindow()).isEqualTo(Duration.ofHours(24));
              assertThat(realtime.replayLimit()).isEqualTo(50);
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    NotificationWorkerProperties.class,
    NotificationRealtimeProperties.class
  })
  static class TestConfiguration {}
}
