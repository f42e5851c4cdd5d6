/*
 * Where: notification service layer
 * What: records delivery outcomes, end-to-end delay, backlog, recovery and connection metrics
 * Why: queue health is observed from Prometheus without reading the jobs table
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.model.NotificationChannel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  static final String METRIC_DELIVERY_E2E_DELAY = "notification.delivery.e2e.delay";
  static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";
  static final String METRIC_STALE_RECOVERED_TOTAL = "notification.stale.recovered.total";
  static final String METRIC_CYCLE_ERRORS_TOTAL = "notification.worker.cycle.errors.total";
  static final String METRIC_CONNECTIONS_CURRENT = "notification.realtime.connections.current";

  private final MeterRegistry meterRegistry;
  private final AtomicLong backlogCurrent = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter staleRecoveredCounter;
  private final Counter cycleErrorCounter;
  private final Timer deliveryE2eDelayTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicLong::get)
        .description("Current number of pending notification jobs")
        .register(meterRegistry);
    this.staleRecoveredCounter =
        Counter.builder(METRIC_STALE_RECOVERED_TOTAL)
            .description("Jobs returned to pending after their claim lease expired")
            .register(meterRegistry);
    this.cycleErrorCounter =
        Counter.builder(METRIC_CYCLE_ERRORS_TOTAL)
            .description("Worker cycles aborted by a store or unexpected error")
            .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("Delay from job creation to successful delivery")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(NotificationChannel channel, String result) {
    deliveryCounters
        .computeIfAbsent(
            channel.value() + ':' + result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification delivery outcomes")
                    .tags(Tags.of("channel", channel.value(), "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeliveryE2eDelay(Instant createdAt, Instant sentAt) {
    if (createdAt == null || sentAt == null || sentAt.isBefore(createdAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(createdAt, sentAt));
  }

  public void recordStaleRecovered(int count) {
    if (count > 0) {
      staleRecoveredCounter.increment(count);
    }
  }

  public void recordCycleError() {
    cycleErrorCounter.increment();
  }

  public void updateBacklogCurrent(long backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  public <T> void bindConnectionCount(T source, ToDoubleFunction<T> count) {
    Gauge.builder(METRIC_CONNECTIONS_CURRENT, source, count)
        .description("Live real-time connections held by this process")
        .register(meterRegistry);
  }
}
