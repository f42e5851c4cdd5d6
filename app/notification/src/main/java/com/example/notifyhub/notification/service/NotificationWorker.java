/*
 * Where: notification delivery worker
 * What: drives dispatch cycles on a fixed delay with startup recovery and error backoff
 * Why: a store outage must slow the loop down, never stop it
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.common.TraceIds;
import com.example.notifyhub.notification.backend.NotificationBackend;
import com.example.notifyhub.notification.backend.RetryPolicy;
import com.example.notifyhub.notification.backend.TransientStoreException;
import com.example.notifyhub.notification.config.NotificationWorkerProperties;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.worker.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationWorker implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(NotificationWorker.class);

  private final NotificationDispatchService dispatchService;
  private final NotificationBackend backend;
  private final RetryPolicy retryPolicy;
  private final NotificationMetrics metrics;
  private final NotificationWorkerProperties properties;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final ReentrantLock cycleLock = new ReentrantLock();

  // guarded by cycleLock
  private int consecutiveErrors;
  private Instant backoffUntil = Instant.MIN;
  private Instant nextRecoveryAt = Instant.MIN;

  @Override
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    cycleLock.lock();
    try {
      recoverIfDue(Instant.now(clock));
    } catch (RuntimeException ex) {
      // retried by the first cycle, nextRecoveryAt is still due
      logger.warn("notification startup recovery failed; retrying on first cycle", ex);
    } finally {
      cycleLock.unlock();
    }
    logger.info(
        "notification worker started pollInterval={} batchSize={}",
        properties.pollInterval(),
        properties.batchSize());
  }

  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    // the current batch finishes; no new cycle starts once the flag is cleared
    try {
      if (cycleLock.tryLock(properties.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        cycleLock.unlock();
        logger.info("notification worker stopped");
      } else {
        logger.warn(
            "notification worker drain timed out after {}; in-flight jobs recover after lease",
            properties.drainTimeout());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("notification worker interrupted while draining", ex);
    }
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  @Scheduled(fixedDelayString = "${notification.worker.poll-interval}")
  public void run() {
    if (properties.runOnce()) {
      return;
    }
    runCycle();
  }

  /** @return whether a cycle was attempted; false while stopped, busy or backing off */
  @VisibleForTesting
  boolean runCycle() {
    if (!running.get() || !cycleLock.tryLock()) {
      return false;
    }
    try {
      final Instant now = Instant.now(clock);
      if (now.isBefore(backoffUntil)) {
        return false;
      }
      MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
      try {
        recoverIfDue(now);
        final DispatchReport report = dispatchService.processBatch();
        metrics.updateBacklogCurrent(backend.countPending());
        if (consecutiveErrors > 0) {
          logger.info("notification worker recovered after {} failed cycles", consecutiveErrors);
        }
        consecutiveErrors = 0;
        backoffUntil = Instant.MIN;
        if (report.claimed() > 0) {
          logger.info(
              "notification cycle finished claimed={} outcomes={}",
              report.claimed(),
              report.outcomes());
        }
      } catch (TransientStoreException ex) {
        onCycleError(now);
        logger.warn(
            "notification store unavailable; backing off until {} errors={}",
            backoffUntil,
            consecutiveErrors,
            ex);
      } catch (RuntimeException ex) {
        onCycleError(now);
        logger.error(
            "notification cycle failed unexpectedly; backing off until {} errors={}",
            backoffUntil,
            consecutiveErrors,
            ex);
      } finally {
        MDC.remove(TraceIds.MDC_KEY);
      }
      return true;
    } finally {
      cycleLock.unlock();
    }
  }

  private void recoverIfDue(Instant now) {
    if (now.isBefore(nextRecoveryAt)) {
      return;
    }
    final int recovered = backend.recoverStaleClaims();
    nextRecoveryAt = now.plus(properties.staleAfter());
    metrics.recordStaleRecovered(recovered);
    if (recovered > 0) {
      logger.info("notification stale claims recovered count={}", recovered);
    }
  }

  private void onCycleError(Instant now) {
    consecutiveErrors++;
    final Duration delay = retryPolicy.errorBackoff(consecutiveErrors);
    backoffUntil = now.plus(delay);
    metrics.recordCycleError();
  }

  @Override
  public int getPhase() {
    // stops before the dispatch executor so the last batch can still use it
    return SmartLifecycle.DEFAULT_PHASE;
  }
}
