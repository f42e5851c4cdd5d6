/*
 * Where: notification service layer
 * What: claims a batch, delivers each job through its channel handler and records the outcome
 * Why: one job's failure is recorded as its own outcome and never aborts the rest of the batch
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.backend.NotificationBackend;
import com.example.notifyhub.notification.config.DispatchExecutorConfig;
import com.example.notifyhub.notification.config.NotificationWorkerProperties;
import com.example.notifyhub.notification.delivery.DeliveryHandler;
import com.example.notifyhub.notification.delivery.DeliveryHandlerRegistry;
import com.example.notifyhub.notification.model.DeliveryFailure;
import com.example.notifyhub.notification.model.DeliveryResult;
import com.example.notifyhub.notification.model.JobStatus;
import com.example.notifyhub.notification.model.NotificationJob;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class NotificationDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatchService.class);

  static final String MDC_JOB_ID = "job_id";
  static final String MDC_RECIPIENT_ID = "recipient_id";
  static final String MDC_CHANNEL = "channel";

  private final NotificationBackend backend;
  private final DeliveryHandlerRegistry handlerRegistry;
  private final PreferenceService preferenceService;
  private final NotificationMetrics metrics;
  private final NotificationWorkerProperties properties;
  private final Executor dispatchExecutor;
  private final Clock clock;

  public NotificationDispatchService(
      NotificationBackend backend,
      DeliveryHandlerRegistry handlerRegistry,
      PreferenceService preferenceService,
      NotificationMetrics metrics,
      NotificationWorkerProperties properties,
      @Qualifier(DispatchExecutorConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor,
      Clock clock) {
    this.backend = backend;
    this.handlerRegistry = handlerRegistry;
    this.preferenceService = preferenceService;
    this.metrics = metrics;
    this.properties = properties;
    this.dispatchExecutor = dispatchExecutor;
    this.clock = clock;
  }

  /**
   * Runs one fetch, dispatch and record pass.
   *
   * @throws com.example.notifyhub.notification.backend.TransientStoreException when the batch
   *     cannot be claimed; nothing was claimed in that case
   */
  public DispatchReport processBatch() {
    // claim is a single statement; delivery IO never runs inside a store transaction
    final List<NotificationJob> jobs = backend.fetchBatch(properties.batchSize());
    if (jobs.isEmpty()) {
      return DispatchReport.EMPTY;
    }
    final List<CompletableFuture<DispatchOutcome>> futures = new ArrayList<>(jobs.size());
    for (NotificationJob job : jobs) {
      futures.add(submit(job));
    }
    final List<DispatchOutcome> outcomes = new ArrayList<>(futures.size());
    for (CompletableFuture<DispatchOutcome> future : futures) {
      outcomes.add(future.join());
    }
    return DispatchReport.of(outcomes);
  }

  private CompletableFuture<DispatchOutcome> submit(NotificationJob job) {
    try {
      return CompletableFuture.supplyAsync(() -> dispatch(job), dispatchExecutor);
    } catch (RejectedExecutionException ex) {
      // pool full or already shut down; finish the claimed job on this thread
      return CompletableFuture.completedFuture(dispatch(job));
    }
  }

  @VisibleForTesting
  DispatchOutcome dispatch(NotificationJob job) {
    MDC.put(MDC_JOB_ID, job.jobId().toString());
    MDC.put(MDC_RECIPIENT_ID, job.recipientId());
    MDC.put(MDC_CHANNEL, job.channel().value());
    try {
      final DeliveryResult result = deliver(job);
      final DispatchOutcome outcome = record(job, result);
      metrics.recordDeliveryResult(job.channel(), outcome.value());
      return outcome;
    } finally {
      MDC.remove(MDC_JOB_ID);
      MDC.remove(MDC_RECIPIENT_ID);
      MDC.remove(MDC_CHANNEL);
    }
  }

  private DeliveryResult deliver(NotificationJob job) {
    try {
      // preference read at dispatch time; opting out after enqueue still stops delivery
      if (!preferenceService.isChannelEnabled(job.recipientId(), job.channel())) {
        return DeliveryResult.suppressed();
      }
      final Optional<DeliveryHandler> handler = handlerRegistry.find(job.channel());
      if (handler.isEmpty()) {
        return DeliveryResult.failed(
            DeliveryFailure.NO_HANDLER, "no handler for channel " + job.channel().value());
      }
      return handler.get().deliver(job);
    } catch (RuntimeException ex) {
      logger.error("notification delivery raised unexpectedly id={}", job.jobId(), ex);
      return DeliveryResult.failed(
          DeliveryFailure.UNEXPECTED, ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private DispatchOutcome record(NotificationJob job, DeliveryResult result) {
    final Optional<JobStatus> status;
    try {
      status = backend.markResult(job, result);
    } catch (RuntimeException ex) {
      // the claim stays IN_PROGRESS and is recovered once its lease expires
      logger.error(
          "notification result could not be recorded id={} delivered={}",
          job.jobId(),
          result.delivered(),
          ex);
      return DispatchOutcome.RECORD_FAILED;
    }
    if (status.isEmpty()) {
      logger.warn(
          "notification result skipped because lock was lost id={} delivered={}",
          job.jobId(),
          result.delivered());
      return DispatchOutcome.CLAIM_LOST;
    }
    return switch (status.get()) {
      case SENT -> {
        metrics.recordDeliveryE2eDelay(job.createdAt(), Instant.now(clock));
        logger.info(
            "notification job sent id={} channel={} type={}",
            job.jobId(),
            job.channel().value(),
            job.notificationType());
        yield DispatchOutcome.SENT;
      }
      case PENDING -> {
        logger.warn(
            "notification retry scheduled id={} attempt={} reason={}",
            job.jobId(),
            job.attemptCount() + 1,
            result.errorMessage());
        yield DispatchOutcome.RETRY_SCHEDULED;
      }
      case FAILED -> {
        if (result.failure() == DeliveryFailure.SUPPRESSED) {
          logger.info(
              "notification job suppressed by preference id={} channel={}",
              job.jobId(),
              job.channel().value());
          yield DispatchOutcome.SUPPRESSED;
        }
        logger.error(
            "notification job failed id={} attempt={} reason={}",
            job.jobId(),
            job.attemptCount() + 1,
            result.errorMessage());
        yield DispatchOutcome.FAILED;
      }
      case IN_PROGRESS -> throw new IllegalStateException("markResult returned IN_PROGRESS");
    };
  }
}
