/*
 * Where: notification queue, PostgreSQL implementation
 * What: stores jobs in notification_jobs and claims them with SKIP LOCKED
 * Why: the database is already the durable source of truth, so no separate broker is needed
 */
package com.example.notifyhub.notification.backend;

import com.example.notifyhub.notification.config.NotificationWorkerProperties;
import com.example.notifyhub.notification.model.DeliveryResult;
import com.example.notifyhub.notification.model.EnqueueRequest;
import com.example.notifyhub.notification.model.JobStatus;
import com.example.notifyhub.notification.model.NotificationJob;
import com.example.notifyhub.notification.repository.NotificationJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

@Component
public class DatabaseQueueBackend implements NotificationBackend {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseQueueBackend.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final NotificationJobRepository repository;
  private final RetryPolicy retryPolicy;
  private final NotificationWorkerProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String workerId;

  @Autowired
  public DatabaseQueueBackend(
      NotificationJobRepository repository,
      RetryPolicy retryPolicy,
      NotificationWorkerProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this(repository, retryPolicy, properties, objectMapper, clock, newWorkerId());
  }

  @VisibleForTesting
  DatabaseQueueBackend(
      NotificationJobRepository repository,
      RetryPolicy retryPolicy,
      NotificationWorkerProperties properties,
      ObjectMapper objectMapper,
      Clock clock,
      String workerId) {
    this.repository = repository;
    this.retryPolicy = retryPolicy;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.workerId = workerId;
  }

  @Override
  public UUID enqueue(EnqueueRequest request) {
    final String payloadJson = serialize(request);
    final Instant now = Instant.now(clock);
    final NotificationJob job =
        NotificationJob.newPending(
            UUID.randomUUID(),
            request.recipientId(),
            request.channel(),
            request.notificationType(),
            payloadJson,
            retryPolicy.maxAttemptsFor(request.channel()),
            request.idempotencyKey(),
            now);
    return withStore(
        "enqueue",
        () -> {
          if (request.idempotencyKey() != null) {
            // archived jobs no longer hold the unique index, so check both tables first
            final Optional<UUID> known =
                repository.findIdByIdempotencyKey(request.idempotencyKey(), request.channel());
            if (known.isPresent()) {
              logDuplicate(known.get(), request);
              return known.get();
            }
          }
          if (repository.insert(job) > 0) {
            logger.info(
                "notification job enqueued id={} recipientId={} channel={} type={}",
                job.jobId(),
                job.recipientId(),
                job.channel().value(),
                job.notificationType());
            return job.jobId();
          }
          // the insert lost to an earlier job with the same idempotency key
          final UUID existing =
              repository
                  .findIdByIdempotencyKey(request.idempotencyKey(), request.channel())
                  .orElseThrow(
                      () ->
                          new IllegalStateException(
                              "idempotent insert skipped but no job found key="
                                  + request.idempotencyKey()));
          logDuplicate(existing, request);
          return existing;
        });
  }

  private void logDuplicate(UUID existing, EnqueueRequest request) {
    logger.info(
        "notification job already enqueued id={} idempotencyKey={} channel={}",
        existing,
        request.idempotencyKey(),
        request.channel().value());
  }

  @Override
  public List<NotificationJob> fetchBatch(int maxJobs) {
    if (maxJobs <= 0) {
      return List.of();
    }
    final Instant now = Instant.now(clock);
    final Instant leaseUntil = now.plus(properties.staleAfter());
    return withStore(
        "fetchBatch", () -> repository.claimPending(maxJobs, now, leaseUntil, workerId));
  }

  @Override
  public Optional<JobStatus> markResult(NotificationJob job, DeliveryResult result) {
    final Instant now = Instant.now(clock);
    final int attempt = job.attemptCount() + 1;
    if (result.delivered()) {
      final int updated =
          withStore("markResult", () -> repository.markSent(job.jobId(), attempt, now, workerId));
      return updated == 0 ? Optional.empty() : Optional.of(JobStatus.SENT);
    }
    final boolean terminal = !result.retryable() || attempt >= job.maxAttempts();
    final Instant nextRetryAt =
        terminal ? null : now.plus(retryPolicy.computeBackoffDuration(attempt));
    final String lastError = retryPolicy.truncateError(result.errorMessage());
    final int updated =
        withStore(
            "markResult",
            () ->
                repository.markFailure(
                    job.jobId(),
                    attempt,
                    terminal,
                    nextRetryAt,
                    lastError,
                    result.failure(),
                    now,
                    workerId));
    if (updated == 0) {
      return Optional.empty();
    }
    return Optional.of(terminal ? JobStatus.FAILED : JobStatus.PENDING);
  }

  @Override
  public int recoverStaleClaims() {
    final Instant now = Instant.now(clock);
    return withStore("recoverStaleClaims", () -> repository.resetStaleInProgress(now));
  }

  @Override
  public long countPending() {
    return withStore("countPending", repository::countPending);
  }

  public String workerId() {
    return workerId;
  }

  private String serialize(EnqueueRequest request) {
    try {
      return objectMapper.writeValueAsString(request.payload());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException(
          "payload is not serializable type=" + request.notificationType(), ex);
    }
  }

  private <T> T withStore(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException ex) {
      if (isTransient(ex)) {
        throw new TransientStoreException("notification store unavailable during " + operation, ex);
      }
      throw ex;
    }
  }

  @VisibleForTesting
  static boolean isTransient(DataAccessException ex) {
    return ex instanceof TransientDataAccessException
        || ex instanceof RecoverableDataAccessException
        || ex instanceof DataAccessResourceFailureException;
  }

  @VisibleForTesting
  /** Host name plus a random suffix; instances on one host must not share a claim owner. */
  static String newWorkerId() {
    return resolveHostname() + ":" + UUID.randomUUID();
  }

  private static String resolveHostname() {
    String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
