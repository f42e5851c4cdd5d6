/*
 * Where: notification queue tests
 * What: DatabaseQueueBackend against PostgreSQL, including several workers claiming at once
 * Why: exclusivity of claims and idempotent result recording only hold with real row locks
 */
package com.example.notifyhub.notification.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.notifyhub.notification.AbstractPostgresContainerTest;
import com.example.notifyhub.notification.config.NotificationWorkerProperties;
import com.example.notifyhub.notification.model.DeliveryFailure;
import com.example.notifyhub.notification.model.DeliveryResult;
import com.example.notifyhub.notification.model.EnqueueRequest;
import com.example.notifyhub.notification.model.JobStatus;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.model.NotificationJob;
import com.example.notifyhub.notification.repository.NotificationJobRepository;
import com.example.notifyhub.notification.support.MutableClock;
import com.example.notifyhub.notification.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DatabaseQueueBackendTest extends AbstractPostgresContainerTest {

  @Autowired private NotificationJobRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private ObjectMapper objectMapper;

  private final NotificationWorkerProperties properties = TestProperties.worker();
  private final RetryPolicy retryPolicy = new RetryPolicy(properties, () -> 0.5d);
  private MutableClock clock;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM notification_jobs", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notification_jobs_archive", new MapSqlParameterSource());
    clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
  }

  @Test
  void enqueueThenFetchClaimsTheJob() {
    final DatabaseQueueBackend backend = backend("worker-a");
    final UUID jobId = backend.enqueue(emailRequest("user-1", null));

    final List<NotificationJob> batch = backend.fetchBatch(10);

    assertThat(batch).extracting(NotificationJob::jobId).containsExactly(jobId);
    assertThat(batch.get(0).status()).isEqualTo(JobStatus.IN_PROGRESS);
    assertThat(batch.get(0).lockedBy()).isEqualTo("worker-a");
    assertThat(batch.get(0).maxAttempts()).isEqualTo(3);
    assertThat(backend.fetchBatch(10)).isEmpty();
  }

  @Test
  void inAppJobsGetTheShorterAttemptCeiling() {
    final DatabaseQueueBackend backend = backend("worker-a");
    final UUID jobId =
        backend.enqueue(
            new EnqueueRequest(
                "user-1", NotificationChannel.IN_APP, "welcome_in_app", Map.of("title", "hi"), null));

    assertThat(repository.findById(jobId).orElseThrow().maxAttempts()).isEqualTo(2);
  }

  @Test
  void fetchWithNonPositiveLimitClaimsNothing() {
    final DatabaseQueueBackend backend = backend("worker-a");
    backend.enqueue(emailRequest("user-1", null));

    assertThat(backend.fetchBatch(0)).isEmpty();
    assertThat(backend.countPending()).isEqualTo(1);
  }

  @Test
  void enqueueWithSameIdempotencyKeyReturnsExistingJob() {
    final DatabaseQueueBackend backend = backend("worker-a");

    final UUID first = backend.enqueue(emailRequest("user-1", "welcome_email:u1"));
    final UUID second = backend.enqueue(emailRequest("user-1", "welcome_email:u1"));

    assertThat(second).isEqualTo(first);
    assertThat(backend.countPending()).isEqualTo(1);
  }

  @Test
  void enqueueAfterArchivalReturnsArchivedJob() {
    final DatabaseQueueBackend backend = backend("worker-a");
    final UUID first = backend.enqueue(emailRequest("user-1", "welcome_email:u1"));
    final NotificationJob job = backend.fetchBatch(1).get(0);
    assertThat(backend.markResult(job, DeliveryResult.sent())).contains(JobStatus.SENT);
    final Instant later = clock.instant().plus(Duration.ofDays(31));
    assertThat(repository.archiveTerminalOlderThan(later, later)).isEqualTo(1);

    final UUID repeat = backend.enqueue(emailRequest("user-1", "welcome_email:u1"));

    assertThat(repeat).isEqualTo(first);
    assertThat(backend.countPending()).isZero();
  }

  @Test
  void concurrentWorkersNeverClaimTheSameJob() throws Exception {
    final DatabaseQueueBackend producer = backend("producer");
    final Set<UUID> enqueued = new HashSet<>();
    for (int i = 0; i < 60; i++) {
      enqueued.add(producer.enqueue(emailRequest("user-" + i, null)));
      clock.advance(Duration.ofMillis(1));
    }

    final ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      final List<Future<List<UUID>>> futures = new ArrayList<>();
      for (int w = 0; w < 4; w++) {
        final DatabaseQueueBackend worker = backend("worker-" + w);
        final Callable<List<UUID>> drain =
            () -> {
              final List<UUID> claimed = new ArrayList<>();
              List<NotificationJob> batch;
              while (!(batch = worker.fetchBatch(7)).isEmpty()) {
                batch.forEach(job -> claimed.add(job.jobId()));
              }
              return claimed;
            };
        futures.add(pool.submit(drain));
      }
      final List<UUID> all = new ArrayList<>();
      for (Future<List<UUID>> future : futures) {
        all.addAll(future.get());
      }
      assertThat(all).doesNotHaveDuplicates();
      assertThat(all).containsExactlyInAnyOrderElementsOf(enqueued);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void deliveredResultIsRecordedOnce() {
    final DatabaseQueueBackend backend = backend("worker-a");
    backend.enqueue(emailRequest("user-1", null));
    final NotificationJob job = backend.fetchBatch(1).get(0);

    assertThat(backend.markResult(job, DeliveryResult.sent())).contains(JobStatus.SENT);
    assertThat(backend.markResult(job, DeliveryResult.sent())).isEmpty();
    assertThat(
            backend.markResult(job, DeliveryResult.failed(DeliveryFailure.TRANSPORT, "late")))
        .isEmpty();

    final NotificationJob stored = repository.findById(job.jobId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.SENT);
    assertThat(stored.attemptCount()).isEqualTo(1);
    assertThat(stored.sentAt()).isEqualTo(clock.instant());
  }

  @Test
  void retryableFailureIsRetriedAfterBackoffUntilAttemptsRunOut() {
    final DatabaseQueueBackend backend = backend("worker-a");
    final UUID jobId = backend.enqueue(emailRequest("user-1", null));
    final DeliveryResult refused = DeliveryResult.failed(DeliveryFailure.TRANSPORT, "refused");

    NotificationJob job = backend.fetchBatch(1).get(0);
    assertThat(backend.markResult(job, refused)).contains(JobStatus.PENDING);
    NotificationJob stored = repository.findById(jobId).orElseThrow();
    assertThat(stored.attemptCount()).isEqualTo(1);
    assertThat(stored.nextRetryAt()).isEqualTo(clock.instant().plusSeconds(30));
    assertThat(stored.lastError()).isEqualTo("transport: refused");
    assertThat(backend.fetchBatch(1)).isEmpty();

    clock.advance(Duration.ofSeconds(30));
    job = backend.fetchBatch(1).get(0);
    assertThat(backend.markResult(job, refused)).contains(JobStatus.PENDING);
    assertThat(repository.findById(jobId).orElseThrow().nextRetryAt())
        .isEqualTo(clock.instant().plusSeconds(60));

    clock.advance(Duration.ofSeconds(60));
    job = backend.fetchBatch(1).get(0);
    assertThat(backend.markResult(job, refused)).contains(JobStatus.FAILED);

    stored = repository.findById(jobId).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.FAILED);
    assertThat(stored.attemptCount()).isEqualTo(3);
    assertThat(stored.nextRetryAt()).isNull();
    assertThat(stored.failureReason()).isEqualTo(DeliveryFailure.TRANSPORT);
  }

  @Test
  void terminalFailureIsNotRetried() {
    final DatabaseQueueBackend backend = backend("worker-a");
    final UUID jobId = backend.enqueue(emailRequest("user-1", null));
    final NotificationJob job = backend.fetchBatch(1).get(0);

    assertThat(
            backend.markResult(
                job, DeliveryResult.failed(DeliveryFailure.RECIPIENT_UNKNOWN, "no address")))
        .contains(JobStatus.FAILED);

    clock.advance(Duration.ofHours(1));
    assertThat(backend.fetchBatch(10)).isEmpty();
    assertThat(repository.findById(jobId).orElseThrow().attemptCount()).isEqualTo(1);
  }

  @Test
  void staleClaimIsRecoveredAndLateResultFromOldClaimIsRejected() {
    final DatabaseQueueBackend crashed = backend("worker-a");
    final DatabaseQueueBackend survivor = backend("worker-b");
    final UUID jobId = crashed.enqueue(emailRequest("user-1", null));
    final NotificationJob lost = crashed.fetchBatch(1).get(0);

    assertThat(survivor.recoverStaleClaims()).isZero();
    clock.advance(properties.staleAfter());
    assertThat(survivor.recoverStaleClaims()).isEqualTo(1);

    final NotificationJob reclaimed = survivor.fetchBatch(1).get(0);
    assertThat(reclaimed.jobId()).isEqualTo(jobId);
    assertThat(reclaimed.attemptCount()).isZero();

    assertThat(crashed.markResult(lost, DeliveryResult.sent())).isEmpty();
    assertThat(survivor.markResult(reclaimed, DeliveryResult.sent())).contains(JobStatus.SENT);
  }

  private DatabaseQueueBackend backend(String workerId) {
    return new DatabaseQueueBackend(
        repository, retryPolicy, properties, objectMapper, clock, workerId);
  }

  private static EnqueueRequest emailRequest(String recipientId, String idempotencyKey) {
    return new EnqueueRequest(
        recipientId,
        NotificationChannel.EMAIL,
        "welcome_email",
        Map.of("to", recipientId + "@example.com", "subject", "Welcome"),
        idempotencyKey);
  }
}
