/*
 * Where: notification queue abstraction
 * What: enqueue, claim and result recording for notification jobs
 * Why: the worker depends on this contract only, so the storage technology can change
 */
package com.example.notifyhub.notification.backend;

import com.example.notifyhub.notification.model.DeliveryResult;
import com.example.notifyhub.notification.model.EnqueueRequest;
import com.example.notifyhub.notification.model.JobStatus;
import com.example.notifyhub.notification.model.NotificationJob;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable queue of notification jobs.
 *
 * <p>Implementations must be safe for concurrent producers and for several worker instances
 * claiming from the same store. Store failures that may succeed on retry are reported as {@link
 * TransientStoreException}.
 */
public interface NotificationBackend {

  /**
   * Persists a new {@code PENDING} job.
   *
   * @return the new job id, or the id of the existing job when the request carries an
   *     idempotency key that was already enqueued for the same channel
   */
  UUID enqueue(EnqueueRequest request);

  /**
   * Atomically claims up to {@code maxJobs} due {@code PENDING} jobs, moving them to {@code
   * IN_PROGRESS}. Never blocks waiting for work; returns an empty list when nothing is due.
   */
  List<NotificationJob> fetchBatch(int maxJobs);

  /**
   * Records the outcome of one claimed job. A retryable failure with attempts left returns the
   * job to {@code PENDING}; anything else is terminal.
   *
   * @return the status the job moved to, or empty when this worker no longer holds the claim
   *     (the result was already recorded, or the claim was recovered as stale)
   */
  Optional<JobStatus> markResult(NotificationJob job, DeliveryResult result);

  /** Returns {@code IN_PROGRESS} jobs whose lease expired to {@code PENDING}. */
  int recoverStaleClaims();

  long countPending();
}
