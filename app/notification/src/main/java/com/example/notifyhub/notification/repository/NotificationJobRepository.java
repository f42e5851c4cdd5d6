/*
 * Where: notification data access
 * What: inserts, claims, result updates and queries on notification_jobs
 * Why: every status transition is a single conditional statement so concurrent workers cannot collide
 */
package com.example.notifyhub.notification.repository;

import static com.example.notifyhub.common.JdbcTimestampUtils.toInstant;
import static com.example.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifyhub.notification.model.DeliveryFailure;
import com.example.notifyhub.notification.model.JobStatus;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.model.NotificationJob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationJobRepository {

  private static final String SELECT_COLUMNS =
      """
      job_id, recipient_id, channel, notification_type, payload_json::text AS payload_json_text,
      status, locked_by, locked_at, lease_until, attempt_count, max_attempts, next_retry_at,
      last_error, failure_reason, idempotency_key, created_at, updated_at, sent_at, read_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Returns 0 when a job with the same idempotency key and channel already exists. */
  public int insert(NotificationJob job) {
    final String sql =
        """
        INSERT INTO notification_jobs (
          job_id,
          recipient_id,
          channel,
          notification_type,
          payload_json,
          status,
          locked_by,
          locked_at,
          lease_until,
          attempt_count,
          max_attempts,
          next_retry_at,
          last_error,
          failure_reason,
          idempotency_key,
          created_at,
          updated_at,
          sent_at,
          read_at
        ) VALUES (
          :jobId,
          :recipientId,
          :channel,
          :notificationType,
          :payloadJson::jsonb,
          :status,
          :lockedBy,
          :lockedAt,
          :leaseUntil,
          :attemptCount,
          :maxAttempts,
          :nextRetryAt,
          :lastError,
          :failureReason,
          :idempotencyKey,
          :createdAt,
          :updatedAt,
          :sentAt,
          :readAt
        )
        ON CONFLICT (idempotency_key, channel) WHERE idempotency_key IS NOT NULL DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", job.jobId())
            .addValue("recipientId", job.recipientId())
            .addValue("channel", job.channel().name())
            .addValue("notificationType", job.notificationType())
            .addValue("payloadJson", job.payloadJson())
            .addValue("status", job.status().name())
            .addValue("lockedBy", job.lockedBy())
            .addValue("lockedAt", toTimestamp(job.lockedAt()))
            .addValue("leaseUntil", toTimestamp(job.leaseUntil()))
            .addValue("attemptCount", job.attemptCount())
            .addValue("maxAttempts", job.maxAttempts())
            .addValue("nextRetryAt", toTimestamp(job.nextRetryAt()))
            .addValue("lastError", job.lastError())
            .addValue(
                "failureReason", job.failureReason() == null ? null : job.failureReason().name())
            .addValue("idempotencyKey", job.idempotencyKey())
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("updatedAt", toTimestamp(job.updatedAt()))
            .addValue("sentAt", toTimestamp(job.sentAt()))
            .addValue("readAt", toTimestamp(job.readAt()));
    return jdbcTemplate.update(sql, params);
  }

  /** Looks in live and archived jobs; archiving must not make a used key reusable. */
  public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey, NotificationChannel channel) {
    final String sql =
        """
        SELECT job_id, 0 AS source
        FROM notification_jobs
        WHERE idempotency_key = :idempotencyKey
          AND channel = :channel
        UNION ALL
        SELECT job_id, 1 AS source
        FROM notification_jobs_archive
        WHERE idempotency_key = :idempotencyKey
          AND channel = :channel
        ORDER BY source
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("idempotencyKey", idempotencyKey)
            .addValue("channel", channel.name());
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("job_id")))
        .stream()
        .findFirst();
  }

  public Optional<NotificationJob> findById(UUID jobId) {
    final String sql = "SELECT " + SELECT_COLUMNS + " FROM notification_jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationJob> findByRecipientId(String recipientId) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM notification_jobs
            WHERE recipient_id = :recipientId
            ORDER BY created_at DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationJob> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // SKIP LOCKED lets concurrent claimers take disjoint rows; the status guard makes the claim win only once
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM notification_jobs
          WHERE status = 'PENDING'
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_jobs j
        SET status = 'IN_PROGRESS',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE j.job_id = cte.job_id
          AND j.status = 'PENDING'
        RETURNING j.job_id, j.recipient_id, j.channel, j.notification_type,
                  j.payload_json::text AS payload_json_text, j.status,
                  j.locked_by, j.locked_at, j.lease_until, j.attempt_count, j.max_attempts,
                  j.next_retry_at, j.last_error, j.failure_reason, j.idempotency_key,
                  j.created_at, j.updated_at, j.sent_at, j.read_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    // RETURNING order is unspecified; restore FIFO for the caller
    return jdbcTemplate.query(sql, params, this::mapRow).stream()
        .sorted(Comparator.comparing(NotificationJob::createdAt))
        .toList();
  }

  public int markSent(UUID jobId, int attemptCount, Instant sentAt, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'SENT',
            attempt_count = :attemptCount,
            sent_at = :sentAt,
            updated_at = :sentAt,
            next_retry_at = NULL,
            last_error = NULL,
            failure_reason = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'IN_PROGRESS'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailure(
      UUID jobId,
      int attemptCount,
      boolean terminal,
      Instant nextRetryAt,
      String lastError,
      DeliveryFailure failureReason,
      Instant now,
      String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            failure_reason = :failureReason,
            updated_at = :now,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'IN_PROGRESS'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", terminal ? JobStatus.FAILED.name() : JobStatus.PENDING.name())
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", terminal ? null : toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("failureReason", failureReason.name())
            .addValue("now", toTimestamp(now))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int resetStaleInProgress(Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'PENDING',
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            next_retry_at = NULL,
            updated_at = :now
        WHERE status = 'IN_PROGRESS'
          AND (lease_until IS NULL OR lease_until <= :now)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<NotificationJob> findUnreadOfflineInApp(String recipientId, Instant since, int limit) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM notification_jobs
            WHERE recipient_id = :recipientId
              AND channel = 'IN_APP'
              AND status = 'FAILED'
              AND failure_reason = 'OFFLINE'
              AND read_at IS NULL
              AND created_at >= :since
            ORDER BY created_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("since", toTimestamp(since))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markRead(UUID jobId, Instant readAt) {
    final String sql =
        """
        UPDATE notification_jobs
        SET read_at = :readAt
        WHERE job_id = :jobId
          AND read_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("readAt", toTimestamp(readAt))
            .addValue("jobId", jobId);
    return jdbcTemplate.update(sql, params);
  }

  public long countPending() {
    final String sql = "SELECT COUNT(*) FROM notification_jobs WHERE status = 'PENDING'";
    final Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  public int archiveTerminalOlderThan(Instant threshold, Instant archivedAt) {
    // moved rows leave notification_jobs and land in the archive within one statement
    final String sql =
        """
        WITH moved AS (
          DELETE FROM notification_jobs
          WHERE created_at < :threshold
            AND status IN ('SENT', 'FAILED')
          RETURNING *
        )
        INSERT INTO notification_jobs_archive (
          job_id, recipient_id, channel, notification_type, payload_json, status,
          attempt_count, max_attempts, last_error, failure_reason, idempotency_key,
          created_at, updated_at, sent_at, read_at, archived_at
        )
        SELECT job_id, recipient_id, channel, notification_type, payload_json, status,
               attempt_count, max_attempts, last_error, failure_reason, idempotency_key,
               created_at, updated_at, sent_at, read_at, :archivedAt
        FROM moved
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("archivedAt", toTimestamp(archivedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_jobs
        WHERE created_at < :threshold
          AND status IN ('PENDING', 'IN_PROGRESS')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String failureReason = rs.getString("failure_reason");
    return new NotificationJob(
        UUID.fromString(rs.getString("job_id")),
        rs.getString("recipient_id"),
        NotificationChannel.valueOf(rs.getString("channel")),
        rs.getString("notification_type"),
        rs.getString("payload_json_text"),
        JobStatus.valueOf(rs.getString("status")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getInt("attempt_count"),
        rs.getInt("max_attempts"),
        toInstant(rs.getTimestamp("next_retry_at")),
        rs.getString("last_error"),
        failureReason == null ? null : DeliveryFailure.valueOf(failureReason),
        rs.getString("idempotency_key"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("read_at")));
  }
}
