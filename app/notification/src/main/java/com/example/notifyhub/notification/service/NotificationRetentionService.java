package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.config.NotificationRetentionProperties;
import com.example.notifyhub.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves sent and failed jobs past the retention period into {@code notification_jobs_archive}.
 * Pending and in-progress jobs are never archived; old ones are reported instead, since a job
 * that is still active after the whole retention period points at a stuck worker.
 */
@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationJobRepository repository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  /** Returns the number of archived jobs. */
  public int archive() {
    final Instant now = clock.instant();
    final Instant threshold = properties.archiveThreshold(now);

    final int stuck = repository.countStaleActive(threshold);
    if (stuck > 0) {
      logger.error("active jobs older than retention count={} createdBefore={}", stuck, threshold);
    }

    final int archived = repository.archiveTerminalOlderThan(threshold, now);
    if (archived > 0) {
      logger.info("archived terminal jobs count={} createdBefore={}", archived, threshold);
    } else {
      logger.debug("nothing to archive createdBefore={}", threshold);
    }
    return archived;
  }
}
