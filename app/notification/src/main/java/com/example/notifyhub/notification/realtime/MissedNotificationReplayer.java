/*
 * Where: real-time gateway
 * What: pushes in-app jobs that failed while the user was offline to a fresh connection
 * Why: each missed job is replayed once; read_at marks it so later connections skip it
 */
package com.example.notifyhub.notification.realtime;

import com.example.notifyhub.notification.config.NotificationRealtimeProperties;
import com.example.notifyhub.notification.model.NotificationJob;
import com.example.notifyhub.notification.repository.NotificationJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MissedNotificationReplayer {

  private static final Logger logger = LoggerFactory.getLogger(MissedNotificationReplayer.class);

  private final NotificationJobRepository repository;
  private final RealtimeMessageWriter messageWriter;
  private final NotificationRealtimeProperties properties;
  private final Clock clock;

  /** @return number of jobs replayed to {@code handle} */
  public int replay(String userId, ConnectionHandle handle) {
    if (!properties.replayMissed()) {
      return 0;
    }
    final Instant now = Instant.now(clock);
    final List<NotificationJob> missed;
    try {
      missed =
          repository.findUnreadOfflineInApp(
              userId, now.minus(properties.replayWindow()), properties.replayLimit());
    } catch (DataAccessException ex) {
      // the connection stays usable for live pushes
      logger.warn("missed notification lookup failed userId={}", userId, ex);
      return 0;
    }
    int replayed = 0;
    for (NotificationJob job : missed) {
      try {
        handle.send(messageWriter.missed(job));
      } catch (JsonProcessingException ex) {
        logger.warn("missed notification payload unreadable; skipping id={}", job.jobId(), ex);
        if (!markRead(job, now)) {
          break;
        }
        continue;
      } catch (IOException ex) {
        logger.warn(
            "missed notification replay interrupted userId={} replayed={}", userId, replayed, ex);
        break;
      }
      replayed++;
      if (!markRead(job, now)) {
        break;
      }
    }
    if (replayed > 0) {
      logger.info("missed notifications replayed userId={} count={}", userId, replayed);
    }
    return replayed;
  }

  private boolean markRead(NotificationJob job, Instant readAt) {
    try {
      repository.markRead(job.jobId(), readAt);
      return true;
    } catch (DataAccessException ex) {
      // an unmarked job is replayed again on the next connection
      logger.warn("missed notification not marked read; stopping replay id={}", job.jobId(), ex);
      return false;
    }
  }
}
