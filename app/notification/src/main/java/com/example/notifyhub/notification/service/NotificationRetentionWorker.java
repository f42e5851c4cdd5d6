/*
 * Where: notification archival schedule
 * What: runs the retention sweep every cleanup-interval
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.common.TraceIds;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.retention.enabled", havingValue = "true")
public class NotificationRetentionWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionWorker.class);

  private final NotificationRetentionService retentionService;

  @Scheduled(
      initialDelayString = "${notification.retention.cleanup-interval}",
      fixedDelayString = "${notification.retention.cleanup-interval}")
  public void sweep() {
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    try {
      retentionService.archive();
    } catch (DataAccessException ex) {
      // the next sweep picks up the same rows
      logger.warn("retention sweep failed; retrying next interval", ex);
    } finally {
      MDC.remove(TraceIds.MDC_KEY);
    }
  }
}
