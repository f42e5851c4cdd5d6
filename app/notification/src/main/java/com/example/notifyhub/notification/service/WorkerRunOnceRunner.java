/*
 * Where: notification delivery worker, one-shot mode
 * What: recovers stale claims, processes a single batch and shuts the application down
 * Why: operators drain a backlog by hand or from a cron job without a resident worker
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.backend.NotificationBackend;
import com.example.notifyhub.notification.backend.TransientStoreException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.worker.run-once", havingValue = "true")
public class WorkerRunOnceRunner implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(WorkerRunOnceRunner.class);

  private final NotificationBackend backend;
  private final NotificationDispatchService dispatchService;
  private final ConfigurableApplicationContext applicationContext;

  @Override
  public void run(ApplicationArguments args) {
    int exitCode = 0;
    try {
      final int recovered = backend.recoverStaleClaims();
      final DispatchReport report = dispatchService.processBatch();
      logger.info(
          "notification run-once finished recovered={} claimed={} outcomes={}",
          recovered,
          report.claimed(),
          report.outcomes());
    } catch (TransientStoreException ex) {
      logger.error("notification run-once aborted: store unavailable", ex);
      exitCode = 1;
    }
    final int code = exitCode;
    System.exit(SpringApplication.exit(applicationContext, () -> code));
  }
}
