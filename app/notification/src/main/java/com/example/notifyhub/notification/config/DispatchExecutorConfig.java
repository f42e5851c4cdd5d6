/*
 * Where: notification worker configuration
 * What: bounded thread pool that runs the jobs of one batch in parallel
 * Why: a slow SMTP or WebSocket write must not hold back the other jobs of the batch
 */
package com.example.notifyhub.notification.config;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchExecutorConfig {

  public static final String DISPATCH_EXECUTOR = "notificationDispatchExecutor";

  @Bean(name = DISPATCH_EXECUTOR)
  public ThreadPoolTaskExecutor notificationDispatchExecutor(NotificationWorkerProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.dispatchParallelism());
    executor.setMaxPoolSize(properties.dispatchParallelism());
    executor.setQueueCapacity(properties.batchSize());
    executor.setThreadNamePrefix("notification-dispatch-");
    // rejection must surface; a silently dropped task would leave its future incomplete
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(properties.drainTimeout().toMillis());
    // stopped after the worker lifecycle, which drains its last batch through this pool
    executor.setPhase(SmartLifecycle.DEFAULT_PHASE - 2048);
    return executor;
  }

  static final class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
      final Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        final Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          if (previous == null) {
            MDC.clear();
          } else {
            MDC.setContextMap(previous);
          }
        }
      };
    }
  }
}
