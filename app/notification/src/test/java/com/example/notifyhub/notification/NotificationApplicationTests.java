/*
 * Where: notification application smoke test
 * What: starts the full Spring context against PostgreSQL
 * Why: catches broken wiring between handlers, backend, worker and the WebSocket endpoint
 */
package com.example.notifyhub.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.notifyhub.notification.backend.NotificationBackend;
import com.example.notifyhub.notification.delivery.DeliveryHandlerRegistry;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.service.NotificationWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;
  @Autowired private DeliveryHandlerRegistry handlerRegistry;
  @Autowired private NotificationBackend backend;

  @Test
  void contextLoads() {
    assertThat(handlerRegistry.find(NotificationChannel.EMAIL)).isPresent();
    assertThat(handlerRegistry.find(NotificationChannel.IN_APP)).isPresent();
    assertThat(backend.countPending()).isGreaterThanOrEqualTo(0);
  }

  @Test
  void workerIsNotCreatedWhenDisabled() {
    assertThat(context.getBeanNamesForType(NotificationWorker.class)).isEmpty();
  }
}
