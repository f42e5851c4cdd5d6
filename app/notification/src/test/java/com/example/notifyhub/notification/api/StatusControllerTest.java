package com.example.notifyhub.notification.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.notifyhub.notification.config.NotificationRealtimeProperties;
import com.example.notifyhub.notification.config.NotificationWorkerProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(StatusController.class)
@Import(StatusControllerTest.PropertiesConfiguration.class)
@ActiveProfiles("test")
class StatusControllerTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void reportsEnabledComponents() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.service").value("notification"))
        .andExpect(jsonPath("$.worker_enabled").value(false))
        .andExpect(jsonPath("$.realtime_enabled").value(true));
  }

  @TestConfiguration
  @EnableConfigurationProperties({
    NotificationWorkerProperties.class,
    NotificationRealtimeProperties.class
  })
  static class PropertiesConfiguration {}
}
