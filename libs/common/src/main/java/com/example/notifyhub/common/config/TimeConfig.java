/*
 * Where: shared configuration
 * What: exposes a UTC Clock as a bean
 * Why: services and workers read time through an injectable clock
 */
package com.example.notifyhub.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
