/*
 * Where: notification configuration binding
 * What: sender identity for outgoing notification emails
 * Why: the From header differs per environment
 */
package com.example.notifyhub.notification.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.mail")
@Validated
public record NotificationMailProperties(
    @NotBlank String fromAddress, String fromName, String defaultSubject) {

  public NotificationMailProperties {
    fromName = fromName == null ? "" : fromName;
    defaultSubject =
        defaultSubject == null || defaultSubject.isBlank() ? "No Subject" : defaultSubject;
  }
}
