/*
 * Where: notification configuration binding
 * What: connection settings for the account service contact lookup
 * Why: the email handler resolves addresses from the account service, not from local tables
 */
package com.example.notifyhub.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.account-client")
public record AccountClientProperties(
    String baseUrl,
    String contactPath,
    String internalApiToken,
    String internalApiHeaderName,
    Duration connectTimeout,
    Duration readTimeout) {

  public AccountClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://account:80" : baseUrl;
    contactPath =
        contactPath == null || contactPath.isBlank() ? "/users/{userId}/contact" : contactPath;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
