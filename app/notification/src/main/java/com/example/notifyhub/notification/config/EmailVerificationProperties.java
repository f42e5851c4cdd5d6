/*
 * Where: notification configuration binding
 * What: signing secret, lifetime and link target of email verification tokens
 * Why: the secret must never be hard-coded and HS256 needs at least 256 bits of key
 */
package com.example.notifyhub.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.verification")
@Validated
public record EmailVerificationProperties(
    @NotBlank String secret,
    @NotNull Duration ttl,
    @NotBlank String baseUrl,
    @NotBlank String verifyPath) {

  private static final int MIN_SECRET_BYTES = 32;

  @AssertTrue(message = "notification.verification.secret must be at least 32 bytes")
  public boolean isSecretLongEnough() {
    return secret != null && secret.getBytes(StandardCharsets.UTF_8).length >= MIN_SECRET_BYTES;
  }
}
