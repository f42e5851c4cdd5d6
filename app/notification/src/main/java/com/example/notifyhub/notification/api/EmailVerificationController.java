/*
 * Where: notification API
 * What: target of the link in the welcome email; confirms the address and notifies the user
 * Why: the link is opened from a mail client, so the token is the only credential
 */
package com.example.notifyhub.notification.api;

import com.example.notifyhub.notification.model.NotificationEventType;
import com.example.notifyhub.notification.service.EmailVerificationTokenService;
import com.example.notifyhub.notification.service.EmailVerificationTokenService.VerifiedEmail;
import com.example.notifyhub.notification.service.NotificationProducer;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class EmailVerificationController {

  private static final Logger logger = LoggerFactory.getLogger(EmailVerificationController.class);

  private final EmailVerificationTokenService tokenService;
  private final NotificationProducer producer;

  @GetMapping("/v1/email-verifications")
  public EmailVerificationResponse verify(@RequestParam("token") String token) {
    final VerifiedEmail verified = tokenService.verify(token);
    // keyed by user so repeated clicks queue a single confirmation
    producer.notify(
        verified.userId(),
        NotificationEventType.EMAIL_VERIFIED,
        verified.email() == null ? Map.of() : Map.of("email", verified.email()),
        verified.userId());
    logger.info("email verified userId={}", verified.userId());
    return new EmailVerificationResponse(verified.userId(), "email successfully verified");
  }
}
