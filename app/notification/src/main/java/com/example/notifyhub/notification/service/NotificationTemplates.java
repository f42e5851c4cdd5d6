/*
 * Where: notification service layer
 * What: renders a domain event into the per-channel notifications it produces
 * Why: the event-to-content mapping lives in one place, apart from preference and queue logic
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.model.EnqueueRequest;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.model.NotificationEvent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
@RequiredArgsConstructor
public class NotificationTemplates {

  static final String TYPE_WELCOME_EMAIL = "welcome_email";
  static final String TYPE_WELCOME_IN_APP = "welcome_in_app";
  static final String TYPE_ARTICLE_PUBLISHED = "article_published";
  static final String TYPE_EMAIL_VERIFIED = "email_verified";

  private final EmailVerificationTokenService verificationTokenService;

  public List<EnqueueRequest> render(NotificationEvent event) {
    if (event == null || event.type() == null) {
      throw new InvalidNotificationEventException("event type is required");
    }
    if (event.recipientId() == null || event.recipientId().isBlank()) {
      throw new InvalidNotificationEventException("recipientId is required");
    }
    return switch (event.type()) {
      case USER_REGISTERED -> userRegistered(event);
      case ARTICLE_PUBLISHED -> articlePublished(event);
      case EMAIL_VERIFIED -> emailVerified(event);
    };
  }

  private List<EnqueueRequest> userRegistered(NotificationEvent event) {
    final String email = required(event, "email");
    final String link = verificationTokenService.verificationUrl(event.recipientId(), email);
    final String safeEmail = HtmlUtils.htmlEscape(email);
    final String safeLink = HtmlUtils.htmlEscape(link);

    final Map<String, Object> mail = new LinkedHashMap<>();
    mail.put("to", email);
    mail.put("subject", "Welcome! Please verify your email");
    mail.put(
        "body_text",
        "Hi "
            + email
            + ",\n\nWelcome aboard! Please verify your email by opening the link below:\n\n"
            + link
            + "\n\nThanks,\nThe Team");
    mail.put(
        "body_html",
        "<p>Hi <b>"
            + safeEmail
            + "</b>,</p><p>Welcome aboard! Please verify your email by clicking the link below:</p>"
            + "<p><a href=\""
            + safeLink
            + "\">Verify your email</a></p><p>Thanks,<br>The Team</p>");

    final Map<String, Object> inApp = new LinkedHashMap<>();
    inApp.put("title", "Welcome!");
    inApp.put("body", "Hi " + email + ", explore what's new.");

    return List.of(
        request(event, NotificationChannel.EMAIL, TYPE_WELCOME_EMAIL, mail),
        request(event, NotificationChannel.IN_APP, TYPE_WELCOME_IN_APP, inApp));
  }

  private List<EnqueueRequest> articlePublished(NotificationEvent event) {
    final String articleId = required(event, "article_id");
    final String title = required(event, "title");

    final Map<String, Object> inApp = new LinkedHashMap<>();
    inApp.put("title", "Your article was published");
    inApp.put("body", "\"" + title + "\" is now live.");
    inApp.put("article_id", articleId);

    final Map<String, Object> mail = new LinkedHashMap<>();
    mail.put("subject", "Your article \"" + title + "\" was published");
    mail.put("body_text", "Your article \"" + title + "\" is now live.\n\nArticle id: " + articleId);

    return List.of(
        request(event, NotificationChannel.IN_APP, TYPE_ARTICLE_PUBLISHED, inApp),
        request(event, NotificationChannel.EMAIL, TYPE_ARTICLE_PUBLISHED, mail));
  }

  private List<EnqueueRequest> emailVerified(NotificationEvent event) {
    final Map<String, Object> inApp = new LinkedHashMap<>();
    inApp.put("title", "Email verified");
    inApp.put("body", "Your email address has been verified.");
    return List.of(request(event, NotificationChannel.IN_APP, TYPE_EMAIL_VERIFIED, inApp));
  }

  private EnqueueRequest request(
      NotificationEvent event,
      NotificationChannel channel,
      String notificationType,
      Map<String, Object> payload) {
    // keys are scoped by notification type so one producer key can fan out to several jobs
    final String idempotencyKey =
        event.idempotencyKey() == null || event.idempotencyKey().isBlank()
            ? null
            : notificationType + ":" + event.idempotencyKey();
    return new EnqueueRequest(
        event.recipientId(), channel, notificationType, payload, idempotencyKey);
  }

  private String required(NotificationEvent event, String key) {
    final String value = event.contextString(key);
    if (value == null || value.isBlank()) {
      throw new InvalidNotificationEventException(
          event.type().value() + " event requires context key " + key);
    }
    return value;
  }
}
