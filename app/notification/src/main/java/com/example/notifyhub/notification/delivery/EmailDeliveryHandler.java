/*
 * Where: notification delivery, email channel
 * What: renders the job payload into a MIME message and hands it to the SMTP server
 * Why: SMTP acceptance is the success signal; mailbox processing is out of our reach
 */
package com.example.notifyhub.notification.delivery;

import com.example.notifyhub.notification.config.NotificationMailProperties;
import com.example.notifyhub.notification.model.DeliveryFailure;
import com.example.notifyhub.notification.model.DeliveryResult;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.model.NotificationJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailDeliveryHandler implements DeliveryHandler {

  static final String KEY_TO = "to";
  static final String KEY_SUBJECT = "subject";
  static final String KEY_BODY_TEXT = "body_text";
  static final String KEY_BODY_HTML = "body_html";

  private static final Logger logger = LoggerFactory.getLogger(EmailDeliveryHandler.class);

  private final JavaMailSender mailSender;
  private final RecipientDirectory recipientDirectory;
  private final NotificationMailProperties mailProperties;
  private final ObjectMapper objectMapper;

  @Override
  public Set<NotificationChannel> channels() {
    return Set.of(NotificationChannel.EMAIL);
  }

  @Override
  public DeliveryResult deliver(NotificationJob job) {
    final JsonNode payload;
    try {
      payload = objectMapper.readTree(job.payloadJson());
    } catch (JsonProcessingException ex) {
      return DeliveryResult.failed(DeliveryFailure.INVALID_PAYLOAD, "payload is not valid json");
    }
    if (payload == null || !payload.isObject()) {
      return DeliveryResult.failed(DeliveryFailure.INVALID_PAYLOAD, "payload must be an object");
    }

    final Optional<String> address;
    try {
      address = resolveAddress(job, payload);
    } catch (AccountDirectoryException ex) {
      if (ex.reason() == AccountDirectoryException.Reason.NOT_FOUND) {
        return DeliveryResult.failed(DeliveryFailure.RECIPIENT_UNKNOWN, ex.getMessage());
      }
      return DeliveryResult.failed(DeliveryFailure.TRANSPORT, ex.getMessage());
    }
    if (address.isEmpty()) {
      return DeliveryResult.failed(DeliveryFailure.RECIPIENT_UNKNOWN, "no email address on file");
    }

    try {
      final MimeMessage mimeMessage = mailSender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(mimeMessage, true, StandardCharsets.UTF_8.name());
      populateMessage(helper, address.get(), payload);
      mailSender.send(mimeMessage);
      logger.info(
          "notification email accepted id={} type={}", job.jobId(), job.notificationType());
      return DeliveryResult.sent();
    } catch (MailException | MessagingException | UnsupportedEncodingException ex) {
      logger.warn("notification email transport failed id={}: {}", job.jobId(), ex.getMessage());
      return DeliveryResult.failed(DeliveryFailure.TRANSPORT, ex.getMessage());
    }
  }

  private Optional<String> resolveAddress(NotificationJob job, JsonNode payload) {
    // an explicit address wins, e.g. a welcome mail sent before the account is readable
    final String explicit = text(payload, KEY_TO);
    if (explicit != null) {
      return Optional.of(explicit);
    }
    return recipientDirectory.findEmailAddress(job.recipientId());
  }

  private void populateMessage(MimeMessageHelper helper, String to, JsonNode payload)
      throws MessagingException, UnsupportedEncodingException {
    if (mailProperties.fromName().isBlank()) {
      helper.setFrom(mailProperties.fromAddress());
    } else {
      helper.setFrom(mailProperties.fromAddress(), mailProperties.fromName());
    }
    helper.setTo(to);
    final String subject = text(payload, KEY_SUBJECT);
    helper.setSubject(subject == null ? mailProperties.defaultSubject() : subject);
    final String bodyText = text(payload, KEY_BODY_TEXT);
    final String bodyHtml = text(payload, KEY_BODY_HTML);
    if (bodyText != null && bodyHtml != null) {
      helper.setText(bodyText, bodyHtml);
    } else if (bodyHtml != null) {
      helper.setText(bodyHtml, true);
    } else {
      helper.setText(bodyText == null ? "" : bodyText, false);
    }
  }

  private static String text(JsonNode payload, String key) {
    final JsonNode node = payload.get(key);
    if (node == null || node.isNull()) {
      return null;
    }
    final String value = node.asText();
    return value.isBlank() ? null : value;
  }
}
