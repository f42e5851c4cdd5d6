/*
 * Where: real-time gateway
 * What: builds the JSON frames pushed to clients for live and replayed notifications
 * Why: both paths must produce the same envelope apart from the type field
 */
package com.example.notifyhub.notification.realtime;

import com.example.notifyhub.notification.model.NotificationJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RealtimeMessageWriter {

  static final String TYPE_NOTIFICATION = "notification";
  static final String TYPE_MISSED = "notification_missed";

  private final ObjectMapper objectMapper;

  public String notification(NotificationJob job) throws JsonProcessingException {
    return write(TYPE_NOTIFICATION, job);
  }

  public String missed(NotificationJob job) throws JsonProcessingException {
    return write(TYPE_MISSED, job);
  }

  private String write(String type, NotificationJob job) throws JsonProcessingException {
    final JsonNode data =
        job.payloadJson() == null
            ? objectMapper.createObjectNode()
            : objectMapper.readTree(job.payloadJson());
    final ObjectNode message = objectMapper.createObjectNode();
    message.put("type", type);
    message.put("job_id", job.jobId().toString());
    message.put("notification_type", job.notificationType());
    message.set("data", data);
    if (job.createdAt() != null) {
      message.put("created_at", job.createdAt().toString());
    }
    return objectMapper.writeValueAsString(message);
  }
}
