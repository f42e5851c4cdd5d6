/*
 * Where: notification debug API
 * What: lists every job of one user with its delivery state
 * Why: lets developers see why a notification did or did not arrive
 */
package com.example.notifyhub.notification.api;

import com.example.notifyhub.notification.model.NotificationJob;
import com.example.notifyhub.notification.repository.NotificationJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationDebugController {

    private final NotificationJobRepository notificationJobRepository;
    private final ObjectMapper objectMapper;

    @GetMapping("/inbox/{userId}")
    public NotificationInboxResponse inbox(@PathVariable("userId") String userId) {
        List<NotificationSummary> items = notificationJobRepository.findByRecipientId(userId).stream()
                .map(this::toSummary)
                .toList();
        return new NotificationInboxResponse(userId, items);
    }

    private NotificationSummary toSummary(NotificationJob job) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(job.payloadJson());
        } catch (JsonProcessingException ex) {
            // show the row even when its payload is broken
            payload = objectMapper.getNodeFactory().textNode(job.payloadJson());
        }
        return new NotificationSummary(
                job.jobId(),
                job.channel().value(),
                job.notificationType(),
                job.status(),
                job.attemptCount(),
                job.failureReason() == null ? null : job.failureReason().value(),
                job.lastError(),
                job.createdAt(),
                job.sentAt(),
                job.readAt(),
                payload);
    }
}
