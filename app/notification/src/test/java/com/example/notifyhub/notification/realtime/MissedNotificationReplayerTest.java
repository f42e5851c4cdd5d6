package com.example.notifyhub.notification.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.notifyhub.notification.config.NotificationRealtimeProperties;
import com.example.notifyhub.notification.model.NotificationChannel;
import com.example.notifyhub.notification.model.NotificationJob;
import com.example.notifyhub.notification.repository.NotificationJobRepository;
import com.example.notifyhub.notification.support.RecordingConnectionHandle;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class MissedNotificationReplayerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");

  @Mock private NotificationJobRepository repository;

  @Test
  void replaysMissedJobsOnceAndMarksThemRead() {
    final NotificationJob first = job("{\"title\":\"a\"}");
    final NotificationJob second = job("{\"title\":\"b\"}");
    when(repository.findUnreadOfflineInApp("user-1", NOW.minus(Duration.ofHours(24)), 50))
        .thenReturn(List.of(first, second));
    final RecordingConnectionHandle handle = new RecordingConnectionHandle("c-1");

    final int replayed = replayer(true).replay("user-1", handle);

    assertThat(replayed).isEqualTo(2);
    assertThat(handle.sent()).hasSize(2);
    assertThat(handle.sent().get(0)).contains("\"type\":\"notification_missed\"");
    verify(repository).markRead(first.jobId(), NOW);
    verify(repository).markRead(second.jobId(), NOW);
  }

  @Test
  void unreadablePayloadIsSkippedAndMarkedRead() {
    final NotificationJob broken = job("{oops");
    final NotificationJob fine = job("{}");
    when(repository.findUnreadOfflineInApp(eq("user-1"), any(), anyInt()))
        .thenReturn(List.of(broken, fine));
    final RecordingConnectionHandle handle = new RecordingConnectionHandle("c-1");

    assertThat(replayer(true).replay("user-1", handle)).isEqualTo(1);
    verify(repository).markRead(broken.jobId(), NOW);
    verify(repository).markRead(fine.jobId(), NOW);
  }

  @Test
  void sendFailureStopsReplayWithoutMarkingRead() {
    final NotificationJob pending = job("{}");
    when(repository.findUnreadOfflineInApp(eq("user-1"), any(), anyInt()))
        .thenReturn(List.of(pending));
    final RecordingConnectionHandle handle = new RecordingConnectionHandle("c-1");
    handle.failOnSend();

    assertThat(replayer(true).replay("user-1", handle)).isZero();
    verify(repository, never()).markRead(any(), any());
  }

  @Test
  void lookupFailureKeepsConnectionUsable() {
    when(repository.findUnreadOfflineInApp(eq("user-1"), any(), anyInt()))
        .thenThrow(new QueryTimeoutException("slow"));

    assertThat(replayer(true).replay("user-1", new RecordingConnectionHandle("c-1"))).isZero();
  }

  @Test
  void markReadFailureStopsReplayWithoutClosingTheConnection() {
    final NotificationJob first = job("{\"text\":\"one\"}");
    final NotificationJob second = job("{\"text\":\"two\"}");
    when(repository.findUnreadOfflineInApp(eq("user-1"), any(), anyInt()))
        .thenReturn(List.of(first, second));
    doThrow(new QueryTimeoutException("slow")).when(repository).markRead(first.jobId(), NOW);
    final RecordingConnectionHandle handle = new RecordingConnectionHandle("c-1");

    assertThat(replayer(true).replay("user-1", handle)).isEqualTo(1);
    assertThat(handle.sent()).hasSize(1);
    assertThat(handle.closed()).isFalse();
    verify(repository, never()).markRead(second.jobId(), NOW);
  }

  @Test
  void disabledReplayDoesNotQuery() {
    assertThat(replayer(false).replay("user-1", new RecordingConnectionHandle("c-1"))).isZero();
    verifyNoInteractions(repository);
  }

  private MissedNotificationReplayer replayer(boolean replayMissed) {
    return new MissedNotificationReplayer(
        repository,
        new RealtimeMessageWriter(new ObjectMapper()),
        new NotificationRealtimeProperties(
            true, null, null, null, replayMissed, Duration.ofHours(24), 50, null, 0),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static NotificationJob job(String payloadJson) {
    return NotificationJob.newPending(
        UUID.randomUUID(),
        "user-1",
        NotificationChannel.IN_APP,
        "article_published",
        payloadJson,
        2,
        null,
        NOW.minus(Duration.ofHours(1)));
  }
}
