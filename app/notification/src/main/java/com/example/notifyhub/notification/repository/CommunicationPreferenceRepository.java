/*
 * Where: notification data access
 * What: reads and upserts rows of communication_preferences
 * Why: one row per (user, channel) is created lazily on the first change
 */
package com.example.notifyhub.notification.repository;

import static com.example.notifyhub.common.JdbcTimestampUtils.toInstant;
import static com.example.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifyhub.notification.model.CommunicationPreference;
import com.example.notifyhub.notification.model.NotificationChannel;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CommunicationPreferenceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Boolean> findEnabled(String userId, NotificationChannel channel) {
    final String sql =
        """
        SELECT enabled
        FROM communication_preferences
        WHERE user_id = :userId
          AND channel = :channel
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("channel", channel.name());
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getBoolean("enabled")).stream()
        .findFirst();
  }

  public List<CommunicationPreference> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, channel, enabled, created_at, updated_at
        FROM communication_preferences
        WHERE user_id = :userId
        ORDER BY channel
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public void upsert(String userId, NotificationChannel channel, boolean enabled, Instant now) {
    final String sql =
        """
        INSERT INTO communication_preferences (user_id, channel, enabled, created_at, updated_at)
        VALUES (:userId, :channel, :enabled, :now, :now)
        ON CONFLICT (user_id, channel)
        DO UPDATE SET enabled = EXCLUDED.enabled,
                      updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("channel", channel.name())
            .addValue("enabled", enabled)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  private CommunicationPreference mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CommunicationPreference(
        rs.getString("user_id"),
        NotificationChannel.valueOf(rs.getString("channel")),
        rs.getBoolean("enabled"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
