/*
 * Where: Lab jobs data access
 * What: Appends and finalizes reminder_messages rows
 * Why: A stored handle is the only way to edit a sent chat message later
 */
package com.example.labjobs.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.labjobs.model.ReminderMessageRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReminderMessageRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(long instanceId, String channel, String messageId, Instant sentAt) {
    final String sql =
        """
        INSERT INTO reminder_messages (job_instance_id, channel, message_id, sent_at)
        VALUES (:instanceId, :channel, :messageId, :sentAt)
        RETURNING reminder_message_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("instanceId", instanceId)
            .addValue("channel", channel)
            .addValue("messageId", messageId)
            .addValue("sentAt", toTimestamp(sentAt));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("reminder message insert returned no id");
    }
    return id;
  }

  public List<ReminderMessageRecord> findByInstanceId(long instanceId) {
    final String sql =
        """
        SELECT reminder_message_id, job_instance_id, channel, message_id, sent_at, finalized_at
        FROM reminder_messages
        WHERE job_instance_id = :instanceId
        ORDER BY sent_at, reminder_message_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("instanceId", instanceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByInstanceId(long instanceId) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM reminder_messages WHERE job_instance_id = :instanceId",
            new MapSqlParameterSource().addValue("instanceId", instanceId),
            Integer.class);
    return count == null ? 0 : count;
  }

  public int markFinalized(long messageRecordId, Instant finalizedAt) {
    final String sql =
        """
        UPDATE reminder_messages
        SET finalized_at = :finalizedAt
        WHERE reminder_message_id = :messageRecordId
          AND finalized_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("finalizedAt", toTimestamp(finalizedAt))
            .addValue("messageRecordId", messageRecordId);
    return jdbcTemplate.update(sql, params);
  }

  public int clearFinalized(long messageRecordId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("messageRecordId", messageRecordId);
    return jdbcTemplate.update(
        "UPDATE reminder_messages SET finalized_at = NULL WHERE reminder_message_id = :messageRecordId",
        params);
  }

  private ReminderMessageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ReminderMessageRecord(
        rs.getLong("reminder_message_id"),
        rs.getLong("job_instance_id"),
        rs.getString("channel"),
        rs.getString("message_id"),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("finalized_at")));
  }
}
