/*
 * Where: Lab jobs data access
 * What: Reads and writes job_instances
 * Why: Every state change is a single guarded UPDATE so ticks and user actions can interleave
 */
package com.example.labjobs.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.labjobs.model.JobInstanceRecord;
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
public class JobInstanceRepository {

  private static final String COLUMNS =
      """
      job_instance_id, job_template_id, name, done, due_at, last_reminder_at,
      reminder_schedule_id, assignee, completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(
      Long templateId,
      String name,
      Instant dueAt,
      Instant lastReminderAt,
      Long reminderScheduleId,
      String assignee) {
    final String sql =
        """
        INSERT INTO job_instances (
          job_template_id,
          name,
          done,
          due_at,
          last_reminder_at,
          reminder_schedule_id,
          assignee
        ) VALUES (
          :templateId,
          :name,
          FALSE,
          :dueAt,
          :lastReminderAt,
          :reminderScheduleId,
          :assignee
        )
        RETURNING job_instance_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("templateId", templateId)
            .addValue("name", name)
            .addValue("dueAt", toTimestamp(dueAt))
            .addValue("lastReminderAt", toTimestamp(lastReminderAt))
            .addValue("reminderScheduleId", reminderScheduleId)
            .addValue("assignee", assignee);
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("job instance insert returned no id");
    }
    return id;
  }

  public Optional<JobInstanceRecord> findById(long instanceId) {
    final String sql = "SELECT " + COLUMNS + " FROM job_instances WHERE job_instance_id = :instanceId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("instanceId", instanceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Row-locks the instance for the rest of the surrounding transaction. */
  public Optional<JobInstanceRecord> findByIdForUpdate(long instanceId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM job_instances WHERE job_instance_id = :instanceId FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("instanceId", instanceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<JobInstanceRecord> findOpen() {
    final String sql =
        "SELECT " + COLUMNS + " FROM job_instances WHERE done = FALSE ORDER BY due_at, job_instance_id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<JobInstanceRecord> findOpenAssigned() {
    final String sql =
        """
        SELECT job_instance_id, job_template_id, name, done, due_at, last_reminder_at,
               reminder_schedule_id, assignee, completed_at
        FROM job_instances
        WHERE done = FALSE
          AND assignee IS NOT NULL
        ORDER BY due_at, job_instance_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public int advanceLastReminder(long instanceId, Instant remindedAt) {
    final String sql =
        """
        UPDATE job_instances
        SET last_reminder_at = :remindedAt
        WHERE job_instance_id = :instanceId
          AND done = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("remindedAt", toTimestamp(remindedAt))
            .addValue("instanceId", instanceId);
    return jdbcTemplate.update(sql, params);
  }

  /** Returns 0 when the instance is unknown or was already done. */
  public int markDone(long instanceId, Instant completedAt) {
    final String sql =
        """
        UPDATE job_instances
        SET done = TRUE,
            completed_at = :completedAt
        WHERE job_instance_id = :instanceId
          AND done = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("instanceId", instanceId);
    return jdbcTemplate.update(sql, params);
  }

  public int updateAssignee(long instanceId, String assignee) {
    final String sql =
        """
        UPDATE job_instances
        SET assignee = :assignee
        WHERE job_instance_id = :instanceId
          AND done = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("assignee", assignee)
            .addValue("instanceId", instanceId);
    return jdbcTemplate.update(sql, params);
  }

  private JobInstanceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobInstanceRecord(
        rs.getLong("job_instance_id"),
        rs.getObject("job_template_id", Long.class),
        rs.getString("name"),
        rs.getBoolean("done"),
        toInstant(rs.getTimestamp("due_at")),
        toInstant(rs.getTimestamp("last_reminder_at")),
        rs.getObject("reminder_schedule_id", Long.class),
        rs.getString("assignee"),
        toInstant(rs.getTimestamp("completed_at")));
  }
}
