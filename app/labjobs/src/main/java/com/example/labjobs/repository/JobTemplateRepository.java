/*
 * Where: Lab jobs data access
 * What: Reads and writes job_templates, including the materialization watermark
 * Why: The watermark guard here is what keeps materialization idempotent across ticks
 */
package com.example.labjobs.repository;

import static com.example.common.JdbcTimestampUtils.toLocalDate;
import static com.example.common.JdbcTimestampUtils.toSqlDate;

import com.example.labjobs.model.JobTemplateRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobTemplateRepository {

  private static final String COLUMNS =
      """
      job_template_id, sort_priority, name, last_generated_on,
      reminder_schedule_id, recurrence, assignee
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(
      int sortPriority,
      String name,
      LocalDate lastGeneratedOn,
      Long reminderScheduleId,
      String recurrence,
      String assignee) {
    final String sql =
        """
        INSERT INTO job_templates (
          sort_priority,
          name,
          last_generated_on,
          reminder_schedule_id,
          recurrence,
          assignee
        ) VALUES (
          :sortPriority,
          :name,
          :lastGeneratedOn,
          :reminderScheduleId,
          :recurrence,
          :assignee
        )
        RETURNING job_template_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sortPriority", sortPriority)
            .addValue("name", name)
            .addValue("lastGeneratedOn", toSqlDate(lastGeneratedOn))
            .addValue("reminderScheduleId", reminderScheduleId)
            .addValue("recurrence", recurrence)
            .addValue("assignee", assignee);
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("job template insert returned no id");
    }
    return id;
  }

  public Optional<JobTemplateRecord> findById(long templateId) {
    final String sql = "SELECT " + COLUMNS + " FROM job_templates WHERE job_template_id = :templateId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("templateId", templateId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<JobTemplateRecord> findAllOrdered() {
    final String sql =
        "SELECT " + COLUMNS + " FROM job_templates ORDER BY sort_priority, job_template_id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<JobTemplateRecord> findWithWatermarkBefore(LocalDate today) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM job_templates WHERE last_generated_on < :today ORDER BY job_template_id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("today", toSqlDate(today));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Moves the watermark forward to {@code today}. Matches no row when another writer already
   * advanced it, which callers treat as "already materialized".
   */
  public int advanceWatermark(long templateId, LocalDate today) {
    final String sql =
        """
        UPDATE job_templates
        SET last_generated_on = :today
        WHERE job_template_id = :templateId
          AND last_generated_on < :today
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("today", toSqlDate(today))
            .addValue("templateId", templateId);
    return jdbcTemplate.update(sql, params);
  }

  // Watermark is deliberately absent: only the materializer moves it
  public int update(
      long templateId,
      String name,
      int sortPriority,
      String assignee,
      Long reminderScheduleId,
      String recurrence) {
    final String sql =
        """
        UPDATE job_templates
        SET name = :name,
            sort_priority = :sortPriority,
            assignee = :assignee,
            reminder_schedule_id = :reminderScheduleId,
            recurrence = :recurrence
        WHERE job_template_id = :templateId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("sortPriority", sortPriority)
            .addValue("assignee", assignee)
            .addValue("reminderScheduleId", reminderScheduleId)
            .addValue("recurrence", recurrence)
            .addValue("templateId", templateId);
    return jdbcTemplate.update(sql, params);
  }

  public int updateAssignee(long templateId, String assignee) {
    final String sql =
        "UPDATE job_templates SET assignee = :assignee WHERE job_template_id = :templateId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("assignee", assignee)
            .addValue("templateId", templateId);
    return jdbcTemplate.update(sql, params);
  }

  public int delete(long templateId) {
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("templateId", templateId);
    return jdbcTemplate.update("DELETE FROM job_templates WHERE job_template_id = :templateId", params);
  }

  private JobTemplateRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobTemplateRecord(
        rs.getLong("job_template_id"),
        rs.getInt("sort_priority"),
        rs.getString("name"),
        toLocalDate(rs.getDate("last_generated_on")),
        rs.getObject("reminder_schedule_id", Long.class),
        rs.getString("recurrence"),
        rs.getString("assignee"));
  }
}
