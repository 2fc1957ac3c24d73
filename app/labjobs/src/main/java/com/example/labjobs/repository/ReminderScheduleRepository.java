/*
 * Where: Lab jobs data access
 * What: Reads and writes reminder_schedules and their escalation steps
 * Why: Schedules are re-read every tick so edits take effect without a restart
 */
package com.example.labjobs.repository;

import com.example.labjobs.model.ReminderScheduleRecord;
import com.example.labjobs.model.ReminderStep;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReminderScheduleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(String name) {
    final String sql =
        "INSERT INTO reminder_schedules (name) VALUES (:name) RETURNING reminder_schedule_id";
    final Long id =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource().addValue("name", name), Long.class);
    if (id == null) {
      throw new IllegalStateException("reminder schedule insert returned no id");
    }
    return id;
  }

  public Optional<ReminderScheduleRecord> findById(long scheduleId) {
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    final List<String> names =
        jdbcTemplate.queryForList(
            "SELECT name FROM reminder_schedules WHERE reminder_schedule_id = :scheduleId",
            params,
            String.class);
    if (names.isEmpty()) {
      return Optional.empty();
    }
    final List<ReminderStep> steps =
        jdbcTemplate.query(
            """
            SELECT threshold_millis, interval_millis
            FROM reminder_schedule_steps
            WHERE reminder_schedule_id = :scheduleId
            ORDER BY threshold_millis
            """,
            params,
            (rs, rowNum) ->
                new ReminderStep(
                    Duration.ofMillis(rs.getLong("threshold_millis")),
                    Duration.ofMillis(rs.getLong("interval_millis"))));
    return Optional.of(new ReminderScheduleRecord(scheduleId, names.get(0), steps));
  }

  public List<ReminderScheduleRecord> findAll() {
    final Map<Long, String> names = new LinkedHashMap<>();
    jdbcTemplate.query(
        "SELECT reminder_schedule_id, name FROM reminder_schedules ORDER BY reminder_schedule_id",
        new MapSqlParameterSource(),
        rs -> {
          names.put(rs.getLong("reminder_schedule_id"), rs.getString("name"));
        });
    final Map<Long, List<ReminderStep>> steps = new LinkedHashMap<>();
    jdbcTemplate.query(
        """
        SELECT reminder_schedule_id, threshold_millis, interval_millis
        FROM reminder_schedule_steps
        ORDER BY reminder_schedule_id, threshold_millis
        """,
        new MapSqlParameterSource(),
        rs -> {
          steps
              .computeIfAbsent(rs.getLong("reminder_schedule_id"), ignored -> new ArrayList<>())
              .add(
                  new ReminderStep(
                      Duration.ofMillis(rs.getLong("threshold_millis")),
                      Duration.ofMillis(rs.getLong("interval_millis"))));
        });
    final List<ReminderScheduleRecord> result = new ArrayList<>(names.size());
    names.forEach(
        (id, name) -> result.add(new ReminderScheduleRecord(id, name, steps.getOrDefault(id, List.of()))));
    return result;
  }

  public int rename(long scheduleId, String name) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("name", name).addValue("scheduleId", scheduleId);
    return jdbcTemplate.update(
        "UPDATE reminder_schedules SET name = :name WHERE reminder_schedule_id = :scheduleId", params);
  }

  /** Callers run this inside a transaction so readers never see a half-replaced step set. */
  public void replaceSteps(long scheduleId, List<ReminderStep> steps) {
    jdbcTemplate.update(
        "DELETE FROM reminder_schedule_steps WHERE reminder_schedule_id = :scheduleId",
        new MapSqlParameterSource().addValue("scheduleId", scheduleId));
    if (steps.isEmpty()) {
      return;
    }
    final SqlParameterSource[] batch =
        steps.stream()
            .map(
                step ->
                    new MapSqlParameterSource()
                        .addValue("scheduleId", scheduleId)
                        .addValue("thresholdMillis", step.threshold().toMillis())
                        .addValue("intervalMillis", step.interval().toMillis()))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(
        """
        INSERT INTO reminder_schedule_steps (reminder_schedule_id, threshold_millis, interval_millis)
        VALUES (:scheduleId, :thresholdMillis, :intervalMillis)
        """,
        batch);
  }

  // Templates and instances referencing the schedule fall back to NULL via ON DELETE SET NULL
  public int delete(long scheduleId) {
    return jdbcTemplate.update(
        "DELETE FROM reminder_schedules WHERE reminder_schedule_id = :scheduleId",
        new MapSqlParameterSource().addValue("scheduleId", scheduleId));
  }
}
