package com.example.labjobs.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.labjobs.model.ReassignmentRecord;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Audit trail of one-off instance reassignments. */
@Repository
@RequiredArgsConstructor
public class ReassignmentRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(long instanceId, String previousAssignee, String newAssignee, Instant reassignedAt) {
    final String sql =
        """
        INSERT INTO job_instance_reassignments (
          job_instance_id, previous_assignee, new_assignee, reassigned_at
        ) VALUES (
          :instanceId, :previousAssignee, :newAssignee, :reassignedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("instanceId", instanceId)
            .addValue("previousAssignee", previousAssignee)
            .addValue("newAssignee", newAssignee)
            .addValue("reassignedAt", toTimestamp(reassignedAt));
    jdbcTemplate.update(sql, params);
  }

  public List<ReassignmentRecord> findByInstanceId(long instanceId) {
    final String sql =
        """
        SELECT reassignment_id, job_instance_id, previous_assignee, new_assignee, reassigned_at
        FROM job_instance_reassignments
        WHERE job_instance_id = :instanceId
        ORDER BY reassigned_at, reassignment_id
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("instanceId", instanceId),
        (rs, rowNum) ->
            new ReassignmentRecord(
                rs.getLong("reassignment_id"),
                rs.getLong("job_instance_id"),
                rs.getString("previous_assignee"),
                rs.getString("new_assignee"),
                toInstant(rs.getTimestamp("reassigned_at"))));
  }
}
