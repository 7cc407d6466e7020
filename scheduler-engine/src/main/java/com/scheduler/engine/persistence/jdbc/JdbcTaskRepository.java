package com.scheduler.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scheduler.core.exception.DuplicateTaskException;
import com.scheduler.core.exception.NotFoundException;
import com.scheduler.core.exception.SchedulerException;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskStatus;
import com.scheduler.core.repository.TaskFilter;
import com.scheduler.core.repository.TaskRepository;
import com.scheduler.core.schedule.RunTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed implementation of TaskRepository (PostgreSQL in production, H2 in tests).
 *
 * Claims and result reports are single conditional UPDATE statements. The row
 * lock taken by the UPDATE makes concurrent claimers of one task serialize, and
 * the re-evaluated WHERE clause lets exactly one of them match.
 */
@Repository("jdbcTaskRepository")
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ScheduledTaskRowMapper rowMapper = new ScheduledTaskRowMapper();

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.objectMapper = objectMapper;
    }

    @Override
    public ScheduledTask save(ScheduledTask task) {
        String sql = """
            INSERT INTO scheduler_task (
                task_uuid, task_name, group_name, function_name, args_json, kwargs_json,
                status, cron_expression, start_time, next_run_time, stop_time, period_ms,
                prevent_drift, immediate_start, repeats, times_run, retry_failed, times_failed,
                timeout_ms, sync_output_ms, assigned_worker, claim_token, last_run_time,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
                int i = 1;
                ps.setString(i++, task.uuid());
                ps.setString(i++, task.taskName());
                ps.setString(i++, task.groupName());
                ps.setString(i++, task.functionName());
                ps.setString(i++, toJson(task.args()));
                ps.setString(i++, toJson(task.kwargs()));
                ps.setString(i++, task.status().name());
                ps.setString(i++, task.cronExpression());
                ps.setTimestamp(i++, toTimestamp(task.startTime()));
                ps.setTimestamp(i++, toTimestamp(task.nextRunTime()));
                ps.setTimestamp(i++, toTimestamp(task.stopTime()));
                if (task.period() != null) {
                    ps.setLong(i++, task.period().toMillis());
                } else {
                    ps.setNull(i++, Types.BIGINT);
                }
                ps.setBoolean(i++, task.preventDrift());
                ps.setBoolean(i++, task.immediate());
                ps.setInt(i++, task.repeats());
                ps.setInt(i++, task.timesRun());
                ps.setInt(i++, task.retryFailed());
                ps.setInt(i++, task.timesFailed());
                ps.setLong(i++, task.timeout().toMillis());
                ps.setLong(i++, task.syncOutputInterval().toMillis());
                ps.setString(i++, task.assignedWorker());
                ps.setLong(i++, task.claimToken());
                ps.setTimestamp(i++, toTimestamp(task.lastRunTime()));
                ps.setTimestamp(i++, toTimestamp(task.createdAt()));
                ps.setTimestamp(i, toTimestamp(task.updatedAt()));
                return ps;
            }, keyHolder);
        } catch (DuplicateKeyException e) {
            Long existingId = findByUuid(task.uuid()).map(ScheduledTask::id).orElse(null);
            throw new DuplicateTaskException(task.uuid(), existingId);
        }

        long id = ((Number) keyHolder.getKeys().get("id")).longValue();
        log.debug("Saved task {} ({}) with id {}", task.taskName(), task.uuid(), id);
        return task.toBuilder().id(id).build();
    }

    @Override
    @Transactional
    public void update(ScheduledTask task) {
        String sql = """
            UPDATE scheduler_task SET
                task_name = ?, group_name = ?, function_name = ?, args_json = ?, kwargs_json = ?,
                status = ?, cron_expression = ?, start_time = ?, next_run_time = ?, stop_time = ?,
                period_ms = ?, prevent_drift = ?, immediate_start = ?, repeats = ?, times_run = ?,
                retry_failed = ?, times_failed = ?, timeout_ms = ?, sync_output_ms = ?,
                assigned_worker = ?, last_run_time = ?, updated_at = ?
            WHERE id = ?
            """;

        int rows = jdbcTemplate.update(sql,
            task.taskName(),
            task.groupName(),
            task.functionName(),
            toJson(task.args()),
            toJson(task.kwargs()),
            task.status().name(),
            task.cronExpression(),
            toTimestamp(task.startTime()),
            toTimestamp(task.nextRunTime()),
            toTimestamp(task.stopTime()),
            task.period() != null ? task.period().toMillis() : null,
            task.preventDrift(),
            task.immediate(),
            task.repeats(),
            task.timesRun(),
            task.retryFailed(),
            task.timesFailed(),
            task.timeout().toMillis(),
            task.syncOutputInterval().toMillis(),
            task.assignedWorker(),
            toTimestamp(task.lastRunTime()),
            toTimestamp(task.updatedAt()),
            task.id()
        );

        if (rows == 0) {
            throw new NotFoundException("Task", String.valueOf(task.id()));
        }
    }

    @Override
    public Optional<ScheduledTask> findById(long id) {
        String sql = "SELECT * FROM scheduler_task WHERE id = ?";
        List<ScheduledTask> results = jdbcTemplate.query(sql, rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<ScheduledTask> findByUuid(String uuid) {
        String sql = "SELECT * FROM scheduler_task WHERE task_uuid = ?";
        List<ScheduledTask> results = jdbcTemplate.query(sql, rowMapper, uuid);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ScheduledTask> find(TaskFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM scheduler_task WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();

        if (!filter.statuses().isEmpty()) {
            sql.append(" AND status IN (:statuses)");
            params.addValue("statuses", filter.statuses().stream().map(Enum::name).toList());
        }
        if (filter.groupName() != null) {
            sql.append(" AND group_name = :groupName");
            params.addValue("groupName", filter.groupName());
        }
        if (filter.taskName() != null) {
            sql.append(" AND task_name = :taskName");
            params.addValue("taskName", filter.taskName());
        }
        if (filter.nextRunBefore() != null) {
            sql.append(" AND next_run_time <= :nextRunBefore");
            params.addValue("nextRunBefore", toTimestamp(filter.nextRunBefore()));
        }
        sql.append(" ORDER BY id LIMIT :limit");
        params.addValue("limit", filter.limit());

        return namedJdbcTemplate.query(sql.toString(), params, rowMapper);
    }

    @Override
    public List<ScheduledTask> findDue(Collection<String> groupNames, Instant now, int limit) {
        if (groupNames.isEmpty()) {
            return List.of();
        }
        String sql = """
            SELECT * FROM scheduler_task
            WHERE status = 'QUEUED'
              AND next_run_time <= :now
              AND group_name IN (:groups)
            ORDER BY next_run_time, id
            LIMIT :limit
            """;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("groups", new ArrayList<>(groupNames))
            .addValue("limit", limit);
        return namedJdbcTemplate.query(sql, params, rowMapper);
    }

    @Override
    @Transactional
    public Optional<ScheduledTask> claim(long taskId, String workerId, Instant now) {
        String sql = """
            UPDATE scheduler_task SET
                status = 'ASSIGNED',
                assigned_worker = ?,
                claim_token = claim_token + 1,
                updated_at = ?
            WHERE id = ?
              AND status = 'QUEUED'
              AND next_run_time <= ?
              AND NOT EXISTS (
                  SELECT 1 FROM scheduler_task_dep d
                  WHERE d.successor_id = scheduler_task.id AND d.satisfied = FALSE
              )
            """;

        int rows = jdbcTemplate.update(sql, workerId, toTimestamp(now), taskId, toTimestamp(now));
        if (rows == 0) {
            log.debug("Claim of task {} by {} lost or not claimable", taskId, workerId);
            return Optional.empty();
        }
        return findById(taskId);
    }

    @Override
    @Transactional
    public boolean markRunning(long taskId, String workerId, long claimToken, Instant now) {
        String sql = """
            UPDATE scheduler_task SET
                status = 'RUNNING',
                last_run_time = ?,
                updated_at = ?
            WHERE id = ? AND assigned_worker = ? AND claim_token = ? AND status = 'ASSIGNED'
            """;

        int rows = jdbcTemplate.update(sql,
            toTimestamp(now), toTimestamp(now), taskId, workerId, claimToken);
        return rows > 0;
    }

    @Override
    @Transactional
    public boolean applyTransition(long taskId, String workerId, long claimToken,
                                   RunTransition transition, Instant now) {
        String sql = """
            UPDATE scheduler_task SET
                status = ?,
                next_run_time = ?,
                repeats = ?,
                times_run = ?,
                retry_failed = ?,
                times_failed = ?,
                assigned_worker = NULL,
                updated_at = ?
            WHERE id = ? AND assigned_worker = ? AND claim_token = ?
              AND status IN ('ASSIGNED', 'RUNNING')
            """;

        int rows = jdbcTemplate.update(sql,
            transition.status().name(),
            toTimestamp(transition.nextRunTime()),
            transition.repeats(),
            transition.timesRun(),
            transition.retryFailed(),
            transition.timesFailed(),
            toTimestamp(now),
            taskId,
            workerId,
            claimToken
        );

        if (rows == 0) {
            log.warn("Dropped stale result for task {} from {} (claim token {})",
                taskId, workerId, claimToken);
            return false;
        }

        if (transition.succeeded()) {
            jdbcTemplate.update(
                "UPDATE scheduler_task_dep SET satisfied = TRUE WHERE predecessor_id = ?", taskId);
            jdbcTemplate.update("""
                UPDATE scheduler_task_dep SET satisfied = FALSE
                WHERE successor_id = ?
                  AND predecessor_id IN (
                      SELECT id FROM scheduler_task WHERE status IN ('QUEUED', 'ASSIGNED', 'RUNNING')
                  )
                """, taskId);
        }
        return true;
    }

    @Override
    @Transactional
    public boolean stop(long taskId, Instant now) {
        String sql = """
            UPDATE scheduler_task SET
                status = 'STOPPED',
                assigned_worker = NULL,
                updated_at = ?
            WHERE id = ? AND status IN ('QUEUED', 'ASSIGNED', 'RUNNING')
            """;
        return jdbcTemplate.update(sql, toTimestamp(now), taskId) > 0;
    }

    @Override
    @Transactional
    public int requeueAbandoned(String workerId, Instant now) {
        String expireSql = """
            UPDATE scheduler_task SET
                status = 'EXPIRED',
                assigned_worker = NULL,
                updated_at = ?
            WHERE assigned_worker = ? AND status IN ('ASSIGNED', 'RUNNING')
              AND stop_time IS NOT NULL AND stop_time < ?
            """;
        int expired = jdbcTemplate.update(expireSql, toTimestamp(now), workerId, toTimestamp(now));

        String requeueSql = """
            UPDATE scheduler_task SET
                status = 'QUEUED',
                assigned_worker = NULL,
                updated_at = ?
            WHERE assigned_worker = ? AND status IN ('ASSIGNED', 'RUNNING')
            """;
        int requeued = jdbcTemplate.update(requeueSql, toTimestamp(now), workerId);

        if (expired > 0) {
            log.info("Expired {} tasks of lost worker {} past their stop time", expired, workerId);
        }
        return requeued;
    }

    @Override
    @Transactional
    public int expireOverdue(Instant now) {
        String sql = """
            UPDATE scheduler_task SET
                status = 'EXPIRED',
                updated_at = ?
            WHERE status = 'QUEUED' AND stop_time IS NOT NULL AND stop_time < ?
            """;
        return jdbcTemplate.update(sql, toTimestamp(now), toTimestamp(now));
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SchedulerException("SERIALIZATION_FAILED", "Failed to serialize task payload", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class ScheduledTaskRowMapper implements RowMapper<ScheduledTask> {
        @Override
        public ScheduledTask mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                long periodMs = rs.getLong("period_ms");
                Duration period = rs.wasNull() ? null : Duration.ofMillis(periodMs);

                return ScheduledTask.builder()
                    .id(rs.getLong("id"))
                    .uuid(rs.getString("task_uuid"))
                    .taskName(rs.getString("task_name"))
                    .groupName(rs.getString("group_name"))
                    .functionName(rs.getString("function_name"))
                    .args(objectMapper.readTree(rs.getString("args_json")))
                    .kwargs(objectMapper.readTree(rs.getString("kwargs_json")))
                    .status(TaskStatus.valueOf(rs.getString("status")))
                    .cronExpression(rs.getString("cron_expression"))
                    .startTime(toInstant(rs.getTimestamp("start_time")))
                    .nextRunTime(toInstant(rs.getTimestamp("next_run_time")))
                    .stopTime(toInstant(rs.getTimestamp("stop_time")))
                    .period(period)
                    .preventDrift(rs.getBoolean("prevent_drift"))
                    .immediate(rs.getBoolean("immediate_start"))
                    .repeats(rs.getInt("repeats"))
                    .timesRun(rs.getInt("times_run"))
                    .retryFailed(rs.getInt("retry_failed"))
                    .timesFailed(rs.getInt("times_failed"))
                    .timeout(Duration.ofMillis(rs.getLong("timeout_ms")))
                    .syncOutputInterval(Duration.ofMillis(rs.getLong("sync_output_ms")))
                    .assignedWorker(rs.getString("assigned_worker"))
                    .claimToken(rs.getLong("claim_token"))
                    .lastRunTime(toInstant(rs.getTimestamp("last_run_time")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map task row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
