package com.scheduler.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scheduler.core.exception.SchedulerException;
import com.scheduler.core.model.RunStatus;
import com.scheduler.core.model.TaskRun;
import com.scheduler.core.repository.TaskRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed implementation of TaskRunRepository.
 */
@Repository("jdbcTaskRunRepository")
public class JdbcTaskRunRepository implements TaskRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRunRepository.class);

    static final String LOST_TRACEBACK = "Worker stopped heartbeating; task requeued";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRunRowMapper rowMapper = new TaskRunRowMapper();

    public JdbcTaskRunRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public TaskRun save(TaskRun run) {
        String sql = """
            INSERT INTO scheduler_run (
                task_id, worker_id, status, start_time, stop_time,
                run_output, result_json, traceback
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, run.taskId());
            ps.setString(2, run.workerId());
            ps.setString(3, run.status().name());
            ps.setTimestamp(4, toTimestamp(run.startTime()));
            ps.setTimestamp(5, toTimestamp(run.stopTime()));
            ps.setString(6, run.output());
            ps.setString(7, toJson(run.result()));
            ps.setString(8, run.traceback());
            return ps;
        }, keyHolder);

        long runId = ((Number) keyHolder.getKeys().get("run_id")).longValue();
        log.debug("Started run {} of task {} on {}", runId, run.taskId(), run.workerId());
        return run.withRunId(runId);
    }

    @Override
    public void updateOutput(long runId, String output) {
        jdbcTemplate.update(
            "UPDATE scheduler_run SET run_output = ? WHERE run_id = ? AND status = 'RUNNING'",
            output, runId);
    }

    @Override
    @Transactional
    public void finish(TaskRun run) {
        String sql = """
            UPDATE scheduler_run SET
                status = ?,
                stop_time = ?,
                run_output = ?,
                result_json = ?,
                traceback = ?
            WHERE run_id = ? AND status = 'RUNNING'
            """;

        int rows = jdbcTemplate.update(sql,
            run.status().name(),
            toTimestamp(run.stopTime()),
            run.output(),
            toJson(run.result()),
            run.traceback(),
            run.runId()
        );

        if (rows == 0) {
            log.warn("Run {} of task {} was already closed; keeping recorded outcome",
                run.runId(), run.taskId());
        }
    }

    @Override
    public Optional<TaskRun> findById(long runId) {
        List<TaskRun> results = jdbcTemplate.query(
            "SELECT * FROM scheduler_run WHERE run_id = ?", rowMapper, runId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<TaskRun> findByTask(long taskId) {
        return jdbcTemplate.query(
            "SELECT * FROM scheduler_run WHERE task_id = ? ORDER BY run_id", rowMapper, taskId);
    }

    @Override
    public Optional<TaskRun> findLatestByTask(long taskId) {
        List<TaskRun> results = jdbcTemplate.query(
            "SELECT * FROM scheduler_run WHERE task_id = ? ORDER BY run_id DESC LIMIT 1",
            rowMapper, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    @Transactional
    public int markLost(String workerId, Instant now) {
        String sql = """
            UPDATE scheduler_run SET
                status = 'LOST',
                stop_time = ?,
                traceback = ?
            WHERE worker_id = ? AND status = 'RUNNING'
            """;
        return jdbcTemplate.update(sql, toTimestamp(now), LOST_TRACEBACK, workerId);
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SchedulerException("SERIALIZATION_FAILED", "Failed to serialize run result", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class TaskRunRowMapper implements RowMapper<TaskRun> {
        @Override
        public TaskRun mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String resultJson = rs.getString("result_json");
                return new TaskRun(
                    rs.getLong("run_id"),
                    rs.getLong("task_id"),
                    rs.getString("worker_id"),
                    RunStatus.valueOf(rs.getString("status")),
                    toInstant(rs.getTimestamp("start_time")),
                    toInstant(rs.getTimestamp("stop_time")),
                    rs.getString("run_output"),
                    resultJson != null ? objectMapper.readTree(resultJson) : null,
                    rs.getString("traceback")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map run row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
