package com.scheduler.engine.persistence.jdbc;

import com.scheduler.core.model.WorkerRecord;
import com.scheduler.core.model.WorkerStatus;
import com.scheduler.core.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * JDBC-backed implementation of WorkerRepository.
 * Group names are stored as a comma-separated list.
 */
@Repository("jdbcWorkerRepository")
public class JdbcWorkerRepository implements WorkerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkerRepository.class);

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<WorkerRecord> rowMapper = (rs, rowNum) -> new WorkerRecord(
        rs.getString("worker_id"),
        splitGroups(rs.getString("group_names")),
        rs.getTimestamp("first_heartbeat").toInstant(),
        rs.getTimestamp("last_heartbeat").toInstant(),
        WorkerStatus.valueOf(rs.getString("status"))
    );

    public JdbcWorkerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public WorkerRecord heartbeat(String workerId, Set<String> groupNames, Instant now) {
        String groups = joinGroups(groupNames);
        String updateSql = """
            UPDATE scheduler_worker SET last_heartbeat = ?, group_names = ?
            WHERE worker_id = ?
            """;

        int rows = jdbcTemplate.update(updateSql, Timestamp.from(now), groups, workerId);
        if (rows == 0) {
            try {
                jdbcTemplate.update("""
                    INSERT INTO scheduler_worker (
                        worker_id, group_names, first_heartbeat, last_heartbeat, status
                    ) VALUES (?, ?, ?, ?, ?)
                    """,
                    workerId, groups, Timestamp.from(now), Timestamp.from(now),
                    WorkerStatus.ACTIVE.name());
                log.info("Registered worker {} serving {}", workerId, groupNames);
            } catch (DuplicateKeyException e) {
                // Registered concurrently under the same id
                jdbcTemplate.update(updateSql, Timestamp.from(now), groups, workerId);
            }
        }

        return findById(workerId).orElseThrow(() ->
            new IllegalStateException("Worker " + workerId + " vanished during heartbeat"));
    }

    @Override
    public Optional<WorkerRecord> findById(String workerId) {
        List<WorkerRecord> results = jdbcTemplate.query(
            "SELECT * FROM scheduler_worker WHERE worker_id = ?", rowMapper, workerId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkerRecord> findAll() {
        return jdbcTemplate.query("SELECT * FROM scheduler_worker ORDER BY worker_id", rowMapper);
    }

    @Override
    public List<WorkerRecord> findStale(Instant cutoff) {
        return jdbcTemplate.query(
            "SELECT * FROM scheduler_worker WHERE last_heartbeat < ? ORDER BY worker_id",
            rowMapper, Timestamp.from(cutoff));
    }

    @Override
    @Transactional
    public boolean updateStatus(String workerId, WorkerStatus status) {
        return jdbcTemplate.update(
            "UPDATE scheduler_worker SET status = ? WHERE worker_id = ?",
            status.name(), workerId) > 0;
    }

    @Override
    @Transactional
    public boolean delete(String workerId) {
        return jdbcTemplate.update("DELETE FROM scheduler_worker WHERE worker_id = ?", workerId) > 0;
    }

    // ========== Helper Methods ==========

    private static String joinGroups(Set<String> groupNames) {
        return String.join(",", new TreeSet<>(groupNames));
    }

    private static Set<String> splitGroups(String groups) {
        return new LinkedHashSet<>(Arrays.asList(groups.split(",")));
    }
}
