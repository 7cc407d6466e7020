package com.scheduler.engine.persistence.jdbc;

import com.scheduler.core.model.DependencyEdge;
import com.scheduler.core.repository.DependencyRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JDBC-backed implementation of DependencyRepository.
 */
@Repository("jdbcDependencyRepository")
public class JdbcDependencyRepository implements DependencyRepository {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    private final RowMapper<DependencyEdge> rowMapper = (rs, rowNum) -> new DependencyEdge(
        rs.getString("job_name"),
        rs.getLong("predecessor_id"),
        rs.getLong("successor_id"),
        rs.getBoolean("satisfied")
    );

    public JdbcDependencyRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    @Transactional
    public void saveAll(Collection<DependencyEdge> edges) {
        String sql = """
            INSERT INTO scheduler_task_dep (job_name, predecessor_id, successor_id, satisfied)
            VALUES (?, ?, ?, ?)
            """;
        List<Object[]> batch = new ArrayList<>(edges.size());
        for (DependencyEdge edge : edges) {
            batch.add(new Object[] {
                edge.jobName(), edge.predecessorId(), edge.successorId(), edge.satisfied()
            });
        }
        jdbcTemplate.batchUpdate(sql, batch);
    }

    @Override
    public List<DependencyEdge> findByJob(String jobName) {
        return jdbcTemplate.query(
            "SELECT * FROM scheduler_task_dep WHERE job_name = ? ORDER BY predecessor_id, successor_id",
            rowMapper, jobName);
    }

    @Override
    public List<DependencyEdge> findBySuccessors(Collection<Long> successorIds) {
        if (successorIds.isEmpty()) {
            return List.of();
        }
        return namedJdbcTemplate.query(
            "SELECT * FROM scheduler_task_dep WHERE successor_id IN (:ids)",
            new MapSqlParameterSource("ids", new ArrayList<>(successorIds)),
            rowMapper);
    }

    @Override
    public List<DependencyEdge> findAll() {
        return jdbcTemplate.query(
            "SELECT * FROM scheduler_task_dep ORDER BY job_name, predecessor_id, successor_id",
            rowMapper);
    }
}
