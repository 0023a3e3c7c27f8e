package com.company.trainingruns.repository;

import com.company.trainingruns.domain.RunObjective;
import com.company.trainingruns.domain.enums.ObjectiveDirection;
import com.company.trainingruns.domain.enums.ObjectiveMetric;
import com.company.trainingruns.exception.DuplicateObjectiveException;
import com.company.trainingruns.exception.ObjectiveNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class RunObjectiveRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    private static final String SELECT_BASE = """
        SELECT id, run_id, objective_name, objective_alias, uniprot, weight, direction,
               raw_mean, normalized_mean, raw_std, normalized_std, created_at, updated_at
        FROM run_objectives
        """;

    /**
     * Insert one objective for a run.
     *
     * @throws DuplicateObjectiveException if the run already has an objective of this name
     */
    public RunObjective insert(RunObjective objective) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        objective.setCreatedAt(now);
        objective.setUpdatedAt(now);

        String sql = """
            INSERT INTO run_objectives (
                run_id, objective_name, objective_alias, uniprot, weight, direction,
                raw_mean, normalized_mean, raw_std, normalized_std, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
                ps.setString(1, objective.getRunId());
                ps.setString(2, objective.getObjectiveName());
                ps.setString(3, objective.getObjectiveAlias());
                ps.setString(4, objective.getUniprot());
                ps.setObject(5, objective.getWeight());
                ps.setString(6, objective.getDirection() != null ? objective.getDirection().getValue() : null);
                ps.setObject(7, objective.getRawMean());
                ps.setObject(8, objective.getNormalizedMean());
                ps.setObject(9, objective.getRawStd());
                ps.setObject(10, objective.getNormalizedStd());
                ps.setTimestamp(11, Timestamp.from(now));
                ps.setTimestamp(12, Timestamp.from(now));
                return ps;
            }, keyHolder);
        } catch (DuplicateKeyException e) {
            throw new DuplicateObjectiveException(objective.getRunId(), objective.getObjectiveName(), e);
        }

        objective.setId(keyHolder.getKey().longValue());
        return objective;
    }

    /**
     * Write the supplied metric values. Metrics absent from the map are left unchanged.
     *
     * @throws ObjectiveNotFoundException if the run has no objective of this name
     */
    public int updateMetrics(String runId, String objectiveName, Map<ObjectiveMetric, Double> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return 0;
        }

        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        metrics.forEach((metric, value) -> {
            assignments.add(metric.getColumn() + " = ?");
            params.add(value);
        });
        assignments.add("updated_at = ?");
        params.add(Timestamp.from(clock.instant().truncatedTo(ChronoUnit.MICROS)));
        params.add(runId);
        params.add(objectiveName);

        String sql = "UPDATE run_objectives SET " + String.join(", ", assignments)
                + " WHERE run_id = ? AND objective_name = ?";
        int rows = jdbcTemplate.update(sql, params.toArray());
        if (rows == 0) {
            throw new ObjectiveNotFoundException(runId, objectiveName);
        }
        return rows;
    }

    public List<RunObjective> findByRunId(String runId) {
        return jdbcTemplate.query(SELECT_BASE + " WHERE run_id = ? ORDER BY objective_name",
                new RunObjectiveRowMapper(), runId);
    }

    public Optional<RunObjective> findByRunIdAndName(String runId, String objectiveName) {
        List<RunObjective> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE run_id = ? AND objective_name = ?",
                new RunObjectiveRowMapper(), runId, objectiveName);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public int countByRunId(String runId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM run_objectives WHERE run_id = ?", Integer.class, runId);
        return count != null ? count : 0;
    }

    private static class RunObjectiveRowMapper implements RowMapper<RunObjective> {
        @Override
        public RunObjective mapRow(ResultSet rs, int rowNum) throws SQLException {
            return RunObjective.builder()
                    .id(rs.getLong("id"))
                    .runId(rs.getString("run_id"))
                    .objectiveName(rs.getString("objective_name"))
                    .objectiveAlias(rs.getString("objective_alias"))
                    .uniprot(rs.getString("uniprot"))
                    .weight(rs.getObject("weight", Double.class))
                    .direction(ObjectiveDirection.fromString(rs.getString("direction")))
                    .rawMean(rs.getObject("raw_mean", Double.class))
                    .normalizedMean(rs.getObject("normalized_mean", Double.class))
                    .rawStd(rs.getObject("raw_std", Double.class))
                    .normalizedStd(rs.getObject("normalized_std", Double.class))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }

        private Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
