package com.company.trainingruns.repository;

import com.company.trainingruns.domain.GradientMethodComparison;
import com.company.trainingruns.domain.ObjectiveBound;
import com.company.trainingruns.domain.ObjectiveQuery;
import com.company.trainingruns.domain.ObjectiveStatistics;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Read-only analysis queries across runs and their objectives.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ObjectiveQueryRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Runs satisfying every objective bound in the query at once.
     * <p>
     * Each named objective gets its own inner join ({@code o0..oN}) on
     * {@code run_objectives}, restricted to that objective name and its bounds. The
     * joins run in a subquery that yields run ids, so the outer select returns each
     * run at most once.
     */
    public List<TrainingRun> findByObjectives(ObjectiveQuery query) {
        if (!query.hasObjectives()) {
            return Collections.emptyList();
        }

        String column = query.getMetric().getColumn();
        StringBuilder joins = new StringBuilder();
        List<Object> params = new ArrayList<>();

        int index = 0;
        for (Map.Entry<String, ObjectiveBound> entry : query.getObjectiveBounds().entrySet()) {
            String alias = "o" + index++;
            ObjectiveBound bound = entry.getValue();

            joins.append(" JOIN run_objectives ").append(alias)
                    .append(" ON ").append(alias).append(".run_id = j.run_id")
                    .append(" AND ").append(alias).append(".objective_name = ?");
            params.add(entry.getKey());

            if (bound.getMin() != null) {
                joins.append(" AND ").append(alias).append('.').append(column).append(" >= ?");
                params.add(bound.getMin());
            }
            if (bound.getMax() != null) {
                joins.append(" AND ").append(alias).append('.').append(column).append(" <= ?");
                params.add(bound.getMax());
            }
        }

        List<String> where = new ArrayList<>();
        where.add("run_id IN (SELECT j.run_id FROM training_runs j" + joins + ")");
        if (query.getGradientMethod() != null) {
            where.add("gradient_method = ?");
            params.add(query.getGradientMethod());
        }
        if (query.getStatus() != null) {
            where.add(TrainingRunRepository.statusIn("status", List.of(query.getStatus()), params));
        }
        if (query.getHost() != null) {
            where.add("host = ?");
            params.add(query.getHost());
        }

        String sql = TrainingRunRepository.SELECT_BASE
                + " WHERE " + String.join(" AND ", where)
                + " ORDER BY " + query.getOrder().clause(null)
                + " LIMIT ?";
        params.add(query.getLimit());

        log.debug("Objective query over {} objectives on {}", query.getObjectiveBounds().size(), column);
        return jdbcTemplate.query(sql, new TrainingRunRepository.TrainingRunRowMapper(), params.toArray());
    }

    public ObjectiveStatistics getStatistics(String objectiveName, String gradientMethod, RunStatus status) {
        List<String> where = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        where.add("o.objective_name = ?");
        params.add(objectiveName);
        if (status != null) {
            where.add(TrainingRunRepository.statusIn("r.status", List.of(status), params));
        }
        if (gradientMethod != null) {
            where.add("r.gradient_method = ?");
            params.add(gradientMethod);
        }

        String sql = """
            SELECT
                COUNT(*) AS run_count,
                AVG(o.raw_mean) AS mean_value,
                MIN(o.raw_mean) AS min_value,
                MAX(o.raw_mean) AS max_value,
                AVG(o.raw_std) AS avg_std
            FROM training_runs r
            JOIN run_objectives o ON r.run_id = o.run_id
            """ + "WHERE " + String.join(" AND ", where);

        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> ObjectiveStatistics.builder()
                .objectiveName(objectiveName)
                .count(rs.getLong("run_count"))
                .mean(getNullableDouble(rs, "mean_value"))
                .min(getNullableDouble(rs, "min_value"))
                .max(getNullableDouble(rs, "max_value"))
                .avgStd(getNullableDouble(rs, "avg_std"))
                .build(), params.toArray());
    }

    /**
     * One row per gradient method, best average first.
     */
    public List<GradientMethodComparison> compareGradientMethods(String objectiveName, RunStatus status) {
        List<Object> params = new ArrayList<>();
        params.add(objectiveName);

        String statusClause = "";
        if (status != null) {
            statusClause = " AND " + TrainingRunRepository.statusIn("r.status", List.of(status), params);
        }

        String sql = """
            SELECT
                r.gradient_method,
                COUNT(*) AS run_count,
                AVG(o.raw_mean) AS avg_value,
                MAX(o.raw_mean) AS best_value,
                MIN(o.raw_mean) AS worst_value,
                AVG(r.duration_seconds / 3600.0) AS avg_hours
            FROM training_runs r
            JOIN run_objectives o ON r.run_id = o.run_id
            WHERE o.objective_name = ?
              AND r.gradient_method IS NOT NULL
            """ + statusClause + """

            GROUP BY r.gradient_method
            ORDER BY avg_value DESC NULLS LAST
            """;

        return jdbcTemplate.query(sql, new GradientMethodComparisonRowMapper(), params.toArray());
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static class GradientMethodComparisonRowMapper implements RowMapper<GradientMethodComparison> {
        @Override
        public GradientMethodComparison mapRow(ResultSet rs, int rowNum) throws SQLException {
            return GradientMethodComparison.builder()
                    .gradientMethod(rs.getString("gradient_method"))
                    .count(rs.getLong("run_count"))
                    .avg(getNullableDouble(rs, "avg_value"))
                    .best(getNullableDouble(rs, "best_value"))
                    .worst(getNullableDouble(rs, "worst_value"))
                    .avgDurationHours(getNullableDouble(rs, "avg_hours"))
                    .build();
        }
    }
}
