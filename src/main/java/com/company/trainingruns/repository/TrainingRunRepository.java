package com.company.trainingruns.repository;

import com.company.trainingruns.domain.LaunchParameters;
import com.company.trainingruns.domain.RunFilter;
import com.company.trainingruns.domain.RunStats;
import com.company.trainingruns.domain.RunUpdate;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.RunSortOrder;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.exception.DuplicateRunException;
import com.company.trainingruns.exception.RunNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store of training runs. Owns the status state machine: every status
 * write is guarded in SQL so a run never moves backwards.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class TrainingRunRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    private static final int ID_BATCH_SIZE = 500;

    static final String SELECT_BASE = """
        SELECT run_id, external_run_id, display_name, chain_of_custody_id,
               config_file_path, host, infra_host_id,
               status, exit_reason, created_at, started_at, ended_at, duration_seconds,
               batch_size, learning_rate, gradient_accumulation_steps, max_steps, max_grad_norm,
               num_gpus, mixed_precision, gradient_checkpointing, fp16, bf16,
               gradient_method, beta, enable_moving_targets, return_groups, n_clusters,
               num_objectives, num_scaffolds,
               config_json, final_metrics_json, history_json,
               external_url, conversation_s3_key, error_log_s3_key,
               crash_report_s3_key, crash_analysis_s3_key, blog_post_url, updated_at
        FROM training_runs
        """;

    /**
     * Insert a newly launched run. Status is always LAUNCHED and created_at is now.
     */
    public TrainingRun insert(TrainingRun run) {
        Instant now = now();
        run.setStatus(RunStatus.LAUNCHED);
        run.setCreatedAt(now);
        run.setUpdatedAt(now);

        LaunchParameters params = run.getLaunchParameters() != null
                ? run.getLaunchParameters()
                : new LaunchParameters();

        String sql = """
            INSERT INTO training_runs (
                run_id, external_run_id, display_name, chain_of_custody_id,
                config_file_path, host, infra_host_id,
                status, created_at,
                batch_size, learning_rate, gradient_accumulation_steps, max_steps, max_grad_norm,
                num_gpus, mixed_precision, gradient_checkpointing, fp16, bf16,
                gradient_method, beta, enable_moving_targets, return_groups, n_clusters,
                num_objectives, num_scaffolds,
                config_json, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                    run.getRunId(),
                    run.getExternalRunId(),
                    run.getDisplayName(),
                    run.getChainOfCustodyId(),
                    run.getConfigFilePath(),
                    run.getHost(),
                    run.getInfraHostId(),
                    RunStatus.LAUNCHED.getValue(),
                    Timestamp.from(now),
                    params.getBatchSize(),
                    params.getLearningRate(),
                    params.getGradientAccumulationSteps(),
                    params.getMaxSteps(),
                    params.getMaxGradNorm(),
                    params.getNumGpus(),
                    params.getMixedPrecision(),
                    params.getGradientCheckpointing(),
                    params.getFp16(),
                    params.getBf16(),
                    params.getGradientMethod(),
                    params.getBeta(),
                    params.getEnableMovingTargets(),
                    params.getReturnGroups(),
                    params.getClusterCount(),
                    params.getNumObjectives(),
                    params.getNumScaffolds(),
                    run.getConfigJson(),
                    Timestamp.from(now)
            );
        } catch (DuplicateKeyException e) {
            if (existsById(run.getRunId())) {
                throw new DuplicateRunException(run.getRunId(), e);
            }
            // external_run_id collision with another run
            throw e;
        }

        log.debug("Inserted run {}", run.getRunId());
        return run;
    }

    /**
     * Sparse status update. Only the columns present in {@code update} are assigned;
     * the status is applied only if it does not move the run backwards.
     *
     * @return number of rows matched (always 1)
     * @throws RunNotFoundException if no run has this id
     */
    public int updateStatus(String runId, RunStatus status, RunUpdate update) {
        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        List<RunStatus> later = status.laterStatuses();
        if (later.isEmpty()) {
            assignments.add("status = ?");
        } else {
            assignments.add("status = CASE WHEN " + statusIn("status", later, params) + " THEN status ELSE ? END");
        }
        params.add(status.getValue());

        return executeUpdate(runId, assignments, params, update);
    }

    /**
     * Sparse field update that leaves the status untouched.
     */
    public int updateFields(String runId, RunUpdate update) {
        return executeUpdate(runId, new ArrayList<>(), new ArrayList<>(), update);
    }

    private int executeUpdate(String runId, List<String> assignments, List<Object> params, RunUpdate update) {
        if (update != null) {
            for (RunUpdate.Field field : update.fields()) {
                String column = field.getColumn();
                if (field.isFillOnly()) {
                    assignments.add(column + " = COALESCE(" + column + ", ?)");
                } else {
                    assignments.add(column + " = ?");
                }
                params.add(toJdbcValue(update.get(field)));
            }
        }

        assignments.add("updated_at = ?");
        params.add(Timestamp.from(now()));
        params.add(runId);

        String sql = "UPDATE training_runs SET " + String.join(", ", assignments) + " WHERE run_id = ?";
        int rows = jdbcTemplate.update(sql, params.toArray());

        if (rows == 0) {
            throw new RunNotFoundException(runId);
        }
        return rows;
    }

    /**
     * Explicit correction of the tracker link. The only write that may replace a
     * non-null external_run_id.
     */
    public int correctExternalRunId(String runId, String externalRunId) {
        int rows = jdbcTemplate.update("""
            UPDATE training_runs
            SET external_run_id = ?, updated_at = ?
            WHERE run_id = ?
            """, externalRunId, Timestamp.from(now()), runId);
        if (rows == 0) {
            throw new RunNotFoundException(runId);
        }
        return rows;
    }

    public Optional<TrainingRun> findById(String runId) {
        List<TrainingRun> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE run_id = ?", new TrainingRunRowMapper(), runId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public boolean existsById(String runId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM training_runs WHERE run_id = ?", Integer.class, runId);
        return count != null && count > 0;
    }

    /**
     * The subset of {@code externalRunIds} already linked to some local run.
     */
    public Set<String> findLinkedExternalRunIds(Collection<String> externalRunIds) {
        Set<String> linked = new HashSet<>();
        List<String> ids = new ArrayList<>(externalRunIds);
        for (int from = 0; from < ids.size(); from += ID_BATCH_SIZE) {
            List<String> batch = ids.subList(from, Math.min(from + ID_BATCH_SIZE, ids.size()));
            String sql = "SELECT external_run_id FROM training_runs WHERE external_run_id IN ("
                    + String.join(", ", Collections.nCopies(batch.size(), "?")) + ")";
            linked.addAll(jdbcTemplate.queryForList(sql, String.class, batch.toArray()));
        }
        return linked;
    }

    public List<TrainingRun> findRuns(RunFilter filter, RunSortOrder order, int limit) {
        RunFilter f = filter != null ? filter : RunFilter.none();
        List<String> where = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (f.getStatus() != null) {
            where.add(statusIn("status", List.of(f.getStatus()), params));
        }
        if (f.getHost() != null) {
            where.add("host = ?");
            params.add(f.getHost());
        }
        if (f.getGradientMethod() != null) {
            where.add("gradient_method = ?");
            params.add(f.getGradientMethod());
        }
        if (f.getMinDurationHours() != null) {
            where.add("duration_seconds >= ?");
            params.add(Math.round(f.getMinDurationHours() * 3600));
        }
        if (f.getCreatedAfter() != null) {
            where.add("created_at >= ?");
            params.add(Timestamp.from(f.getCreatedAfter()));
        }
        addPresence(where, "blog_post_url", f.getHasBlogPost());
        addPresence(where, "crash_report_s3_key", f.getHasCrashReport());
        addPresence(where, "crash_analysis_s3_key", f.getHasCrashAnalysis());

        RunSortOrder sort = order != null ? order : RunSortOrder.CREATED_AT_DESC;
        String sql = SELECT_BASE
                + (where.isEmpty() ? "" : " WHERE " + String.join(" AND ", where))
                + " ORDER BY " + sort.clause(null)
                + " LIMIT ?";
        params.add(limit);

        return jdbcTemplate.query(sql, new TrainingRunRowMapper(), params.toArray());
    }

    /**
     * {@code column IN (?, ...)} over every stored label of the given statuses, with the
     * labels appended to {@code params}.
     */
    static String statusIn(String column, Collection<RunStatus> statuses, List<Object> params) {
        List<String> labels = new ArrayList<>();
        statuses.forEach(s -> labels.addAll(s.storedValues()));
        params.addAll(labels);
        return column + " IN (" + String.join(", ", Collections.nCopies(labels.size(), "?")) + ")";
    }

    private static void addPresence(List<String> where, String column, Boolean present) {
        if (present != null) {
            where.add(column + (present ? " IS NOT NULL" : " IS NULL"));
        }
    }

    /**
     * Runs the reconciler must look at: live runs, runs never synced, and stopped
     * runs whose metric history was never captured.
     */
    public List<TrainingRun> findRunsNeedingSync(int limit) {
        List<Object> params = new ArrayList<>();
        String live = statusIn("status", List.of(RunStatus.RUNNING, RunStatus.LAUNCHED), params);
        String stopped = statusIn("status", List.of(RunStatus.NOT_RUNNING), params);
        params.add(limit);

        String sql = SELECT_BASE
                + " WHERE " + live
                + " OR (" + stopped + " AND history_json IS NULL)"
                + " ORDER BY created_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, new TrainingRunRowMapper(), params.toArray());
    }

    /**
     * Live runs that carry an infrastructure host id, for the host liveness check.
     */
    public List<TrainingRun> findActiveWithInfraHost(int limit) {
        String sql = SELECT_BASE + """
            WHERE status IN (?, ?)
              AND infra_host_id IS NOT NULL
              AND infra_host_id <> ''
            ORDER BY created_at DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, new TrainingRunRowMapper(),
                RunStatus.LAUNCHED.getValue(), RunStatus.RUNNING.getValue(), limit);
    }

    public int countByStatus(RunStatus status) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM training_runs WHERE " + statusIn("status", List.of(status), params);
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, params.toArray());
        return count != null ? count : 0;
    }

    public RunStats getStats() {
        List<Object> params = new ArrayList<>();
        String launched = statusIn("status", List.of(RunStatus.LAUNCHED), params);
        String running = statusIn("status", List.of(RunStatus.RUNNING), params);
        String notRunning = statusIn("status", List.of(RunStatus.NOT_RUNNING), params);

        Map<String, Object> row = jdbcTemplate.queryForMap("""
            SELECT
                COUNT(*) AS total_runs,
                COUNT(CASE WHEN %s THEN 1 END) AS launched,
                COUNT(CASE WHEN %s THEN 1 END) AS running,
                COUNT(CASE WHEN %s THEN 1 END) AS not_running,
                COUNT(CASE WHEN history_json IS NOT NULL THEN 1 END) AS with_history,
                COUNT(CASE WHEN blog_post_url IS NOT NULL THEN 1 END) AS with_blog_posts,
                COUNT(CASE WHEN crash_report_s3_key IS NOT NULL THEN 1 END) AS with_crash_reports,
                COUNT(CASE WHEN crash_analysis_s3_key IS NOT NULL THEN 1 END) AS with_crash_analysis
            FROM training_runs
            """.formatted(launched, running, notRunning), params.toArray());

        return RunStats.builder()
                .totalRuns(getLong(row, "total_runs"))
                .launched(getLong(row, "launched"))
                .running(getLong(row, "running"))
                .notRunning(getLong(row, "not_running"))
                .withHistory(getLong(row, "with_history"))
                .withBlogPosts(getLong(row, "with_blog_posts"))
                .withCrashReports(getLong(row, "with_crash_reports"))
                .withCrashAnalysis(getLong(row, "with_crash_analysis"))
                .build();
    }

    /**
     * Administrative removal. Objective rows go with the run via ON DELETE CASCADE.
     */
    public boolean deleteById(String runId) {
        return jdbcTemplate.update("DELETE FROM training_runs WHERE run_id = ?", runId) > 0;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static Object toJdbcValue(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        return value;
    }

    private static long getLong(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value instanceof Number number ? number.longValue() : 0L;
    }

    static class TrainingRunRowMapper implements RowMapper<TrainingRun> {
        @Override
        public TrainingRun mapRow(ResultSet rs, int rowNum) throws SQLException {
            LaunchParameters params = LaunchParameters.builder()
                    .batchSize(rs.getObject("batch_size", Integer.class))
                    .learningRate(rs.getObject("learning_rate", Double.class))
                    .gradientAccumulationSteps(rs.getObject("gradient_accumulation_steps", Integer.class))
                    .maxSteps(rs.getObject("max_steps", Integer.class))
                    .maxGradNorm(rs.getObject("max_grad_norm", Double.class))
                    .numGpus(rs.getObject("num_gpus", Integer.class))
                    .mixedPrecision(rs.getObject("mixed_precision", Boolean.class))
                    .gradientCheckpointing(rs.getObject("gradient_checkpointing", Boolean.class))
                    .fp16(rs.getObject("fp16", Boolean.class))
                    .bf16(rs.getObject("bf16", Boolean.class))
                    .gradientMethod(rs.getString("gradient_method"))
                    .beta(rs.getObject("beta", Double.class))
                    .enableMovingTargets(rs.getObject("enable_moving_targets", Boolean.class))
                    .returnGroups(rs.getObject("return_groups", Boolean.class))
                    .clusterCount(rs.getObject("n_clusters", Integer.class))
                    .numObjectives(rs.getObject("num_objectives", Integer.class))
                    .numScaffolds(rs.getObject("num_scaffolds", Integer.class))
                    .build();

            return TrainingRun.builder()
                    .runId(rs.getString("run_id"))
                    .externalRunId(rs.getString("external_run_id"))
                    .displayName(rs.getString("display_name"))
                    .chainOfCustodyId(rs.getString("chain_of_custody_id"))
                    .configFilePath(rs.getString("config_file_path"))
                    .host(rs.getString("host"))
                    .infraHostId(rs.getString("infra_host_id"))
                    .status(RunStatus.fromDatabase(rs.getString("status")))
                    .exitReason(rs.getString("exit_reason"))
                    .createdAt(getInstant(rs, "created_at"))
                    .startedAt(getInstant(rs, "started_at"))
                    .endedAt(getInstant(rs, "ended_at"))
                    .durationSeconds(rs.getObject("duration_seconds", Integer.class))
                    .launchParameters(params)
                    .configJson(rs.getString("config_json"))
                    .finalMetricsJson(rs.getString("final_metrics_json"))
                    .historyJson(rs.getString("history_json"))
                    .externalUrl(rs.getString("external_url"))
                    .conversationS3Key(rs.getString("conversation_s3_key"))
                    .errorLogS3Key(rs.getString("error_log_s3_key"))
                    .crashReportS3Key(rs.getString("crash_report_s3_key"))
                    .crashAnalysisS3Key(rs.getString("crash_analysis_s3_key"))
                    .blogPostUrl(rs.getString("blog_post_url"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }

        static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
