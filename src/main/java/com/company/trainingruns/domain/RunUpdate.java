package com.company.trainingruns.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Sparse set of run columns to write. Only fields explicitly set here are assigned
 * by the UPDATE statement, so writers supplying disjoint fields never clobber each
 * other and resupplying the same values is a no-op.
 */
public final class RunUpdate {

    public enum Field {
        EXTERNAL_RUN_ID("external_run_id", true),
        DISPLAY_NAME("display_name", false),
        STARTED_AT("started_at", false),
        ENDED_AT("ended_at", true),
        DURATION_SECONDS("duration_seconds", false),
        EXIT_REASON("exit_reason", true),
        FINAL_METRICS_JSON("final_metrics_json", false),
        HISTORY_JSON("history_json", false),
        EXTERNAL_URL("external_url", false),
        CONVERSATION_S3_KEY("conversation_s3_key", false),
        ERROR_LOG_S3_KEY("error_log_s3_key", false),
        CRASH_REPORT_S3_KEY("crash_report_s3_key", false),
        CRASH_ANALYSIS_S3_KEY("crash_analysis_s3_key", false),
        BLOG_POST_URL("blog_post_url", false);

        private final String column;
        private final boolean fillOnly;

        Field(String column, boolean fillOnly) {
            this.column = column;
            this.fillOnly = fillOnly;
        }

        public String getColumn() {
            return column;
        }

        /**
         * Fill-only columns keep their first non-null value.
         */
        public boolean isFillOnly() {
            return fillOnly;
        }
    }

    private final Map<Field, Object> values = new EnumMap<>(Field.class);

    public static RunUpdate empty() {
        return new RunUpdate();
    }

    public RunUpdate externalRunId(String externalRunId) {
        return set(Field.EXTERNAL_RUN_ID, externalRunId);
    }

    public RunUpdate displayName(String displayName) {
        return set(Field.DISPLAY_NAME, displayName);
    }

    public RunUpdate startedAt(Instant startedAt) {
        return set(Field.STARTED_AT, startedAt);
    }

    public RunUpdate endedAt(Instant endedAt) {
        return set(Field.ENDED_AT, endedAt);
    }

    public RunUpdate durationSeconds(Integer durationSeconds) {
        return set(Field.DURATION_SECONDS, durationSeconds);
    }

    public RunUpdate exitReason(String exitReason) {
        return set(Field.EXIT_REASON, exitReason);
    }

    public RunUpdate finalMetricsJson(String finalMetricsJson) {
        return set(Field.FINAL_METRICS_JSON, finalMetricsJson);
    }

    public RunUpdate historyJson(String historyJson) {
        return set(Field.HISTORY_JSON, historyJson);
    }

    public RunUpdate externalUrl(String externalUrl) {
        return set(Field.EXTERNAL_URL, externalUrl);
    }

    public RunUpdate conversationS3Key(String key) {
        return set(Field.CONVERSATION_S3_KEY, key);
    }

    public RunUpdate errorLogS3Key(String key) {
        return set(Field.ERROR_LOG_S3_KEY, key);
    }

    public RunUpdate crashReportS3Key(String key) {
        return set(Field.CRASH_REPORT_S3_KEY, key);
    }

    public RunUpdate crashAnalysisS3Key(String key) {
        return set(Field.CRASH_ANALYSIS_S3_KEY, key);
    }

    public RunUpdate blogPostUrl(String url) {
        return set(Field.BLOG_POST_URL, url);
    }

    public boolean contains(Field field) {
        return values.containsKey(field);
    }

    public Object get(Field field) {
        return values.get(field);
    }

    public Set<Field> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private RunUpdate set(Field field, Object value) {
        values.put(field, value);
        return this;
    }

    @Override
    public String toString() {
        return "RunUpdate" + values.keySet();
    }
}
