package com.company.trainingruns.reconciliation;

import com.company.trainingruns.domain.RunUpdate;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.ExternalRunState;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.exception.MalformedDataException;
import com.company.trainingruns.tracker.TrackerRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a tracker record into the sparse set of run fields it actually provides.
 */
@Component
@RequiredArgsConstructor
public class TrackerRunMapper {

    static final String RUNTIME_KEY = "_runtime";
    private static final String RESERVED_PREFIX = "_";

    private final ObjectMapper objectMapper;

    /**
     * @param observedAt time of this observation; becomes {@code ended_at} on the terminal transition
     */
    public RunUpdate toUpdate(TrainingRun run, TrackerRun record, List<Map<String, Object>> history,
                              Instant observedAt) {
        ExternalRunState state = record.getExternalState();
        RunStatus status = state.toRunStatus();
        Map<String, Object> summary = record.getSummary() != null ? record.getSummary() : Map.of();

        RunUpdate update = RunUpdate.empty();

        if (record.getId() != null) {
            update.externalRunId(record.getId());
        }
        if (!run.hasDisplayName() && record.getName() != null) {
            update.displayName(record.getName());
        }
        if (record.getUrl() != null) {
            update.externalUrl(record.getUrl());
        }
        if (record.getCreatedAt() != null) {
            update.startedAt(record.getCreatedAt());
        }

        Integer duration = runtimeSeconds(summary);
        if (duration != null) {
            update.durationSeconds(duration);
        }

        if (status.isTerminal()) {
            update.exitReason(state.exitReason());
            // stamped only when this observation is what stops the run
            if (run.getEndedAt() == null && run.getStatus() != RunStatus.NOT_RUNNING) {
                update.endedAt(observedAt);
            }
        }

        if (history != null && !history.isEmpty()) {
            update.historyJson(toJson(alignHistory(history)));
        } else if (status.isTerminal()) {
            // nothing more will be logged; an empty document ends the backfill
            update.historyJson("{}");
        }

        if (state == ExternalRunState.FINISHED) {
            update.finalMetricsJson(toJson(finalMetrics(summary)));
        }

        return update;
    }

    /**
     * Metric values for objective updates: the summary overlaid with the last logged step.
     */
    public Map<String, Object> latestMetrics(TrackerRun record, List<Map<String, Object>> history) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        if (record.getSummary() != null) {
            metrics.putAll(record.getSummary());
        }
        if (history != null && !history.isEmpty()) {
            history.get(history.size() - 1).forEach((key, value) -> {
                if (value != null) {
                    metrics.put(key, value);
                }
            });
        }
        return metrics;
    }

    /**
     * One list per metric name, each indexed by step. A step that did not log a metric
     * holds null at that index.
     */
    static Map<String, List<Object>> alignHistory(List<Map<String, Object>> steps) {
        Set<String> keys = new LinkedHashSet<>();
        for (Map<String, Object> step : steps) {
            keys.addAll(step.keySet());
        }

        Map<String, List<Object>> aligned = new LinkedHashMap<>();
        for (String key : keys) {
            List<Object> values = new ArrayList<>(steps.size());
            for (Map<String, Object> step : steps) {
                values.add(step.get(key));
            }
            aligned.put(key, values);
        }
        return aligned;
    }

    static Map<String, Object> finalMetrics(Map<String, Object> summary) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        summary.forEach((key, value) -> {
            if (!key.startsWith(RESERVED_PREFIX)) {
                metrics.put(key, value);
            }
        });
        return metrics;
    }

    static Integer runtimeSeconds(Map<String, Object> summary) {
        Object runtime = summary.get(RUNTIME_KEY);
        if (runtime == null) {
            return null;
        }
        if (!(runtime instanceof Number number) || !Double.isFinite(number.doubleValue())) {
            throw new MalformedDataException("Tracker runtime is not a number: " + runtime);
        }
        return (int) Math.round(number.doubleValue());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MalformedDataException("Tracker data cannot be serialized", e);
        }
    }
}
