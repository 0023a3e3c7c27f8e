package com.company.trainingruns.service;

import com.company.trainingruns.domain.RunObjective;
import com.company.trainingruns.domain.enums.ObjectiveDirection;
import com.company.trainingruns.domain.enums.ObjectiveMetric;
import com.company.trainingruns.dto.request.ObjectiveMetricsRequest;
import com.company.trainingruns.event.ObjectiveMetricsUpdatedEvent;
import com.company.trainingruns.exception.MalformedDataException;
import com.company.trainingruns.repository.RunObjectiveRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes objective metric values, either parsed from tracker metric keys of the form
 * {@code objectives/{alias}/{metric}} or supplied directly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ObjectiveMetricService {

    static final String KEY_PREFIX = "objectives/";

    private final RunObjectiveRepository objectiveRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public List<RunObjective> getObjectives(String runId) {
        return objectiveRepository.findByRunId(runId);
    }

    /**
     * Resolve tracker metric keys against the run's objectives.
     * Values that are not finite numbers are recorded as malformed and skipped.
     *
     * @return metric values per objective name, in key order
     */
    public Map<String, Map<ObjectiveMetric, Double>> resolve(List<RunObjective> objectives,
                                                             Map<String, Object> metrics,
                                                             ObjectiveMetricUpdateResult result) {
        Map<String, String> nameByAlias = new HashMap<>();
        Map<String, String> names = new HashMap<>();
        for (RunObjective objective : objectives) {
            names.put(objective.getObjectiveName(), objective.getObjectiveName());
            if (objective.getObjectiveAlias() != null) {
                nameByAlias.put(objective.getObjectiveAlias(), objective.getObjectiveName());
            }
        }

        Map<String, Map<ObjectiveMetric, Double>> updates = new LinkedHashMap<>();
        if (metrics == null) {
            return updates;
        }

        for (Map.Entry<String, Object> entry : metrics.entrySet()) {
            String key = entry.getKey();
            if (key == null || !key.startsWith(KEY_PREFIX)) {
                continue;
            }

            String[] parts = key.substring(KEY_PREFIX.length()).split("/");
            if (parts.length != 2) {
                continue;
            }
            Optional<ObjectiveMetric> metric = ObjectiveMetric.fromKey(parts[1]);
            if (metric.isEmpty()) {
                continue;
            }

            String objectiveName = nameByAlias.get(parts[0]);
            if (objectiveName == null) {
                objectiveName = names.get(stripDirectionSuffix(parts[0]));
            }
            if (objectiveName == null) {
                result.recordUnmatched(key);
                continue;
            }

            Double value = toFiniteDouble(entry.getValue());
            if (value == null) {
                if (entry.getValue() != null) {
                    result.recordMalformed(key);
                }
                continue;
            }

            updates.computeIfAbsent(objectiveName, n -> new EnumMap<>(ObjectiveMetric.class))
                    .put(metric.get(), value);
        }
        return updates;
    }

    /**
     * Apply tracker metric values to the run's objectives.
     */
    @Transactional
    public ObjectiveMetricUpdateResult applyTrackerMetrics(String runId, Map<String, Object> metrics) {
        ObjectiveMetricUpdateResult result = new ObjectiveMetricUpdateResult();
        List<RunObjective> objectives = objectiveRepository.findByRunId(runId);
        if (objectives.isEmpty()) {
            return result;
        }

        Map<String, Map<ObjectiveMetric, Double>> updates = resolve(objectives, metrics, result);
        updates.forEach((objectiveName, values) -> {
            objectiveRepository.updateMetrics(runId, objectiveName, values);
            result.recordUpdate();
        });

        if (result.hasMalformed()) {
            log.warn("Skipped {} malformed metric values for run {}: {}",
                    result.getMalformedKeys().size(), runId, result.getMalformedKeys());
            meterRegistry.counter("training.objectives.malformed_values")
                    .increment(result.getMalformedKeys().size());
        }
        if (result.getObjectivesUpdated() > 0) {
            eventPublisher.publishEvent(new ObjectiveMetricsUpdatedEvent(runId, result.getObjectivesUpdated()));
        }
        return result;
    }

    /**
     * Manual metric write. Null request fields are left unchanged.
     */
    @Transactional
    public RunObjective updateMetrics(String runId, String objectiveName, ObjectiveMetricsRequest request) {
        Map<ObjectiveMetric, Double> values = new EnumMap<>(ObjectiveMetric.class);
        putChecked(values, ObjectiveMetric.RAW_MEAN, request.getRawMean());
        putChecked(values, ObjectiveMetric.NORMALIZED_MEAN, request.getNormalizedMean());
        putChecked(values, ObjectiveMetric.RAW_STD, request.getRawStd());
        putChecked(values, ObjectiveMetric.NORMALIZED_STD, request.getNormalizedStd());

        if (values.isEmpty()) {
            throw new MalformedDataException("No metric values supplied");
        }

        objectiveRepository.updateMetrics(runId, objectiveName, values);
        log.info("Updated {} metrics of objective {} for run {}", values.size(), objectiveName, runId);
        eventPublisher.publishEvent(new ObjectiveMetricsUpdatedEvent(runId, 1));

        return objectiveRepository.findByRunIdAndName(runId, objectiveName).orElseThrow();
    }

    private static void putChecked(Map<ObjectiveMetric, Double> values, ObjectiveMetric metric, Double value) {
        if (value == null) {
            return;
        }
        if (value.isNaN() || value.isInfinite()) {
            throw new MalformedDataException(metric.getColumn() + " must be a finite number");
        }
        values.put(metric, value);
    }

    static String stripDirectionSuffix(String alias) {
        for (ObjectiveDirection direction : ObjectiveDirection.values()) {
            if (alias.endsWith(direction.aliasSuffix())) {
                return alias.substring(0, alias.length() - direction.aliasSuffix().length());
            }
        }
        return alias;
    }

    private static Double toFiniteDouble(Object value) {
        if (!(value instanceof Number number)) {
            return null;
        }
        double d = number.doubleValue();
        return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
    }
}
