package com.company.trainingruns.service;

import com.company.trainingruns.domain.RunObjective;
import com.company.trainingruns.domain.enums.ObjectiveDirection;
import com.company.trainingruns.domain.enums.ObjectiveMetric;
import com.company.trainingruns.dto.request.ObjectiveMetricsRequest;
import com.company.trainingruns.event.ObjectiveMetricsUpdatedEvent;
import com.company.trainingruns.exception.MalformedDataException;
import com.company.trainingruns.repository.RunObjectiveRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObjectiveMetricServiceTest {

    @Mock
    private RunObjectiveRepository objectiveRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ObjectiveMetricService service;

    @BeforeEach
    void setUp() {
        service = new ObjectiveMetricService(objectiveRepository, eventPublisher, new SimpleMeterRegistry());
    }

    @Test
    void resolve_shouldMatchByAliasOrByStrippedSuffix() {
        List<RunObjective> objectives = List.of(
                objective("COMT_activity", "comt_alias"),
                objective("DRD2_binding", null));
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("objectives/comt_alias/raw_mean", 0.8);
        metrics.put("objectives/DRD2_binding_minimize/normalized_std", 0.05);
        metrics.put("objectives/unknown_maximize/raw_mean", 0.1);
        metrics.put("objectives/COMT_activity/not_a_metric", 1.0);
        metrics.put("loss", 0.3);

        ObjectiveMetricUpdateResult result = new ObjectiveMetricUpdateResult();
        Map<String, Map<ObjectiveMetric, Double>> resolved = service.resolve(objectives, metrics, result);

        assertThat(resolved).containsOnlyKeys("COMT_activity", "DRD2_binding");
        assertThat(resolved.get("COMT_activity")).containsEntry(ObjectiveMetric.RAW_MEAN, 0.8);
        assertThat(resolved.get("DRD2_binding")).containsEntry(ObjectiveMetric.NORMALIZED_STD, 0.05);
        assertThat(result.getUnmatchedKeys()).containsExactly("objectives/unknown_maximize/raw_mean");
    }

    @Test
    void resolve_nonFiniteOrNonNumericValues_shouldBeReportedMalformed() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("objectives/COMT_activity_maximize/raw_mean", Double.NaN);
        metrics.put("objectives/COMT_activity_maximize/raw_std", "n/a");
        metrics.put("objectives/COMT_activity_maximize/normalized_mean", 0.4);

        ObjectiveMetricUpdateResult result = new ObjectiveMetricUpdateResult();
        Map<String, Map<ObjectiveMetric, Double>> resolved = service.resolve(
                List.of(objective("COMT_activity", null)), metrics, result);

        assertThat(resolved.get("COMT_activity")).containsOnlyKeys(ObjectiveMetric.NORMALIZED_MEAN);
        assertThat(result.getMalformedKeys()).containsExactlyInAnyOrder(
                "objectives/COMT_activity_maximize/raw_mean",
                "objectives/COMT_activity_maximize/raw_std");
    }

    @Test
    void applyTrackerMetrics_shouldWriteEachObjectiveAndPublish() {
        when(objectiveRepository.findByRunId("run_1")).thenReturn(List.of(objective("COMT_activity", null)));

        ObjectiveMetricUpdateResult result = service.applyTrackerMetrics("run_1",
                Map.of("objectives/COMT_activity_maximize/raw_mean", 0.7));

        verify(objectiveRepository).updateMetrics(eq("run_1"), eq("COMT_activity"),
                eq(Map.of(ObjectiveMetric.RAW_MEAN, 0.7)));
        verify(eventPublisher).publishEvent(any(ObjectiveMetricsUpdatedEvent.class));
        assertThat(result.getObjectivesUpdated()).isEqualTo(1);
    }

    @Test
    void applyTrackerMetrics_runWithoutObjectives_shouldDoNothing() {
        when(objectiveRepository.findByRunId("run_1")).thenReturn(List.of());

        ObjectiveMetricUpdateResult result = service.applyTrackerMetrics("run_1",
                Map.of("objectives/COMT_activity_maximize/raw_mean", 0.7));

        verify(objectiveRepository, never()).updateMetrics(anyString(), anyString(), anyMap());
        assertThat(result.getObjectivesUpdated()).isZero();
    }

    @Test
    void updateMetrics_nonFiniteValue_shouldBeRejected() {
        ObjectiveMetricsRequest request = ObjectiveMetricsRequest.builder()
                .rawMean(Double.POSITIVE_INFINITY)
                .build();

        assertThatThrownBy(() -> service.updateMetrics("run_1", "COMT_activity", request))
                .isInstanceOf(MalformedDataException.class);
        verify(objectiveRepository, never()).updateMetrics(anyString(), anyString(), anyMap());
    }

    @Test
    void stripDirectionSuffix_shouldRemoveOnlyKnownSuffix() {
        assertThat(ObjectiveMetricService.stripDirectionSuffix("COMT_activity_maximize")).isEqualTo("COMT_activity");
        assertThat(ObjectiveMetricService.stripDirectionSuffix("DRD2_minimize")).isEqualTo("DRD2");
        assertThat(ObjectiveMetricService.stripDirectionSuffix("plain")).isEqualTo("plain");
    }

    private static RunObjective objective(String name, String alias) {
        return RunObjective.builder()
                .runId("run_1")
                .objectiveName(name)
                .objectiveAlias(alias)
                .direction(ObjectiveDirection.MAXIMIZE)
                .weight(1.0)
                .build();
    }
}
