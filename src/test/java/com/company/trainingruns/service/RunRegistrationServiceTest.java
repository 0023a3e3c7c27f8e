package com.company.trainingruns.service;

import com.company.trainingruns.domain.RunObjective;
import com.company.trainingruns.domain.RunUpdate;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.ObjectiveDirection;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.dto.request.CrashReportRequest;
import com.company.trainingruns.dto.request.ObjectiveConfig;
import com.company.trainingruns.dto.request.RegisterRunRequest;
import com.company.trainingruns.event.RunRegisteredEvent;
import com.company.trainingruns.exception.MalformedDataException;
import com.company.trainingruns.exception.RunNotFoundException;
import com.company.trainingruns.repository.RunObjectiveRepository;
import com.company.trainingruns.repository.TrainingRunRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunRegistrationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private TrainingRunRepository runRepository;

    @Mock
    private RunObjectiveRepository objectiveRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RunRegistrationService service;

    @BeforeEach
    void setUp() {
        service = new RunRegistrationService(
                runRepository,
                objectiveRepository,
                new LaunchParameterExtractor(),
                objectMapper,
                eventPublisher,
                new SimpleMeterRegistry(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void register_withoutExplicitObjectives_shouldTakeThemFromConfig() throws Exception {
        when(runRepository.insert(any(TrainingRun.class))).thenAnswer(invocation -> invocation.getArgument(0));
        RegisterRunRequest request = RegisterRunRequest.builder()
                .runId("expA_v2_i-0abc123")
                .host("ec2")
                .infraHostId("  ")
                .config(objectMapper.readTree("""
                        {
                          "reward": {"gradient_method": "reinforce"},
                          "objectives": [
                            {"name": "COMT_activity", "alias": "COMT_activity_maximize", "direction": "maximize"},
                            {"name": "DRD2_binding", "direction": "minimize", "weight": 0.5}
                          ]
                        }
                        """))
                .build();

        TrainingRun run = service.register(request);

        assertThat(run.getInfraHostId()).isNull();
        assertThat(run.getLaunchParameters().getGradientMethod()).isEqualTo("reinforce");
        assertThat(run.getConfigJson()).contains("\"gradient_method\":\"reinforce\"");

        ArgumentCaptor<RunObjective> objectives = ArgumentCaptor.forClass(RunObjective.class);
        verify(objectiveRepository, times(2)).insert(objectives.capture());
        assertThat(objectives.getAllValues())
                .extracting(RunObjective::getObjectiveName, RunObjective::getWeight, RunObjective::getDirection)
                .containsExactly(
                        tuple("COMT_activity", 1.0, ObjectiveDirection.MAXIMIZE),
                        tuple("DRD2_binding", 0.5, ObjectiveDirection.MINIMIZE));
        verify(eventPublisher).publishEvent(any(RunRegisteredEvent.class));
    }

    @Test
    void register_withDuplicateObjectiveNames_shouldKeepFirst() {
        when(runRepository.insert(any(TrainingRun.class))).thenAnswer(invocation -> invocation.getArgument(0));
        RegisterRunRequest request = RegisterRunRequest.builder()
                .runId("run_1")
                .objectives(List.of(
                        ObjectiveConfig.builder().name("A").weight(2.0).build(),
                        ObjectiveConfig.builder().name("A").weight(3.0).build()))
                .build();

        service.register(request);

        verify(objectiveRepository, times(1)).insert(any(RunObjective.class));
    }

    @Test
    void register_withBadConfigType_shouldRejectBeforeInsert() throws Exception {
        RegisterRunRequest request = RegisterRunRequest.builder()
                .runId("run_1")
                .config(objectMapper.readTree("{\"training\": {\"max_steps\": \"many\"}}"))
                .build();

        assertThatThrownBy(() -> service.register(request)).isInstanceOf(MalformedDataException.class);
        verify(runRepository, never()).insert(any());
    }

    @Test
    void attachCrashReport_shouldStopRunWithDiagnostics() {
        service.attachCrashReport("run_1", CrashReportRequest.builder()
                .crashReportS3Key("s3://crashes/run_1/report.json")
                .build());

        ArgumentCaptor<RunUpdate> update = ArgumentCaptor.forClass(RunUpdate.class);
        verify(runRepository).updateStatus(eq("run_1"), eq(RunStatus.NOT_RUNNING), update.capture());
        assertThat(update.getValue().get(RunUpdate.Field.EXIT_REASON)).isEqualTo("crash_reported");
        assertThat(update.getValue().get(RunUpdate.Field.ENDED_AT)).isEqualTo(NOW);
        assertThat(update.getValue().get(RunUpdate.Field.CRASH_REPORT_S3_KEY))
                .isEqualTo("s3://crashes/run_1/report.json");
        assertThat(update.getValue().contains(RunUpdate.Field.ERROR_LOG_S3_KEY)).isFalse();
    }

    @Test
    void deleteRun_whenMissing_shouldThrowNotFound() {
        when(runRepository.deleteById("missing")).thenReturn(false);

        assertThatThrownBy(() -> service.deleteRun("missing")).isInstanceOf(RunNotFoundException.class);
        verify(eventPublisher, never()).publishEvent(any());
    }
}
