package com.company.trainingruns.reconciliation;

import com.company.trainingruns.config.TrainingRunProperties;
import com.company.trainingruns.domain.RunUpdate;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.HostState;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.exception.ExternalServiceException;
import com.company.trainingruns.infrastructure.HostLivenessClient;
import com.company.trainingruns.repository.TrainingRunRepository;
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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrphanedRunDetectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private TrainingRunRepository runRepository;

    @Mock
    private HostLivenessClient hostLivenessClient;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private OrphanedRunDetector detector;

    @BeforeEach
    void setUp() {
        detector = new OrphanedRunDetector(
                runRepository,
                hostLivenessClient,
                new TrainingRunProperties(),
                eventPublisher,
                new SimpleMeterRegistry(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void detectOrphans_terminatedHost_shouldStopRun() {
        when(runRepository.findActiveWithInfraHost(50)).thenReturn(List.of(run("run_a_1", "ec2", "i-dead")));
        when(hostLivenessClient.describeHost("i-dead")).thenReturn(HostState.TERMINATED);

        ReconciliationSummary summary = detector.detectOrphans(options(false));

        ArgumentCaptor<RunUpdate> update = ArgumentCaptor.forClass(RunUpdate.class);
        verify(runRepository).updateStatus(eq("run_a_1"), eq(RunStatus.NOT_RUNNING), update.capture());
        assertThat(update.getValue().get(RunUpdate.Field.EXIT_REASON)).isEqualTo("host_terminated");
        assertThat(update.getValue().get(RunUpdate.Field.ENDED_AT)).isEqualTo(NOW);
        assertThat(summary.getMarkedStale()).isEqualTo(1);
    }

    @Test
    void detectOrphans_liveHost_shouldLeaveRunAlone() {
        when(runRepository.findActiveWithInfraHost(50)).thenReturn(List.of(run("run_a_1", "ec2", "i-live")));
        when(hostLivenessClient.describeHost("i-live")).thenReturn(HostState.RUNNING);

        ReconciliationSummary summary = detector.detectOrphans(options(false));

        verify(runRepository, never()).updateStatus(anyString(), any(), any());
        assertThat(summary.getUpdated()).isEqualTo(1);
    }

    @Test
    void detectOrphans_exemptHost_shouldNotBeChecked() {
        when(runRepository.findActiveWithInfraHost(50)).thenReturn(List.of(run("run_a_1", "Expanse", "node-17")));

        ReconciliationSummary summary = detector.detectOrphans(options(false));

        verify(hostLivenessClient, never()).describeHost(anyString());
        assertThat(summary.getProcessed()).isZero();
    }

    @Test
    void detectOrphans_apiFailure_shouldOnlyAffectThatRun() {
        when(runRepository.findActiveWithInfraHost(50)).thenReturn(List.of(
                run("run_a_1", "ec2", "i-flaky"),
                run("run_b_1", "ec2", "i-gone")));
        when(hostLivenessClient.describeHost("i-flaky"))
                .thenThrow(new ExternalServiceException("ec2", "throttled", null));
        when(hostLivenessClient.describeHost("i-gone")).thenReturn(HostState.NOT_FOUND);

        ReconciliationSummary summary = detector.detectOrphans(options(false));

        verify(runRepository).updateStatus(eq("run_b_1"), eq(RunStatus.NOT_RUNNING), any(RunUpdate.class));
        assertThat(summary.getErrored()).isEqualTo(1);
        assertThat(summary.getMarkedStale()).isEqualTo(1);
        assertThat(summary.getFailures()).extracting(RunSyncFailure::getRunId).containsExactly("run_a_1");
    }

    @Test
    void detectOrphans_dryRun_shouldWriteNothing() {
        when(runRepository.findActiveWithInfraHost(50)).thenReturn(List.of(run("run_a_1", "ec2", "i-dead")));
        when(hostLivenessClient.describeHost("i-dead")).thenReturn(HostState.STOPPED);

        ReconciliationSummary summary = detector.detectOrphans(options(true));

        verify(runRepository, never()).updateStatus(anyString(), any(), any());
        verify(eventPublisher, never()).publishEvent(any());
        assertThat(summary.getSkipped()).isEqualTo(1);
    }

    private static ReconciliationOptions options(boolean dryRun) {
        return ReconciliationOptions.builder().limit(50).dryRun(dryRun).build();
    }

    private static TrainingRun run(String runId, String host, String infraHostId) {
        return TrainingRun.builder()
                .runId(runId)
                .host(host)
                .infraHostId(infraHostId)
                .status(RunStatus.RUNNING)
                .build();
    }
}
