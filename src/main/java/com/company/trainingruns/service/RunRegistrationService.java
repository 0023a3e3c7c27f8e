package com.company.trainingruns.service;

import com.company.trainingruns.domain.RunObjective;
import com.company.trainingruns.domain.RunUpdate;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.ObjectiveDirection;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.dto.request.CrashReportRequest;
import com.company.trainingruns.dto.request.ObjectiveConfig;
import com.company.trainingruns.dto.request.RegisterRunRequest;
import com.company.trainingruns.event.RunDeletedEvent;
import com.company.trainingruns.event.RunRegisteredEvent;
import com.company.trainingruns.event.RunStatusChangedEvent;
import com.company.trainingruns.exception.MalformedDataException;
import com.company.trainingruns.exception.RunNotFoundException;
import com.company.trainingruns.repository.RunObjectiveRepository;
import com.company.trainingruns.repository.TrainingRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Write paths driven by the launcher, the crash reporter and admin tooling.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RunRegistrationService {

    static final String CRASH_REPORTED = "crash_reported";
    private static final double DEFAULT_WEIGHT = 1.0;

    private final TrainingRunRepository runRepository;
    private final RunObjectiveRepository objectiveRepository;
    private final LaunchParameterExtractor parameterExtractor;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Register a launched run and its objectives.
     *
     * @throws com.company.trainingruns.exception.DuplicateRunException if the run id is taken
     * @throws MalformedDataException if a config field has the wrong type
     */
    @Transactional
    public TrainingRun register(RegisterRunRequest request) {
        JsonNode config = request.getConfig();

        TrainingRun run = TrainingRun.builder()
                .runId(request.getRunId())
                .externalRunId(blankToNull(request.getExternalRunId()))
                .displayName(blankToNull(request.getDisplayName()))
                .chainOfCustodyId(request.getChainOfCustodyId())
                .configFilePath(request.getConfigFilePath())
                .host(request.getHost())
                .infraHostId(blankToNull(request.getInfraHostId()))
                .launchParameters(parameterExtractor.extract(config))
                .configJson(toJson(config))
                .build();

        run = runRepository.insert(run);

        List<ObjectiveConfig> objectives = !request.getObjectives().isEmpty()
                ? request.getObjectives()
                : objectivesFromConfig(config);
        int inserted = insertObjectives(run.getRunId(), objectives);

        eventPublisher.publishEvent(new RunRegisteredEvent(run));

        meterRegistry.counter("training.runs.registered",
                "host", run.getHost() != null ? run.getHost() : "unknown"
        ).increment();

        log.info("Registered run {} (host={}, instance={}, objectives={})",
                run.getRunId(), run.getHost(), run.getInfraHostId(), inserted);

        return run;
    }

    /**
     * Record crash artifacts and stop the run, whether or not the tracker ever saw it.
     */
    @Transactional
    public void attachCrashReport(String runId, CrashReportRequest request) {
        RunUpdate update = RunUpdate.empty()
                .exitReason(CRASH_REPORTED)
                .endedAt(clock.instant().truncatedTo(ChronoUnit.MICROS));
        if (request.getErrorLogS3Key() != null) {
            update.errorLogS3Key(request.getErrorLogS3Key());
        }
        if (request.getCrashReportS3Key() != null) {
            update.crashReportS3Key(request.getCrashReportS3Key());
        }
        if (request.getCrashAnalysisS3Key() != null) {
            update.crashAnalysisS3Key(request.getCrashAnalysisS3Key());
        }

        runRepository.updateStatus(runId, RunStatus.NOT_RUNNING, update);
        eventPublisher.publishEvent(new RunStatusChangedEvent(runId, RunStatus.NOT_RUNNING, CRASH_REPORTED));
        meterRegistry.counter("training.runs.crash_reported").increment();

        log.warn("Crash report attached to run {}", runId);
    }

    @Transactional
    public void attachBlogPost(String runId, String blogPostUrl) {
        runRepository.updateFields(runId, RunUpdate.empty().blogPostUrl(blogPostUrl));
        log.info("Attached blog post to run {}: {}", runId, blogPostUrl);
    }

    @Transactional
    public void attachConversation(String runId, String conversationS3Key) {
        runRepository.updateFields(runId, RunUpdate.empty().conversationS3Key(conversationS3Key));
        log.info("Attached conversation to run {}: {}", runId, conversationS3Key);
    }

    /**
     * Replace the tracker link of a run, including one already set by reconciliation.
     */
    @Transactional
    public void correctExternalRunId(String runId, String externalRunId, String reason) {
        TrainingRun run = runRepository.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));

        runRepository.correctExternalRunId(runId, externalRunId);

        log.warn("External run id of {} corrected: {} -> {} (reason: {})",
                runId, run.getExternalRunId(), externalRunId, reason);
        meterRegistry.counter("training.runs.external_id_corrected").increment();
    }

    /**
     * Remove a run. Its objectives are removed with it.
     */
    @Transactional
    public void deleteRun(String runId) {
        if (!runRepository.deleteById(runId)) {
            throw new RunNotFoundException(runId);
        }
        eventPublisher.publishEvent(new RunDeletedEvent(runId));
        log.warn("Deleted run {}", runId);
    }

    private int insertObjectives(String runId, List<ObjectiveConfig> objectives) {
        Set<String> seen = new HashSet<>();
        int count = 0;

        for (ObjectiveConfig objective : objectives) {
            if (!seen.add(objective.getName())) {
                log.warn("Objective {} listed twice for run {}, keeping the first", objective.getName(), runId);
                continue;
            }

            objectiveRepository.insert(RunObjective.builder()
                    .runId(runId)
                    .objectiveName(objective.getName())
                    .objectiveAlias(objective.getAlias())
                    .uniprot(objective.getUniprot())
                    .direction(parseDirection(objective.getDirection()))
                    .weight(objective.getWeight() != null ? objective.getWeight() : DEFAULT_WEIGHT)
                    .build());
            count++;
        }
        return count;
    }

    private List<ObjectiveConfig> objectivesFromConfig(JsonNode config) {
        List<ObjectiveConfig> objectives = new ArrayList<>();
        if (config == null || !config.has("objectives") || !config.get("objectives").isArray()) {
            return objectives;
        }

        for (JsonNode node : config.get("objectives")) {
            String name = node.path("name").asText(null);
            if (name == null || name.isBlank()) {
                throw new MalformedDataException("Every config objective needs a name");
            }
            JsonNode weight = node.get("weight");
            if (weight != null && !weight.isNull() && !weight.isNumber()) {
                throw new MalformedDataException("Weight of objective " + name + " must be a number");
            }
            objectives.add(ObjectiveConfig.builder()
                    .name(name)
                    .alias(node.path("alias").asText(null))
                    .uniprot(node.path("uniprot").asText(null))
                    .direction(node.path("direction").asText(null))
                    .weight(weight != null && weight.isNumber() ? weight.doubleValue() : null)
                    .build());
        }
        return objectives;
    }

    private static ObjectiveDirection parseDirection(String direction) {
        try {
            return ObjectiveDirection.fromString(direction);
        } catch (IllegalArgumentException e) {
            throw new MalformedDataException("Unknown objective direction: " + direction, e);
        }
    }

    private String toJson(JsonNode config) {
        if (config == null || config.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new MalformedDataException("Launch config cannot be serialized", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
