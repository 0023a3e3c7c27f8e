package com.company.trainingruns.service;

import com.company.trainingruns.config.RedisCacheConfig;
import com.company.trainingruns.domain.RunFilter;
import com.company.trainingruns.domain.RunObjective;
import com.company.trainingruns.domain.RunStats;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.RunSortOrder;
import com.company.trainingruns.dto.response.ObjectiveResponse;
import com.company.trainingruns.dto.response.RunDetailResponse;
import com.company.trainingruns.dto.response.RunResponse;
import com.company.trainingruns.exception.RunNotFoundException;
import com.company.trainingruns.repository.RunObjectiveRepository;
import com.company.trainingruns.repository.TrainingRunRepository;
import com.company.trainingruns.util.TimeUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class RunQueryService {

    private final TrainingRunRepository runRepository;
    private final RunObjectiveRepository objectiveRepository;
    private final ObjectMapper objectMapper;

    public TrainingRun getRun(String runId) {
        return runRepository.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
    }

    public RunDetailResponse getRunDetail(String runId) {
        TrainingRun run = getRun(runId);
        List<RunObjective> objectives = objectiveRepository.findByRunId(runId);
        return toRunDetailResponse(run, objectives);
    }

    public List<RunResponse> listRuns(RunFilter filter, RunSortOrder order, int limit) {
        return runRepository.findRuns(filter, order, limit).stream()
                .map(RunQueryService::toRunResponse)
                .collect(Collectors.toList());
    }

    @Cacheable(value = RedisCacheConfig.RUN_STATS, key = "'all'")
    public RunStats getStats() {
        log.debug("Computing run statistics");
        return runRepository.getStats();
    }

    public static RunResponse toRunResponse(TrainingRun run) {
        return RunResponse.builder()
                .runId(run.getRunId())
                .externalRunId(run.getExternalRunId())
                .displayName(run.getDisplayName())
                .host(run.getHost())
                .status(run.getStatus().getValue())
                .exitReason(run.getExitReason())
                .gradientMethod(run.getLaunchParameters() != null
                        ? run.getLaunchParameters().getGradientMethod() : null)
                .createdAt(run.getCreatedAt())
                .startedAt(run.getStartedAt())
                .endedAt(run.getEndedAt())
                .durationSeconds(run.getDurationSeconds())
                .durationFormatted(TimeUtils.formatDuration(run.getDurationSeconds()))
                .externalUrl(run.getExternalUrl())
                .blogPostUrl(run.getBlogPostUrl())
                .build();
    }

    public static ObjectiveResponse toObjectiveResponse(RunObjective objective) {
        return ObjectiveResponse.builder()
                .objectiveName(objective.getObjectiveName())
                .objectiveAlias(objective.getObjectiveAlias())
                .uniprot(objective.getUniprot())
                .weight(objective.getWeight())
                .direction(objective.getDirection() != null ? objective.getDirection().getValue() : null)
                .rawMean(objective.getRawMean())
                .normalizedMean(objective.getNormalizedMean())
                .rawStd(objective.getRawStd())
                .normalizedStd(objective.getNormalizedStd())
                .updatedAt(objective.getUpdatedAt())
                .build();
    }

    private RunDetailResponse toRunDetailResponse(TrainingRun run, List<RunObjective> objectives) {
        return RunDetailResponse.builder()
                .runId(run.getRunId())
                .externalRunId(run.getExternalRunId())
                .displayName(run.getDisplayName())
                .chainOfCustodyId(run.getChainOfCustodyId())
                .configFilePath(run.getConfigFilePath())
                .host(run.getHost())
                .infraHostId(run.getInfraHostId())
                .status(run.getStatus().getValue())
                .exitReason(run.getExitReason())
                .createdAt(run.getCreatedAt())
                .startedAt(run.getStartedAt())
                .endedAt(run.getEndedAt())
                .durationSeconds(run.getDurationSeconds())
                .durationFormatted(TimeUtils.formatDuration(run.getDurationSeconds()))
                .launchParameters(run.getLaunchParameters())
                .objectives(objectives.stream()
                        .map(RunQueryService::toObjectiveResponse)
                        .collect(Collectors.toList()))
                .config(parseJson(run.getRunId(), "config", run.getConfigJson()))
                .finalMetrics(parseJson(run.getRunId(), "final metrics", run.getFinalMetricsJson()))
                .history(parseJson(run.getRunId(), "history", run.getHistoryJson()))
                .externalUrl(run.getExternalUrl())
                .conversationS3Key(run.getConversationS3Key())
                .errorLogS3Key(run.getErrorLogS3Key())
                .crashReportS3Key(run.getCrashReportS3Key())
                .crashAnalysisS3Key(run.getCrashAnalysisS3Key())
                .blogPostUrl(run.getBlogPostUrl())
                .updatedAt(run.getUpdatedAt())
                .build();
    }

    private JsonNode parseJson(String runId, String label, String json) {
        if (json == null) return null;

        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            log.warn("Stored {} of run {} is not valid JSON", label, runId, e);
            return null;
        }
    }
}
