package com.company.trainingruns.dto.response;

import com.company.trainingruns.domain.LaunchParameters;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunDetailResponse {
    private String runId;
    private String externalRunId;
    private String displayName;
    private String chainOfCustodyId;
    private String configFilePath;
    private String host;
    private String infraHostId;

    private String status;
    private String exitReason;
    private Instant createdAt;
    private Instant startedAt;
    private Instant endedAt;
    private Integer durationSeconds;
    private String durationFormatted;

    private LaunchParameters launchParameters;
    private List<ObjectiveResponse> objectives;

    private JsonNode config;
    private JsonNode finalMetrics;
    private JsonNode history;

    private String externalUrl;
    private String conversationS3Key;
    private String errorLogS3Key;
    private String crashReportS3Key;
    private String crashAnalysisS3Key;
    private String blogPostUrl;

    private Instant updatedAt;
}
