package com.company.trainingruns.domain;

import com.company.trainingruns.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * One launched training job, keyed by the launcher-assigned run id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingRun implements Serializable {
    private static final long serialVersionUID = 1L;

    // Identity
    private String runId;
    private String externalRunId;
    private String displayName;
    private String chainOfCustodyId;

    // Launch metadata
    private String configFilePath;
    private String host; // label such as ec2 or expanse
    private String infraHostId;

    // Lifecycle
    private RunStatus status;
    private String exitReason;
    private Instant createdAt;
    private Instant startedAt;
    private Instant endedAt;
    private Integer durationSeconds;

    private LaunchParameters launchParameters;

    // JSON documents, stored verbatim
    private String configJson;
    private String finalMetricsJson;
    private String historyJson;

    // Attachments
    private String externalUrl;
    private String conversationS3Key;
    private String errorLogS3Key;
    private String crashReportS3Key;
    private String crashAnalysisS3Key;
    private String blogPostUrl;

    private Instant updatedAt;

    public boolean hasExternalRunId() {
        return externalRunId != null && !externalRunId.isBlank();
    }

    public boolean hasDisplayName() {
        return displayName != null && !displayName.isBlank();
    }

    public boolean hasInfraHostId() {
        return infraHostId != null && !infraHostId.isBlank();
    }
}
