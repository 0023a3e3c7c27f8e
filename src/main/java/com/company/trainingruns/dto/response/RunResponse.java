package com.company.trainingruns.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * List view of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResponse {
    private String runId;
    private String externalRunId;
    private String displayName;
    private String host;
    private String status;
    private String exitReason;
    private String gradientMethod;
    private Instant createdAt;
    private Instant startedAt;
    private Instant endedAt;
    private Integer durationSeconds;
    private String durationFormatted;
    private String externalUrl;
    private String blogPostUrl;
}
