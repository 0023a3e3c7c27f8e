package com.company.trainingruns.domain;

import com.company.trainingruns.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Predicates for listing runs. Null fields are not applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunFilter {
    private RunStatus status;
    private String host;
    private String gradientMethod;
    private Double minDurationHours;
    private Instant createdAfter;
    private Boolean hasBlogPost;
    private Boolean hasCrashReport;
    private Boolean hasCrashAnalysis;

    public static RunFilter none() {
        return new RunFilter();
    }
}
