package com.company.trainingruns.domain;

import com.company.trainingruns.domain.enums.ObjectiveDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Per-run record of one scored objective. At most one per (runId, objectiveName).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunObjective implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String runId;

    private String objectiveName;   // e.g. COMT_activity
    private String objectiveAlias;  // e.g. COMT_activity_maximize, as keyed by the tracker
    private String uniprot;

    private Double weight;
    private ObjectiveDirection direction;

    private Double rawMean;
    private Double normalizedMean;
    private Double rawStd;
    private Double normalizedStd;

    private Instant createdAt;
    private Instant updatedAt;
}
