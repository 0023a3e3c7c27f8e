package com.company.trainingruns.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Hyperparameters lifted out of the launch config into queryable columns.
 * A null field means the config did not set it; it is never defaulted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LaunchParameters implements Serializable {
    private static final long serialVersionUID = 1L;

    // training
    private Integer batchSize;
    private Double learningRate;
    private Integer gradientAccumulationSteps;
    private Integer maxSteps;
    private Double maxGradNorm;
    private Integer numGpus;
    private Boolean mixedPrecision;
    private Boolean gradientCheckpointing;
    private Boolean fp16;
    private Boolean bf16;

    // reward
    private String gradientMethod;
    private Double beta;
    private Boolean enableMovingTargets;

    // grouping
    private Boolean returnGroups;
    private Integer clusterCount;

    private Integer numObjectives;
    private Integer numScaffolds;
}
