package com.company.trainingruns.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Aggregate of one objective over all runs sharing a gradient method.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GradientMethodComparison implements Serializable {
    private static final long serialVersionUID = 1L;

    private String gradientMethod;
    private long count;
    private Double avg;
    private Double best;
    private Double worst;
    private Double avgDurationHours;
}
