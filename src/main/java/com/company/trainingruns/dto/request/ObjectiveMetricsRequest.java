package com.company.trainingruns.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metric values to write. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveMetricsRequest {
    private Double rawMean;
    private Double normalizedMean;
    private Double rawStd;
    private Double normalizedStd;
}
