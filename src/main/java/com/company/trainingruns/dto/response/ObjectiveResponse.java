package com.company.trainingruns.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveResponse {
    private String objectiveName;
    private String objectiveAlias;
    private String uniprot;
    private Double weight;
    private String direction;
    private Double rawMean;
    private Double normalizedMean;
    private Double rawStd;
    private Double normalizedStd;
    private Instant updatedAt;
}
