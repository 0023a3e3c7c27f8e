package com.company.trainingruns.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveStatistics implements Serializable {
    private static final long serialVersionUID = 1L;

    private String objectiveName;
    private long count;
    private Double mean;
    private Double min;
    private Double max;
    private Double avgStd;
}
