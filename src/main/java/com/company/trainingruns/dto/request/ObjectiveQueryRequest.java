package com.company.trainingruns.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveQueryRequest {

    @Builder.Default
    private Map<String, Bound> objectives = new LinkedHashMap<>();

    private String metric;          // raw_mean (default), normalized_mean, raw_std, normalized_std
    private String gradientMethod;
    private String status;
    private String host;
    private String order;           // CREATED_AT_DESC (default), CREATED_AT_ASC, DURATION_DESC, DURATION_ASC

    @Min(1)
    @Max(1000)
    @Builder.Default
    private Integer limit = 100;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bound {
        private Double min;
        private Double max;
    }
}
