package com.company.trainingruns.domain.enums;

import java.util.Optional;

/**
 * Metric columns of an objective record. Column names are fixed here and never
 * taken from caller input.
 */
public enum ObjectiveMetric {
    RAW_MEAN("raw_mean"),
    NORMALIZED_MEAN("normalized_mean"),
    RAW_STD("raw_std"),
    NORMALIZED_STD("normalized_std");

    private final String column;

    ObjectiveMetric(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    public static Optional<ObjectiveMetric> fromKey(String key) {
        for (ObjectiveMetric metric : values()) {
            if (metric.column.equals(key)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
