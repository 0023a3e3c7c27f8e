package com.company.trainingruns.domain;

import lombok.Value;

/**
 * Inclusive numeric bounds for one objective. Either side may be open.
 */
@Value
public class ObjectiveBound {
    Double min;
    Double max;

    public ObjectiveBound(Double min, Double max) {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min " + min + " is greater than max " + max);
        }
        this.min = min;
        this.max = max;
    }

    public static ObjectiveBound atLeast(double min) {
        return new ObjectiveBound(min, null);
    }

    public static ObjectiveBound atMost(double max) {
        return new ObjectiveBound(null, max);
    }

    public static ObjectiveBound between(double min, double max) {
        return new ObjectiveBound(min, max);
    }

    public boolean isOpen() {
        return min == null && max == null;
    }
}
