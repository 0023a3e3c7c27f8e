package com.company.trainingruns.domain;

import com.company.trainingruns.domain.enums.ObjectiveMetric;
import com.company.trainingruns.domain.enums.RunSortOrder;
import com.company.trainingruns.domain.enums.RunStatus;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed description of a multi-objective run search: every named objective must
 * fall within its bounds for a run to match.
 */
@Getter
public final class ObjectiveQuery {

    public static final int DEFAULT_LIMIT = 100;

    private final Map<String, ObjectiveBound> objectiveBounds;
    private final ObjectiveMetric metric;
    private final String gradientMethod;
    private final RunStatus status;
    private final String host;
    private final RunSortOrder order;
    private final int limit;

    private ObjectiveQuery(Builder builder) {
        this.objectiveBounds = Collections.unmodifiableMap(new LinkedHashMap<>(builder.objectiveBounds));
        this.metric = builder.metric;
        this.gradientMethod = builder.gradientMethod;
        this.status = builder.status;
        this.host = builder.host;
        this.order = builder.order;
        this.limit = builder.limit;
    }

    public boolean hasObjectives() {
        return !objectiveBounds.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ObjectiveBound> objectiveBounds = new LinkedHashMap<>();
        private ObjectiveMetric metric = ObjectiveMetric.RAW_MEAN;
        private String gradientMethod;
        private RunStatus status;
        private String host;
        private RunSortOrder order = RunSortOrder.CREATED_AT_DESC;
        private int limit = DEFAULT_LIMIT;

        private Builder() {
        }

        public Builder objective(String objectiveName, ObjectiveBound bound) {
            Objects.requireNonNull(objectiveName, "objectiveName");
            objectiveBounds.put(objectiveName, bound != null ? bound : new ObjectiveBound(null, null));
            return this;
        }

        public Builder objectives(Map<String, ObjectiveBound> bounds) {
            if (bounds != null) {
                bounds.forEach(this::objective);
            }
            return this;
        }

        public Builder metric(ObjectiveMetric metric) {
            this.metric = metric != null ? metric : ObjectiveMetric.RAW_MEAN;
            return this;
        }

        public Builder gradientMethod(String gradientMethod) {
            this.gradientMethod = gradientMethod;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder order(RunSortOrder order) {
            this.order = order != null ? order : RunSortOrder.CREATED_AT_DESC;
            return this;
        }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            this.limit = limit;
            return this;
        }

        public ObjectiveQuery build() {
            return new ObjectiveQuery(this);
        }
    }
}
