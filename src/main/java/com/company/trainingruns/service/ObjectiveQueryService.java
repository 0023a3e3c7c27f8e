package com.company.trainingruns.service;

import com.company.trainingruns.config.RedisCacheConfig;
import com.company.trainingruns.domain.GradientMethodComparison;
import com.company.trainingruns.domain.ObjectiveBound;
import com.company.trainingruns.domain.ObjectiveQuery;
import com.company.trainingruns.domain.ObjectiveStatistics;
import com.company.trainingruns.domain.enums.ObjectiveMetric;
import com.company.trainingruns.domain.enums.RunSortOrder;
import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.dto.request.ObjectiveQueryRequest;
import com.company.trainingruns.dto.response.RunResponse;
import com.company.trainingruns.repository.ObjectiveQueryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class ObjectiveQueryService {

    private final ObjectiveQueryRepository queryRepository;
    private final MeterRegistry meterRegistry;

    /**
     * Runs meeting every objective bound. A query without objective bounds matches
     * nothing rather than the whole table.
     */
    public List<RunResponse> query(ObjectiveQuery query) {
        if (!query.hasObjectives()) {
            log.debug("Objective query without objective bounds, returning no runs");
            return Collections.emptyList();
        }

        meterRegistry.counter("training.objectives.queries",
                "objectives", String.valueOf(query.getObjectiveBounds().size())
        ).increment();

        return queryRepository.findByObjectives(query).stream()
                .map(RunQueryService::toRunResponse)
                .collect(Collectors.toList());
    }

    @Cacheable(value = RedisCacheConfig.OBJECTIVE_STATISTICS,
            key = "#objectiveName + ':' + #gradientMethod + ':' + #status")
    public ObjectiveStatistics getStatistics(String objectiveName, String gradientMethod, RunStatus status) {
        return queryRepository.getStatistics(objectiveName, gradientMethod, status);
    }

    @Cacheable(value = RedisCacheConfig.GRADIENT_COMPARISON, key = "#objectiveName + ':' + #status")
    public List<GradientMethodComparison> compareGradientMethods(String objectiveName, RunStatus status) {
        return queryRepository.compareGradientMethods(objectiveName, status);
    }

    /**
     * Translate an API request into a typed query. Unknown metric, order or status
     * names are rejected with {@link IllegalArgumentException}.
     */
    public ObjectiveQuery toQuery(ObjectiveQueryRequest request) {
        ObjectiveQuery.Builder builder = ObjectiveQuery.builder()
                .gradientMethod(request.getGradientMethod())
                .host(request.getHost());

        if (request.getObjectives() != null) {
            request.getObjectives().forEach((name, bound) -> builder.objective(name,
                    bound != null ? new ObjectiveBound(bound.getMin(), bound.getMax()) : null));
        }
        if (request.getMetric() != null) {
            builder.metric(ObjectiveMetric.fromKey(request.getMetric().toLowerCase(Locale.ROOT))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + request.getMetric())));
        }
        if (request.getOrder() != null) {
            builder.order(RunSortOrder.valueOf(request.getOrder().toUpperCase(Locale.ROOT)));
        }
        if (request.getStatus() != null) {
            builder.status(RunStatus.fromDatabase(request.getStatus()));
        }
        if (request.getLimit() != null) {
            builder.limit(request.getLimit());
        }
        return builder.build();
    }
}
