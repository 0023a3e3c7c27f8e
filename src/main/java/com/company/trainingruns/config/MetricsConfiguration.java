package com.company.trainingruns.config;

import com.company.trainingruns.domain.enums.RunStatus;
import com.company.trainingruns.repository.TrainingRunRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Run lifecycle gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final TrainingRunRepository runRepository;

    @Bean
    public MeterBinder trainingRunMetrics(MeterRegistry registry) {
        return (reg) -> {
            for (RunStatus status : new RunStatus[]{RunStatus.LAUNCHED, RunStatus.RUNNING}) {
                Gauge.builder("training.runs.active", runRepository, repo -> {
                            try {
                                return repo.countByStatus(status);
                            } catch (Exception e) {
                                log.warn("Failed to count {} runs", status.getValue(), e);
                                return 0;
                            }
                        })
                        .tag("status", status.getValue())
                        .description("Number of runs not yet stopped, by status")
                        .register(reg);
            }

            log.info("Training run metrics registered");
        };
    }
}
