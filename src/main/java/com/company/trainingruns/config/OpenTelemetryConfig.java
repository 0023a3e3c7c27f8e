package com.company.trainingruns.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Tracing for reconciliation passes. Exporters default to none so a local run needs
 * no collector; OTEL_* environment variables still take precedence.
 */
@Configuration
public class OpenTelemetryConfig {

    static final String INSTRUMENTATION_NAME = "training-run-service";

    @Bean
    public OpenTelemetry openTelemetry(
            @Value("${spring.application.name:training-run-service}") String serviceName,
            @Value("${training-runs.tracing.exporter:none}") String tracesExporter) {
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> {
                    Map<String, String> defaults = new HashMap<>();
                    defaults.put("otel.service.name", serviceName);
                    defaults.put("otel.traces.exporter", tracesExporter);
                    defaults.put("otel.metrics.exporter", "none");
                    defaults.put("otel.logs.exporter", "none");
                    return defaults;
                })
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }
}
