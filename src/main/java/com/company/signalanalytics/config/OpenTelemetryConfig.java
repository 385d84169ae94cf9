package com.company.signalanalytics.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Tracing for warehouse round trips. Exporters are off unless the usual
 * OTEL_* environment variables switch them on.
 */
@Configuration
@Slf4j
public class OpenTelemetryConfig {

    static final String INSTRUMENTATION_NAME = "signal-analytics-warehouse";

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry(@Value("${spring.application.name}") String serviceName) {
        log.info("Initializing OpenTelemetry SDK for {}", serviceName);
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> Map.of(
                        "otel.service.name", serviceName,
                        "otel.traces.exporter", "none",
                        "otel.metrics.exporter", "none",
                        "otel.logs.exporter", "none"))
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer warehouseTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }
}
