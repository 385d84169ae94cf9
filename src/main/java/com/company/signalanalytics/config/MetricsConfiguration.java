package com.company.signalanalytics.config;

import com.company.signalanalytics.domain.enums.SessionState;
import com.company.signalanalytics.repository.GeometryRepository;
import com.company.signalanalytics.warehouse.WarehouseSessionManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final WarehouseSessionManager sessionManager;
    private final GeometryRepository geometryRepository;

    @Bean
    public MeterBinder warehouseMetrics() {
        return (reg) -> {
            // 1 while connected, 0 otherwise
            Gauge.builder("warehouse.session.connected", sessionManager,
                            manager -> manager.getState() == SessionState.CONNECTED ? 1 : 0)
                    .description("Whether the shared warehouse session is established")
                    .register(reg);

            Gauge.builder("warehouse.session.leases", sessionManager, WarehouseSessionManager::getActiveLeases)
                    .description("Queries currently holding the warehouse session")
                    .register(reg);

            Gauge.builder("geometry.cache.loaded", geometryRepository, repo -> repo.isLoaded() ? 1 : 0)
                    .description("Whether segment geometry is cached")
                    .register(reg);

            log.info("Warehouse metrics registered");
        };
    }
}
