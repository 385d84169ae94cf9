package com.company.signalanalytics.config;

import com.company.signalanalytics.domain.enums.SessionState;
import com.company.signalanalytics.repository.GeometryRepository;
import com.company.signalanalytics.warehouse.WarehouseSessionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsConfigurationTest {

    @Mock
    private WarehouseSessionManager sessionManager;

    @Mock
    private GeometryRepository geometryRepository;

    @Test
    void shouldReportSessionAndCacheGauges() {
        when(sessionManager.getState()).thenReturn(SessionState.CONNECTED);
        when(sessionManager.getActiveLeases()).thenReturn(3);
        when(geometryRepository.isLoaded()).thenReturn(false);

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new MetricsConfiguration(sessionManager, geometryRepository).warehouseMetrics().bindTo(registry);

        assertEquals(1.0, registry.get("warehouse.session.connected").gauge().value());
        assertEquals(3.0, registry.get("warehouse.session.leases").gauge().value());
        assertEquals(0.0, registry.get("geometry.cache.loaded").gauge().value());
    }
}
