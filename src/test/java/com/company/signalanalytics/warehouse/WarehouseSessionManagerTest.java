package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.enums.SessionState;
import com.company.signalanalytics.domain.enums.WarehouseErrorKind;
import com.company.signalanalytics.exception.WarehouseAccessException;
import com.company.signalanalytics.exception.WarehouseUnavailableException;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WarehouseSessionManagerTest {

    @Mock
    private WarehouseConnector connector;

    @Mock
    private WarehouseSession firstSession;

    @Mock
    private WarehouseSession secondSession;

    private SimpleMeterRegistry meterRegistry;
    private WarehouseSessionManager manager;

    @BeforeEach
    void setUp() {
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(new ConnectivityFailurePredicate())
                .build());
        meterRegistry = new SimpleMeterRegistry();
        manager = new WarehouseSessionManager(connector, retryRegistry, meterRegistry, new SignalAnalyticsProperties());
    }

    @Test
    void shouldConnectOnceForConcurrentCallers() throws Exception {
        when(connector.open()).thenAnswer(invocation -> {
            Thread.sleep(200);
            return firstSession;
        });

        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<WarehouseSessionLease>> leases = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                leases.add(executor.submit(() -> {
                    start.await();
                    return manager.acquire();
                }));
            }
            start.countDown();

            for (Future<WarehouseSessionLease> lease : leases) {
                WarehouseSessionLease acquired = lease.get(5, TimeUnit.SECONDS);
                assertSame(firstSession, acquired.getSession());
                assertEquals(1L, acquired.getGeneration());
            }
        } finally {
            executor.shutdownNow();
        }

        verify(connector, times(1)).open();
        assertEquals(SessionState.CONNECTED, manager.getState());
        assertEquals(callers, manager.getActiveLeases());
    }

    @Test
    void shouldRetryConnectivityFailuresBeforeGivingUp() {
        WarehouseAccessException unreachable =
                new WarehouseAccessException(WarehouseErrorKind.CONNECTIVITY, "unreachable", null);
        when(connector.open()).thenThrow(unreachable).thenThrow(unreachable).thenReturn(firstSession);

        WarehouseSessionLease lease = manager.acquire();

        assertSame(firstSession, lease.getSession());
        verify(connector, times(3)).open();
    }

    @Test
    void shouldReportUnavailableWhenRetriesAreExhausted() {
        when(connector.open()).thenThrow(
                new WarehouseAccessException(WarehouseErrorKind.CONNECTIVITY, "unreachable", null));

        assertThrows(WarehouseUnavailableException.class, () -> manager.acquire());

        verify(connector, times(3)).open();
        assertEquals(SessionState.DISCONNECTED, manager.getState());
        assertEquals(1.0, meterRegistry.counter("warehouse.connect.failures").count());
    }

    @Test
    void shouldNotRetryRejectedCredentials() {
        when(connector.open()).thenThrow(
                new WarehouseAccessException(WarehouseErrorKind.AUTH_EXPIRED, "bad credentials", null));

        assertThrows(WarehouseUnavailableException.class, () -> manager.acquire());

        verify(connector, times(1)).open();
    }

    @Test
    void shouldReconnectAfterInvalidation() {
        when(connector.open()).thenReturn(firstSession, secondSession);

        WarehouseSessionLease first = manager.acquire();
        manager.release(first);
        manager.invalidate(first);

        assertEquals(SessionState.EXPIRED, manager.getState());
        verify(firstSession).close();

        WarehouseSessionLease second = manager.acquire();
        assertSame(secondSession, second.getSession());
        assertEquals(2L, second.getGeneration());
    }

    @Test
    void shouldKeepExpiredSessionOpenUntilRunningStatementsFinish() {
        when(connector.open()).thenReturn(firstSession, secondSession);

        WarehouseSessionLease detecting = manager.acquire();
        WarehouseSessionLease running = manager.acquire();
        manager.invalidate(detecting);

        assertEquals(SessionState.EXPIRED, manager.getState());
        assertEquals(2, manager.getActiveLeases());
        verify(firstSession, never()).close();

        manager.release(detecting);
        WarehouseSessionLease retry = manager.acquire();
        assertSame(secondSession, retry.getSession());
        verify(firstSession, never()).close();

        manager.release(running);
        verify(firstSession).close();
        verify(secondSession, never()).close();
        assertEquals(1, manager.getActiveLeases());
    }

    @Test
    void shouldCloseRetiredSessionsOnShutdown() {
        when(connector.open()).thenReturn(firstSession, secondSession);

        WarehouseSessionLease running = manager.acquire();
        manager.invalidate(running);
        manager.acquire();

        manager.destroy();

        verify(firstSession).close();
        verify(secondSession).close();
        assertEquals(0, manager.getActiveLeases());
    }

    @Test
    void shouldIgnoreInvalidationFromStaleLease() {
        when(connector.open()).thenReturn(firstSession, secondSession);

        WarehouseSessionLease stale = manager.acquire();
        manager.invalidate(stale);
        WarehouseSessionLease fresh = manager.acquire();

        manager.invalidate(stale);

        assertEquals(SessionState.CONNECTED, manager.getState());
        assertNotSame(stale.getSession(), fresh.getSession());
        verify(secondSession, never()).close();
    }

    @Test
    void shouldTrackLeasesAndCloseOnShutdown() {
        when(connector.open()).thenReturn(firstSession);

        WarehouseSessionLease a = manager.acquire();
        WarehouseSessionLease b = manager.acquire();
        assertEquals(2, manager.getActiveLeases());

        manager.release(a);
        manager.release(b);
        manager.destroy();

        assertEquals(0, manager.getActiveLeases());
        assertEquals(SessionState.DISCONNECTED, manager.getState());
        verify(firstSession).close();
    }
}
