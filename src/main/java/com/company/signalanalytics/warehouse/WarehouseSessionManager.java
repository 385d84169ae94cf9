package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.enums.SessionState;
import com.company.signalanalytics.exception.WarehouseUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single process-wide warehouse session.
 * <p>
 * The session is opened lazily by the first caller. While one thread is
 * CONNECTING, everybody else waits on the state condition and then reuses
 * the session it produced; a failed attempt is reported to the waiters of
 * that attempt instead of each of them dialing again. Invalidation moves a
 * live session to EXPIRED, and the next {@link #acquire()} reconnects.
 * <p>
 * An expired session is retired rather than closed: statements still running
 * on it keep their connection, and it is closed when the last lease of its
 * generation is released.
 */
@Component
@Slf4j
public class WarehouseSessionManager implements DisposableBean {

    public static final String CONNECT_RETRY_NAME = "warehouseConnect";

    private final WarehouseConnector connector;
    private final Retry connectRetry;
    private final MeterRegistry meterRegistry;
    private final Duration connectWaitTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private final Map<Long, Integer> leasesByGeneration = new HashMap<>();
    private final Map<Long, WarehouseSession> retired = new HashMap<>();

    private SessionState state = SessionState.DISCONNECTED;
    private WarehouseSession session;
    private long generation;
    private long connectAttempt;
    private RuntimeException lastConnectFailure;

    public WarehouseSessionManager(WarehouseConnector connector,
                                   RetryRegistry retryRegistry,
                                   MeterRegistry meterRegistry,
                                   SignalAnalyticsProperties properties) {
        this.connector = connector;
        this.connectRetry = retryRegistry.retry(CONNECT_RETRY_NAME);
        this.meterRegistry = meterRegistry;
        this.connectWaitTimeout = properties.getWarehouse().getConnectWaitTimeout();
        this.connectRetry.getEventPublisher().onRetry(event ->
                log.warn("Warehouse connect attempt {} failed, retrying in {} ms",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
    }

    public WarehouseSessionLease acquire() {
        long attempt;
        lock.lock();
        try {
            long remainingNanos = connectWaitTimeout.toNanos();
            while (state == SessionState.CONNECTING) {
                long waitingFor = connectAttempt;
                if (remainingNanos <= 0L) {
                    throw new WarehouseUnavailableException("Timed out waiting for warehouse session");
                }
                try {
                    remainingNanos = stateChanged.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new WarehouseUnavailableException("Interrupted waiting for warehouse session", e);
                }
                if (state == SessionState.DISCONNECTED && connectAttempt != waitingFor && lastConnectFailure != null) {
                    throw new WarehouseUnavailableException("Warehouse unavailable", lastConnectFailure);
                }
            }
            if (state == SessionState.CONNECTED) {
                return lease();
            }
            log.info("Warehouse session {}, connecting", state);
            state = SessionState.CONNECTING;
            attempt = connectAttempt;
        } finally {
            lock.unlock();
        }
        return connect(attempt);
    }

    private WarehouseSessionLease connect(long attempt) {
        WarehouseSession opened;
        try {
            opened = connectRetry.executeSupplier(connector::open);
        } catch (RuntimeException e) {
            meterRegistry.counter("warehouse.connect.failures").increment();
            log.error("Unable to establish warehouse session", e);
            lock.lock();
            try {
                state = SessionState.DISCONNECTED;
                lastConnectFailure = e;
                connectAttempt = attempt + 1;
                stateChanged.signalAll();
            } finally {
                lock.unlock();
            }
            throw new WarehouseUnavailableException("Warehouse unavailable", e);
        }

        lock.lock();
        try {
            session = opened;
            generation++;
            state = SessionState.CONNECTED;
            lastConnectFailure = null;
            connectAttempt = attempt + 1;
            stateChanged.signalAll();
            log.info("Warehouse session established (generation {})", generation);
            return lease();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private WarehouseSessionLease lease() {
        leasesByGeneration.merge(generation, 1, Integer::sum);
        return new WarehouseSessionLease(session, generation);
    }

    /**
     * Returns a lease. Releasing the last lease of a retired generation
     * closes that generation's session.
     */
    public void release(WarehouseSessionLease lease) {
        if (lease == null) {
            return;
        }
        WarehouseSession drained = null;
        lock.lock();
        try {
            Integer remaining = leasesByGeneration.computeIfPresent(lease.getGeneration(),
                    (gen, count) -> count > 1 ? count - 1 : null);
            if (remaining == null) {
                drained = retired.remove(lease.getGeneration());
            }
        } finally {
            lock.unlock();
        }
        if (drained != null) {
            log.info("Last statement on expired session generation {} finished, closing it", lease.getGeneration());
        }
        closeQuietly(drained);
    }

    /**
     * Marks the lease's session as expired. A lease from an older generation
     * is ignored: its session has already been retired. The expired session
     * is closed at once only when no lease of its generation is outstanding.
     */
    public void invalidate(WarehouseSessionLease lease) {
        WarehouseSession idle = null;
        lock.lock();
        try {
            if (state == SessionState.CONNECTED && lease.getGeneration() == generation) {
                state = SessionState.EXPIRED;
                if (leasesByGeneration.containsKey(generation)) {
                    retired.put(generation, session);
                    log.warn("Warehouse session generation {} invalidated, {} statements still running",
                            generation, leasesByGeneration.get(generation));
                } else {
                    idle = session;
                    log.warn("Warehouse session generation {} invalidated", generation);
                }
                session = null;
            }
        } finally {
            lock.unlock();
        }
        closeQuietly(idle);
    }

    public SessionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getActiveLeases() {
        lock.lock();
        try {
            int active = 0;
            for (int count : leasesByGeneration.values()) {
                active += count;
            }
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void destroy() {
        List<WarehouseSession> open = new ArrayList<>();
        lock.lock();
        try {
            if (session != null) {
                open.add(session);
            }
            open.addAll(retired.values());
            retired.clear();
            leasesByGeneration.clear();
            session = null;
            state = SessionState.DISCONNECTED;
        } finally {
            lock.unlock();
        }
        open.forEach(this::closeQuietly);
    }

    private void closeQuietly(WarehouseSession expired) {
        if (expired == null) {
            return;
        }
        try {
            expired.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close warehouse session", e);
        }
    }
}
