package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.WarehouseErrorKind;
import com.company.signalanalytics.exception.QueryExecutionException;
import com.company.signalanalytics.exception.WarehouseAccessException;
import com.company.signalanalytics.exception.WarehouseUnavailableException;
import com.company.signalanalytics.query.RenderedQuery;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Runs rendered queries on the shared session.
 * <p>
 * An expired session is invalidated and the failed statement alone is
 * retried once on a fresh session. Connectivity failures surface as
 * {@link WarehouseUnavailableException}; anything else is a
 * {@link QueryExecutionException} whose message carries no driver detail.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WarehouseQueryExecutor {

    private final WarehouseSessionManager sessionManager;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    public Table execute(String queryName, RenderedQuery query) {
        Span span = tracer.spanBuilder("warehouse.query")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("query.name", queryName);
            span.setAttribute("query.params", query.getParams().size());

            Table result = executeWithAuthRetry(queryName, query);
            span.setAttribute("query.rows", result.rowCount());
            return result;

        } catch (RuntimeException e) {
            outcome = e instanceof WarehouseUnavailableException ? "unavailable" : "error";
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("warehouse.query", "query", queryName, "outcome", outcome));
            span.end();
        }
    }

    private Table executeWithAuthRetry(String queryName, RenderedQuery query) {
        WarehouseSessionLease lease = sessionManager.acquire();
        try {
            return lease.getSession().execute(query);
        } catch (WarehouseAccessException e) {
            if (e.getKind() != WarehouseErrorKind.AUTH_EXPIRED) {
                throw translate(queryName, query, lease, e);
            }
            log.warn("Warehouse session expired during {}, reconnecting and retrying once", queryName);
            meterRegistry.counter("warehouse.query.auth_retry", "query", queryName).increment();
            sessionManager.invalidate(lease);
        } finally {
            sessionManager.release(lease);
        }
        return retryOnce(queryName, query);
    }

    private Table retryOnce(String queryName, RenderedQuery query) {
        WarehouseSessionLease lease = sessionManager.acquire();
        try {
            return lease.getSession().execute(query);
        } catch (WarehouseAccessException e) {
            if (e.getKind() == WarehouseErrorKind.AUTH_EXPIRED) {
                sessionManager.invalidate(lease);
                log.error("Warehouse session expired again on retry of {}", queryName, e);
                throw new WarehouseUnavailableException("Warehouse authentication could not be renewed", e);
            }
            throw translate(queryName, query, lease, e);
        } finally {
            sessionManager.release(lease);
        }
    }

    private RuntimeException translate(String queryName, RenderedQuery query,
                                       WarehouseSessionLease lease, WarehouseAccessException e) {
        if (e.getKind() == WarehouseErrorKind.CONNECTIVITY) {
            sessionManager.invalidate(lease);
            log.error("Lost warehouse connection during {}", queryName, e);
            return new WarehouseUnavailableException("Warehouse connection lost", e);
        }
        String correlationId = UUID.randomUUID().toString();
        log.error("Query {} failed [ref={}]\n{}\nparams={}", queryName, correlationId,
                query.getSql(), query.getParams(), e);
        // driver detail stays in the log
        return new QueryExecutionException(queryName, correlationId);
    }
}
