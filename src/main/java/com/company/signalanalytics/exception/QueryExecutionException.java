package com.company.signalanalytics.exception;

import lombok.Getter;

/**
 * A statement failed inside the warehouse. The message is safe to show to
 * clients; the driver error and query text are only logged, under the
 * correlation id carried here.
 */
@Getter
public class QueryExecutionException extends RuntimeException {

    private final String queryName;
    private final String correlationId;

    public QueryExecutionException(String queryName, String correlationId) {
        super("Query " + queryName + " failed (reference " + correlationId + ")");
        this.queryName = queryName;
        this.correlationId = correlationId;
    }
}
