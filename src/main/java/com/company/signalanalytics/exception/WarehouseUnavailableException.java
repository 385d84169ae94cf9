package com.company.signalanalytics.exception;

/**
 * The warehouse could not be reached or re-authenticated after retrying.
 * Callers may retry the request later.
 */
public class WarehouseUnavailableException extends RuntimeException {

    public WarehouseUnavailableException(String message) {
        super(message);
    }

    public WarehouseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
