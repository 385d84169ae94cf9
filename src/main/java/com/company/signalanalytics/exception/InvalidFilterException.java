package com.company.signalanalytics.exception;

import lombok.Getter;

/**
 * Request parameter that cannot be turned into a filter. Raised instead of
 * silently dropping or widening the filter.
 */
@Getter
public class InvalidFilterException extends RuntimeException {

    private final String parameter;

    public InvalidFilterException(String parameter, String value, String reason) {
        super("Invalid value for " + parameter + ": '" + value + "' (" + reason + ")");
        this.parameter = parameter;
    }
}
